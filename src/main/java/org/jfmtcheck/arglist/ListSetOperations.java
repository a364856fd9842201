package org.jfmtcheck.arglist;

import java.util.Objects;
import java.util.Optional;

/**
 * Intersection, union and comparison of constraint lists.
 */
public final class ListSetOperations {
    private ListSetOperations() {}

    /**
     * Combines the constraints of two elements. The inputs are left untouched; nested lists in the result are
     * fresh copies.
     *
     * @return the combined element with the given repeat count, or empty if no value satisfies both
     */
    public static Optional<ConstraintElement> intersectElements(
            final ConstraintElement first, final ConstraintElement second, final int repeatCount) {
        final ArgPresence presence = ArgPresence.combine(first.presence(), second.presence());
        final int type;
        ConstraintList nested = null;

        if (first.type() == ArgType.ANY) {
            type = second.type();
            if (second.isElementwise()) {
                nested = second.elementwise().copy();
            }
        } else if (second.type() == ArgType.ANY) {
            type = first.type();
            if (first.isElementwise()) {
                nested = first.elementwise().copy();
            }
        } else if (first.isElementwise() && second.isElementwise()) {
            if (first.type() != second.type()
                    || (first.type() != ArgType.ELEMENTWISE_1 && first.type() != ArgType.ELEMENTWISE_2)) {
                return Optional.empty();
            }
            type = first.type();
            final ListOutcome combined = intersect(first.elementwise().copy(), second.elementwise().copy());
            if (combined.isContradiction()) {
                return Optional.empty();
            }
            nested = combined.list();
        } else {
            final int common = first.type() & second.type();
            if (common == ArgType.NONE) {
                return Optional.empty();
            }
            if (first.isElementwise()) {
                type = common | ArgType.ELEMENTWISE;
                nested = first.elementwise().copy();
            } else if (second.isElementwise()) {
                type = common | ArgType.ELEMENTWISE;
                nested = second.elementwise().copy();
            } else {
                type = common;
            }
        }
        return Optional.of(new ConstraintElement(repeatCount, presence, type, nested));
    }

    /**
     * Creates the list of combined constraints. Both arguments are consumed.
     */
    public static ListOutcome intersect(final ConstraintList list1, final ConstraintList list2) {
        Objects.requireNonNull(list1, "list1");
        Objects.requireNonNull(list2, "list2");

        if (!list1.isFinite() && !list2.isFinite()) {
            final int n1 = list1.repeated().length();
            final int n2 = list2.repeated().length();
            final int g = gcd(n1, n2);
            ListAlgebra.unfoldLoop(list1, n2 / g);
            ListAlgebra.unfoldLoop(list2, n1 / g);
        }
        if (!list1.isFinite() || !list2.isFinite()) {
            final int m = Math.max(list1.initial().length(), list2.initial().length());
            if (!list1.isFinite()) {
                ListAlgebra.rotateLoop(list1, m);
            }
            if (!list2.isFinite()) {
                ListAlgebra.rotateLoop(list2, m);
            }
        }

        final ConstraintList result = ConstraintList.empty();

        final Cursor c1 = new Cursor(list1.initial());
        final Cursor c2 = new Cursor(list2.initial());
        while (!c1.exhausted() && !c2.exhausted()) {
            final int repeatCount = Math.min(c1.remaining(), c2.remaining());
            final Optional<ConstraintElement> combined =
                    intersectElements(c1.current(), c2.current(), repeatCount);
            if (combined.isEmpty()) {
                // An optional position lets the result end here.
                if (ArgPresence.combine(c1.current().presence(), c2.current().presence()) == ArgPresence.REQUIRED) {
                    return finish(ListConstraints.backtrackInInitial(result));
                }
                return finish(ListOutcome.of(result));
            }
            result.initial().add(combined.get());
            c1.advance(repeatCount);
            c2.advance(repeatCount);
        }

        if (list1.isFinite() && list2.isFinite()) {
            final Cursor longer = c1.exhausted() ? c2 : c1;
            if (!longer.exhausted() && longer.current().presence() == ArgPresence.REQUIRED) {
                return finish(ListConstraints.backtrackInInitial(result));
            }
            return finish(ListOutcome.of(result));
        }
        if (list1.isFinite() || list2.isFinite()) {
            final Cursor infiniteCursor = list1.isFinite() ? c2 : c1;
            final ConstraintList infinite = list1.isFinite() ? list2 : list1;
            final ArgPresence next = infiniteCursor.exhausted()
                    ? infinite.repeated().get(0).presence()
                    : infiniteCursor.current().presence();
            if (next == ArgPresence.REQUIRED) {
                return finish(ListConstraints.backtrackInInitial(result));
            }
            return finish(ListOutcome.of(result));
        }

        final Cursor r1 = new Cursor(list1.repeated());
        final Cursor r2 = new Cursor(list2.repeated());
        while (!r1.exhausted() && !r2.exhausted()) {
            final int repeatCount = Math.min(r1.remaining(), r2.remaining());
            final Optional<ConstraintElement> combined =
                    intersectElements(r1.current(), r2.current(), repeatCount);
            if (combined.isEmpty()) {
                final boolean required = ArgPresence.combine(
                        r1.current().presence(), r2.current().presence()) == ArgPresence.REQUIRED;
                ListAlgebra.appendRepeatedToInitial(result);
                if (required) {
                    return finish(ListConstraints.backtrackInInitial(result));
                }
                return finish(ListOutcome.of(result));
            }
            result.repeated().add(combined.get());
            r1.advance(repeatCount);
            r2.advance(repeatCount);
        }
        return finish(ListOutcome.of(result));
    }

    /**
     * Intersection where either operand may already be a contradiction.
     */
    public static ListOutcome intersection(final ListOutcome first, final ListOutcome second) {
        if (first.isContradiction() || second.isContradiction()) {
            return ListOutcome.contradiction();
        }
        return intersect(first.list(), second.list());
    }

    /**
     * Intersects a list with the zero-length list. The argument is not modified.
     */
    public static ListOutcome intersectWithEmptyList(final ConstraintList list) {
        if (list.firstPresence() == ArgPresence.REQUIRED) {
            return ListOutcome.contradiction();
        }
        return ListOutcome.of(ConstraintList.empty());
    }

    /**
     * Creates the union of a list and the zero-length list, i.e. additionally allows the list to be empty.
     * The argument is consumed.
     */
    public static ConstraintList unionWithEmptyList(final ConstraintList list) {
        Objects.requireNonNull(list, "list");
        if (list.firstPresence() == ArgPresence.REQUIRED) {
            ListAlgebra.splitAtBoundary(list, 1);
            list.initial().get(0).presence(ArgPresence.OPTIONAL);
            // Element 0 may now equal element 1.
            ListAlgebra.normalizeOutermost(list);
        }
        return list;
    }

    /**
     * Tests whether two normalized lists are equivalent.
     */
    public static boolean equalLists(final ConstraintList list1, final ConstraintList list2) {
        return equalSegments(list1.initial(), list2.initial()) && equalSegments(list1.repeated(), list2.repeated());
    }

    private static boolean equalSegments(final Segment first, final Segment second) {
        if (first.count() != second.count()) {
            return false;
        }
        for (int i = 0; i < first.count(); i++) {
            final ConstraintElement e1 = first.get(i);
            final ConstraintElement e2 = second.get(i);
            if (e1.repeatCount() != e2.repeatCount() || !e1.sameConstraint(e2)) {
                return false;
            }
        }
        return true;
    }

    private static ListOutcome finish(final ListOutcome outcome) {
        return outcome.then(list -> {
            ListAlgebra.normalize(list);
            list.verify();
            return ListOutcome.of(list);
        });
    }

    static int gcd(final int a, final int b) {
        int x = a;
        int y = b;
        while (y != 0) {
            final int r = x % y;
            x = y;
            y = r;
        }
        return x;
    }

    /**
     * Walks the arguments of a segment without modifying it.
     */
    private static final class Cursor {
        private final Segment segment;
        private int index;
        private int remaining;

        private Cursor(final Segment segment) {
            this.segment = segment;
            this.index = 0;
            this.remaining = segment.isEmpty() ? 0 : segment.get(0).repeatCount();
        }

        boolean exhausted() {
            return index >= segment.count();
        }

        ConstraintElement current() {
            return segment.get(index);
        }

        int remaining() {
            return remaining;
        }

        void advance(final int amount) {
            remaining -= amount;
            if (remaining == 0) {
                index++;
                remaining = exhausted() ? 0 : segment.get(index).repeatCount();
            }
        }
    }
}
