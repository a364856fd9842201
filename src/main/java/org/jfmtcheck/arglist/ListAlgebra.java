package org.jfmtcheck.arglist;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structural operations on constraint lists: normalization and loop surgery.
 *
 * <p>All operations modify the given list in place.
 */
public final class ListAlgebra {
    /** Maximum depth of nested elementwise lists. */
    public static final int MAX_NESTING_DEPTH = 1000;

    private ListAlgebra() {}

    /**
     * Brings a list into canonical form, nested lists first. Two lists are equivalent iff their canonical forms
     * are structurally equal.
     *
     * @return the same list, for chaining
     * @throws ListNestingDepthException if nested lists are deeper than {@link #MAX_NESTING_DEPTH}
     */
    public static ConstraintList normalize(final ConstraintList list) {
        normalize(Objects.requireNonNull(list, "list"), 0);
        return list;
    }

    private static void normalize(final ConstraintList list, final int depth) {
        if (depth > MAX_NESTING_DEPTH) {
            throw new ListNestingDepthException(depth);
        }
        for (final ConstraintElement element : list.initial().elements()) {
            if (element.isElementwise()) {
                normalize(element.elementwise(), depth + 1);
            }
        }
        for (final ConstraintElement element : list.repeated().elements()) {
            if (element.isElementwise()) {
                normalize(element.elementwise(), depth + 1);
            }
        }
        normalizeOutermost(list);
    }

    /**
     * Normalizes the top level of a list, assuming all nested lists are already normalized.
     */
    static void normalizeOutermost(final ConstraintList list) {
        final Segment initial = list.initial();
        final Segment repeated = list.repeated();

        mergeAdjacent(initial);
        mergeAdjacent(repeated);

        if (repeated.isEmpty()) {
            return;
        }

        reduceLoopPeriod(repeated);
        if (repeated.count() == 1) {
            repeated.setRepeatCount(0, 1);
        }

        rollInitialIntoLoop(initial, repeated);
    }

    private static void mergeAdjacent(final Segment segment) {
        final List<ConstraintElement> merged = new ArrayList<>(segment.count());
        for (final ConstraintElement element : segment.elements()) {
            if (!merged.isEmpty()) {
                final ConstraintElement previous = merged.get(merged.size() - 1);
                if (previous.sameConstraint(element)) {
                    previous.repeatCount(previous.repeatCount() + element.repeatCount());
                    continue;
                }
            }
            merged.add(element);
        }
        segment.replaceWith(merged);
    }

    private static void reduceLoopPeriod(final Segment repeated) {
        int n = repeated.count();
        int firstExtra = 0;
        // A last element equal to the first one wraps around; treat it as part of element 0.
        if (n > 1 && repeated.get(0).sameConstraint(repeated.get(n - 1))) {
            firstExtra = repeated.get(n - 1).repeatCount();
            n--;
        }
        for (int m = 2; m <= n / 2; m++) {
            if (n % m != 0) {
                continue;
            }
            boolean periodic = true;
            for (int i = 0; i < n - m; i++) {
                final ConstraintElement current = repeated.get(i);
                final ConstraintElement shifted = repeated.get(i + m);
                final int expectedCount = current.repeatCount() + (i == 0 ? firstExtra : 0);
                if (expectedCount != shifted.repeatCount() || !current.sameConstraint(shifted)) {
                    periodic = false;
                    break;
                }
            }
            if (periodic) {
                final List<ConstraintElement> period = new ArrayList<>(repeated.elements().subList(0, m));
                if (n < repeated.count()) {
                    period.add(repeated.get(n));
                }
                repeated.replaceWith(period);
                return;
            }
        }
    }

    private static void rollInitialIntoLoop(final Segment initial, final Segment repeated) {
        if (repeated.count() == 1) {
            // The second-to-last initial element differs from the last one, so at most one element rolls.
            if (!initial.isEmpty() && initial.last().sameConstraint(repeated.get(0))) {
                initial.removeLast();
            }
            return;
        }
        while (!initial.isEmpty() && initial.last().sameConstraint(repeated.last())) {
            final int moved = Math.min(initial.last().repeatCount(), repeated.last().repeatCount());

            if (repeated.get(0).sameConstraint(repeated.last())) {
                repeated.setRepeatCount(0, repeated.get(0).repeatCount() + moved);
            } else {
                repeated.add(0, repeated.last().copyWithRepeatCount(moved));
            }

            shrinkLast(repeated, moved);
            shrinkLast(initial, moved);
        }
    }

    private static void shrinkLast(final Segment segment, final int amount) {
        final int remaining = segment.last().repeatCount() - amount;
        if (remaining == 0) {
            segment.removeLast();
        } else {
            segment.setRepeatCount(segment.count() - 1, remaining);
        }
    }

    /**
     * Replicates the loop segment so that it is {@code m} times as long.
     */
    public static void unfoldLoop(final ConstraintList list, final int m) {
        final Segment repeated = list.repeated();
        requireLoop(list);
        if (m < 1) {
            throw new IllegalArgumentException("unfold factor must be >= 1: " + m);
        }
        if (m == 1) {
            return;
        }
        final List<ConstraintElement> period = new ArrayList<>(repeated.elements());
        for (int k = 1; k < m; k++) {
            for (final ConstraintElement element : period) {
                repeated.add(element.copy());
            }
        }
    }

    /**
     * Grows the initial segment to exactly {@code m} arguments by moving loop iterations into it, rotating the
     * loop so that the list keeps its meaning.
     */
    public static void rotateLoop(final ConstraintList list, final int m) {
        final Segment initial = list.initial();
        final Segment repeated = list.repeated();
        requireLoop(list);
        if (m < initial.length()) {
            throw new IllegalArgumentException(
                    "cannot rotate to " + m + ", initial segment already has length " + initial.length());
        }
        if (m == initial.length()) {
            return;
        }

        if (repeated.count() == 1) {
            initial.add(repeated.get(0).copyWithRepeatCount(m - initial.length()));
            return;
        }

        final int n = repeated.length();
        final int q = (m - initial.length()) / n;
        final int r = (m - initial.length()) % n;

        // Elements 0..s-1 of the loop plus t arguments of element s make up r arguments.
        int s = 0;
        int t = r;
        while (s < repeated.count() && t >= repeated.get(s).repeatCount()) {
            t -= repeated.get(s).repeatCount();
            s++;
        }
        if (s >= repeated.count()) {
            throw new IllegalStateException("loop split point out of range");
        }

        for (int k = 0; k < q; k++) {
            for (final ConstraintElement element : repeated.elements()) {
                initial.add(element.copy());
            }
        }
        for (int j = 0; j < s; j++) {
            initial.add(repeated.get(j).copy());
        }
        if (t > 0) {
            initial.add(repeated.get(s).copyWithRepeatCount(t));
        }

        if (r > 0) {
            final List<ConstraintElement> rotated = new ArrayList<>(repeated.count() + 1);
            rotated.addAll(repeated.elements().subList(s, repeated.count()));
            rotated.addAll(repeated.elements().subList(0, s));
            if (t > 0) {
                final ConstraintElement head = rotated.get(0);
                rotated.add(head.copyWithRepeatCount(t));
                head.repeatCount(head.repeatCount() - t);
            }
            repeated.replaceWith(rotated);
        }
    }

    /**
     * Ensures that position {@code n} falls on a boundary between two elements of the initial segment, rotating
     * the loop first when the initial segment is too short.
     *
     * @return the index of the element starting at position {@code n}; equal to the element count when
     *     {@code n} is the length of the initial segment
     */
    public static int splitAtBoundary(final ConstraintList list, final int n) {
        final Segment initial = list.initial();
        requireNonNegative(n);
        if (n > initial.length()) {
            if (list.isFinite()) {
                throw new IllegalArgumentException(
                        "position " + n + " lies beyond the finite list of length " + initial.length());
            }
            rotateLoop(list, n);
        }

        int s = 0;
        int t = n;
        while (s < initial.count() && t >= initial.get(s).repeatCount()) {
            t -= initial.get(s).repeatCount();
            s++;
        }
        if (t == 0) {
            return s;
        }

        final int oldCount = initial.get(s).repeatCount();
        final ConstraintElement tail = initial.get(s).copyWithRepeatCount(oldCount - t);
        initial.setRepeatCount(s, t);
        initial.add(s + 1, tail);
        return s + 1;
    }

    /**
     * Makes the element covering position {@code n} a singleton of its own.
     *
     * @return the index of that element in the initial segment
     */
    public static int isolate(final ConstraintList list, final int n) {
        final int index = splitAtBoundary(list, n);
        splitAtBoundary(list, n + 1);
        return index;
    }

    /**
     * Moves the loop segment to the end of the initial segment, leaving a finite list.
     */
    public static void appendRepeatedToInitial(final ConstraintList list) {
        final Segment repeated = list.repeated();
        if (repeated.isEmpty()) {
            return;
        }
        final List<ConstraintElement> moved = new ArrayList<>(repeated.elements());
        repeated.clear();
        for (final ConstraintElement element : moved) {
            list.initial().add(element);
        }
    }

    private static void requireLoop(final ConstraintList list) {
        if (list.repeated().isEmpty()) {
            throw new IllegalArgumentException("operation requires a non-empty loop segment");
        }
    }

    private static void requireNonNegative(final int position) {
        if (position < 0) {
            throw new IllegalArgumentException("position must be >= 0: " + position);
        }
    }
}
