package org.jfmtcheck.arglist;

import java.util.Objects;
import java.util.Optional;

/**
 * Adds specific constraints to a constraint list. These are the mutators a directive parser calls.
 *
 * <p>Every method consumes its list argument and returns either the updated list or a contradiction.
 */
public final class ListConstraints {
    private ListConstraints() {}

    /**
     * Tests whether arguments {@code 0..n} are all required.
     */
    public static boolean isRequired(final ConstraintList list, final int n) {
        Objects.requireNonNull(list, "list");
        int t = n + 1;

        final Segment initial = list.initial();
        int s = 0;
        while (s < initial.count() && t >= initial.get(s).repeatCount()) {
            if (initial.get(s).presence() != ArgPresence.REQUIRED) {
                return false;
            }
            t -= initial.get(s).repeatCount();
            s++;
        }
        if (t == 0) {
            return true;
        }
        if (s < initial.count()) {
            return initial.get(s).presence() == ArgPresence.REQUIRED;
        }

        final Segment repeated = list.repeated();
        if (repeated.isEmpty()) {
            return false;
        }
        s = 0;
        while (s < repeated.count() && t >= repeated.get(s).repeatCount()) {
            if (repeated.get(s).presence() != ArgPresence.REQUIRED) {
                return false;
            }
            t -= repeated.get(s).repeatCount();
            s++;
        }
        if (t == 0 || s >= repeated.count()) {
            // Either exactly consumed, or the loop is entirely required and further passes change nothing.
            return true;
        }
        return repeated.get(s).presence() == ArgPresence.REQUIRED;
    }

    /**
     * Requires that arguments {@code 0..n} are present.
     */
    public static ListOutcome addRequiredConstraint(final ConstraintList list, final int n) {
        Objects.requireNonNull(list, "list");
        requireNonNegative(n);
        if (list.isFinite() && list.initial().length() <= n) {
            return ListOutcome.contradiction();
        }

        ListAlgebra.splitAtBoundary(list, n + 1);

        final Segment initial = list.initial();
        int rest = n + 1;
        for (int i = 0; rest > 0; i++) {
            initial.get(i).presence(ArgPresence.REQUIRED);
            rest -= initial.get(i).repeatCount();
        }
        return ListOutcome.of(list);
    }

    /**
     * Forbids argument {@code n} and everything after it.
     */
    public static ListOutcome addEndConstraint(final ConstraintList list, final int n) {
        Objects.requireNonNull(list, "list");
        requireNonNegative(n);
        if (list.isFinite() && list.initial().length() <= n) {
            return ListOutcome.of(list);
        }

        final int s = ListAlgebra.splitAtBoundary(list, n);
        final Segment initial = list.initial();
        final ArgPresence presenceAtEnd = s < initial.count()
                ? initial.get(s).presence()
                : list.repeated().get(0).presence();

        initial.truncate(s);
        list.repeated().clear();

        if (presenceAtEnd == ArgPresence.REQUIRED) {
            return backtrackInInitial(list);
        }
        return ListOutcome.of(list);
    }

    /**
     * Resolves a contradiction in a finite list by cutting it off at the last position where it may end.
     */
    public static ListOutcome backtrackInInitial(final ConstraintList list) {
        Objects.requireNonNull(list, "list");
        if (!list.isFinite()) {
            throw new IllegalArgumentException("backtracking requires an empty loop segment");
        }
        final Segment initial = list.initial();
        while (!initial.isEmpty()) {
            final ConstraintElement last = initial.last();
            if (last.presence() == ArgPresence.REQUIRED) {
                initial.removeLast();
                continue;
            }
            if (last.repeatCount() > 1) {
                initial.setRepeatCount(initial.count() - 1, last.repeatCount() - 1);
            } else {
                initial.removeLast();
            }
            return ListOutcome.of(list);
        }
        return ListOutcome.contradiction();
    }

    /**
     * Restricts arguments {@code n1..n2} to {@code type}. Assumes a preceding
     * {@link #addRequiredConstraint(ConstraintList, int) addRequiredConstraint(list, n2)}.
     *
     * @param sublist the nested list for an elementwise type, {@code null} otherwise; it is not consumed
     */
    public static ListOutcome addTypeConstraint(
            final ConstraintList list, final int n1, final int n2, final int type, final ConstraintList sublist) {
        Objects.requireNonNull(list, "list");
        requireNonNegative(n1);
        if (n2 < n1) {
            throw new IllegalArgumentException("n2 must be >= n1: " + n1 + ".." + n2);
        }
        final ConstraintElement constraint = new ConstraintElement(1, ArgPresence.OPTIONAL, type, sublist);

        int s = ListAlgebra.splitAtBoundary(list, n1);
        ListAlgebra.splitAtBoundary(list, n2 + 1);

        final Segment initial = list.initial();
        int n = n1;
        while (n <= n2) {
            final ConstraintElement current = initial.get(s);
            if (!narrow(current, constraint)) {
                return addEndConstraint(list, n);
            }
            n += current.repeatCount();
            s++;
        }
        return ListOutcome.of(list);
    }

    /**
     * Restricts every argument at position {@code n} or later, if present, to {@code type}.
     *
     * @param sublist the nested list for an elementwise type, {@code null} otherwise; it is not consumed
     */
    public static ListOutcome addRepeatedOptTypeConstraint(
            final ConstraintList list, final int n, final int type, final ConstraintList sublist) {
        Objects.requireNonNull(list, "list");
        final ConstraintElement constraint = new ConstraintElement(1, ArgPresence.OPTIONAL, type, sublist);

        int s = ListAlgebra.splitAtBoundary(list, n);
        int position = n;

        final Segment initial = list.initial();
        for (; s < initial.count(); s++) {
            final ConstraintElement current = initial.get(s);
            if (!narrow(current, constraint)) {
                return addEndConstraint(list, position);
            }
            position += current.repeatCount();
        }

        for (final ConstraintElement current : list.repeated().elements()) {
            if (!narrow(current, constraint)) {
                return addEndConstraint(list, position);
            }
            position += current.repeatCount();
        }
        return ListOutcome.of(list);
    }

    private static boolean narrow(final ConstraintElement target, final ConstraintElement constraint) {
        final Optional<ConstraintElement> narrowed =
                ListSetOperations.intersectElements(target, constraint, target.repeatCount());
        if (narrowed.isEmpty()) {
            return false;
        }
        target.setConstraint(narrowed.get().type(), narrowed.get().elementwise());
        return true;
    }

    private static void requireNonNegative(final int position) {
        if (position < 0) {
            throw new IllegalArgumentException("position must be >= 0: " + position);
        }
    }
}
