package org.jfmtcheck.arglist;

import java.util.Objects;

/**
 * Constraints for a potentially infinite argument list.
 *
 * <p>The constraints are assumed to become ultimately periodic, so they are split into an initial segment and an
 * endlessly repeated loop segment. A finite list is represented entirely in the initial segment and has an empty
 * loop. Structure sharing is not allowed: every nested list belongs to exactly one element.
 *
 * <p>Operations in {@link ListAlgebra}, {@link ListConstraints} and {@link ListSetOperations} consume the lists
 * passed to them; callers keep a {@link #copy()} when they still need the original.
 */
public final class ConstraintList {
    private final Segment initial;
    private final Segment repeated;

    ConstraintList() {
        this.initial = new Segment();
        this.repeated = new Segment();
    }

    /**
     * Creates a list that accepts any number of arguments of any type.
     */
    public static ConstraintList unconstrained() {
        final ConstraintList list = new ConstraintList();
        list.repeated.add(ConstraintElement.of(1, ArgPresence.OPTIONAL, ArgType.ANY));
        return list;
    }

    /**
     * Creates a list that accepts no arguments at all.
     */
    public static ConstraintList empty() {
        return new ConstraintList();
    }

    /**
     * Assembles a list from explicit elements. The elements are copied.
     */
    public static ConstraintList of(final Iterable<ConstraintElement> initialElements,
                                    final Iterable<ConstraintElement> repeatedElements) {
        final ConstraintList list = new ConstraintList();
        for (final ConstraintElement element : Objects.requireNonNull(initialElements, "initialElements")) {
            list.initial.add(element.copy());
        }
        for (final ConstraintElement element : Objects.requireNonNull(repeatedElements, "repeatedElements")) {
            list.repeated.add(element.copy());
        }
        return list;
    }

    public Segment initial() {
        return initial;
    }

    public Segment repeated() {
        return repeated;
    }

    public boolean isEmpty() {
        return initial.isEmpty() && repeated.isEmpty();
    }

    public boolean isFinite() {
        return repeated.isEmpty();
    }

    /**
     * Returns the presence of position 0, or {@code null} for the empty list.
     */
    ArgPresence firstPresence() {
        if (!initial.isEmpty()) {
            return initial.get(0).presence();
        }
        if (!repeated.isEmpty()) {
            return repeated.get(0).presence();
        }
        return null;
    }

    public ConstraintList copy() {
        final ConstraintList copy = new ConstraintList();
        copy.initial.addAll(initial.copy());
        copy.repeated.addAll(repeated.copy());
        return copy;
    }

    /**
     * Checks the structural invariants, recursively.
     *
     * @throws IllegalStateException if an invariant is violated
     */
    public void verify() {
        initial.verify();
        repeated.verify();
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ConstraintList that)) {
            return false;
        }
        return ListSetOperations.equalLists(this, that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(initial.elements(), repeated.elements());
    }

    @Override
    public String toString() {
        return ConstraintListPrinter.print(this);
    }
}
