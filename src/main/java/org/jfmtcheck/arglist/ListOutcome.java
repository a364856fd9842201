package org.jfmtcheck.arglist;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of an operation that may discover that the accumulated constraints cannot be satisfied.
 */
public interface ListOutcome {

    static ListOutcome of(final ConstraintList list) {
        return new Constrained(list);
    }

    static ListOutcome contradiction() {
        return Contradiction.INSTANCE;
    }

    boolean isContradiction();

    /**
     * Returns the list.
     *
     * @throws IllegalStateException for a contradiction
     */
    ConstraintList list();

    Optional<ConstraintList> asOptional();

    /**
     * Applies the next step; a contradiction stays a contradiction.
     */
    ListOutcome then(Function<ConstraintList, ListOutcome> step);

    record Constrained(ConstraintList list) implements ListOutcome {
        public Constrained {
            Objects.requireNonNull(list, "list");
        }

        @Override
        public boolean isContradiction() {
            return false;
        }

        @Override
        public Optional<ConstraintList> asOptional() {
            return Optional.of(list);
        }

        @Override
        public ListOutcome then(final Function<ConstraintList, ListOutcome> step) {
            return Objects.requireNonNull(step.apply(list), "step result");
        }
    }

    final class Contradiction implements ListOutcome {
        private static final Contradiction INSTANCE = new Contradiction();

        private Contradiction() {}

        @Override
        public boolean isContradiction() {
            return true;
        }

        @Override
        public ConstraintList list() {
            throw new IllegalStateException("the constraints are contradictory");
        }

        @Override
        public Optional<ConstraintList> asOptional() {
            return Optional.empty();
        }

        @Override
        public ListOutcome then(final Function<ConstraintList, ListOutcome> step) {
            return this;
        }

        @Override
        public String toString() {
            return "Contradiction";
        }
    }
}
