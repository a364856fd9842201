package org.jfmtcheck.arglist;

/**
 * Signals that nested elementwise lists exceed {@link ListAlgebra#MAX_NESTING_DEPTH}.
 */
public final class ListNestingDepthException extends IllegalArgumentException {
    private final int depth;

    public ListNestingDepthException(final int depth) {
        super("nested argument lists exceed the maximum depth of " + ListAlgebra.MAX_NESTING_DEPTH + ": " + depth);
        this.depth = depth;
    }

    public int depth() {
        return depth;
    }
}
