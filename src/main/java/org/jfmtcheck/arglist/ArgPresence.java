package org.jfmtcheck.arglist;

/**
 * Whether an argument list may end right before a given position.
 */
public enum ArgPresence {
    /** The argument list cannot end before this argument. */
    REQUIRED,
    /** The argument list may end before this argument. */
    OPTIONAL;

    static ArgPresence combine(final ArgPresence first, final ArgPresence second) {
        if (first == REQUIRED || second == REQUIRED) {
            return REQUIRED;
        }
        return OPTIONAL;
    }
}
