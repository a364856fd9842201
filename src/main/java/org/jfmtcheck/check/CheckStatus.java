package org.jfmtcheck.check;

import java.util.Objects;

/**
 * Outcome category of checking one message pair.
 */
public enum CheckStatus {
    /** Both strings parse and take the same arguments. */
    EQUIVALENT("ok"),
    NOT_EQUIVALENT("mismatch"),
    /** The source string is not a valid format string; nothing can be checked. */
    INVALID_MSGID("invalid-msgid"),
    INVALID_MSGSTR("invalid-msgstr");

    private final String code;

    CheckStatus(final String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static CheckStatus fromCode(final String code) {
        Objects.requireNonNull(code, "code");
        for (final CheckStatus status : values()) {
            if (status.code.equals(code.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown check status: " + code);
    }
}
