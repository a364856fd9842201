package org.jfmtcheck.format;

import java.util.Objects;

/**
 * Marks a source offset of a parsed format string, for highlighting directives and parse errors.
 */
public record DirectiveIndicator(int offset, Tag tag) {
    public DirectiveIndicator {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        Objects.requireNonNull(tag, "tag");
    }

    public enum Tag {
        /** First character of a directive. */
        DIRECTIVE_START,
        /** Last character of a directive. */
        DIRECTIVE_END,
        /** Character where a parse error was recognized. */
        ERROR
    }
}
