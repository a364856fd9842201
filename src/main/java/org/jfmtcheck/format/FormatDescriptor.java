package org.jfmtcheck.format;

import java.util.Objects;
import org.jfmtcheck.arglist.ConstraintList;

/**
 * Parsed form of a valid format string: its normalized argument constraints plus directive counters.
 */
public final class FormatDescriptor {
    private final String format;
    private final int directives;
    private final int likelyIntentionalDirectives;
    private final ConstraintList constraints;

    public FormatDescriptor(
            final String format,
            final int directives,
            final int likelyIntentionalDirectives,
            final ConstraintList constraints) {
        this.format = Objects.requireNonNull(format, "format");
        if (directives < 0) {
            throw new IllegalArgumentException("directives must be >= 0");
        }
        if (likelyIntentionalDirectives < 0 || likelyIntentionalDirectives > directives) {
            throw new IllegalArgumentException("likelyIntentionalDirectives must be within 0..directives");
        }
        this.directives = directives;
        this.likelyIntentionalDirectives = likelyIntentionalDirectives;
        this.constraints = Objects.requireNonNull(constraints, "constraints").copy();
    }

    public String format() {
        return format;
    }

    /**
     * Number of directives; a string that is output literally has none.
     */
    public int directives() {
        return directives;
    }

    public int likelyIntentionalDirectives() {
        return likelyIntentionalDirectives;
    }

    /**
     * Whether the string, although valid, looks unlikely to be meant as a format string: every directive
     * contained a space, as in {@code "100% complete"}.
     */
    public boolean isUnlikelyIntentional() {
        return likelyIntentionalDirectives == 0;
    }

    /**
     * Returns a copy of the normalized argument constraints.
     */
    public ConstraintList constraints() {
        return constraints.copy();
    }

    @Override
    public String toString() {
        return "FormatDescriptor{format=" + format + ", directives=" + directives + ", constraints=" + constraints
                + "}";
    }
}
