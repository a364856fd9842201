package org.jfmtcheck.format;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Registry of the supported format string languages.
 */
public final class FormatStringParsers {
    private static final FormatStringParser D = new DFormatStringParser();
    private static final List<FormatStringParser> ALL = List.of(D);

    private FormatStringParsers() {
    }

    public static FormatStringParser d() {
        return D;
    }

    public static List<FormatStringParser> all() {
        return ALL;
    }

    /**
     * Looks up a parser by its short name; the {@code -format} suffix used in PO file flags is accepted too.
     *
     * @throws IllegalArgumentException for an unknown language
     */
    public static FormatStringParser forName(final String name) {
        Objects.requireNonNull(name, "name");
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("-format")) {
            normalized = normalized.substring(0, normalized.length() - "-format".length());
        }
        for (final FormatStringParser parser : ALL) {
            if (parser.name().equals(normalized)) {
                return parser;
            }
        }
        throw new IllegalArgumentException("unsupported format language: " + name);
    }
}
