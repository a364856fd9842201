package org.jfmtcheck.format;

/**
 * Parser for the format strings of one host language.
 */
public interface FormatStringParser {
    /**
     * Short name, e.g. {@code d} for D format strings.
     */
    String name();

    /**
     * Parses a candidate format string.
     *
     * @param translated whether the string is a translation; some languages accept extensions only there
     */
    ParseResult parse(String format, boolean translated);

    default int directiveCount(final FormatDescriptor descriptor) {
        return descriptor.directives();
    }

    default boolean isUnlikelyIntentional(final FormatDescriptor descriptor) {
        return descriptor.isUnlikelyIntentional();
    }
}
