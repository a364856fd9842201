package org.jfmtcheck.check;

/**
 * Receives mismatch reports from {@link EquivalenceChecker}. The template uses {@code %s} placeholders.
 */
@FunctionalInterface
public interface FormatErrorLogger {
    void error(String template, Object... args);

    /**
     * Renders a template the way {@link String#format} does.
     */
    static String render(final String template, final Object... args) {
        return String.format(template, args);
    }
}
