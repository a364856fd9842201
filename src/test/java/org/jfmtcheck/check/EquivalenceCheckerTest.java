package org.jfmtcheck.check;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.jfmtcheck.format.DFormatStringParser;
import org.jfmtcheck.format.FormatDescriptor;
import org.junit.jupiter.api.Test;

class EquivalenceCheckerTest {
    private final DFormatStringParser parser = new DFormatStringParser();
    private final List<String> reported = new ArrayList<>();
    private final FormatErrorLogger logger = (template, args) -> reported.add(FormatErrorLogger.render(template, args));

    @Test
    void differentArgumentTypesAreReported() {
        final boolean hadError = EquivalenceChecker.check(descriptor("%d"), descriptor("%s"), true, logger);

        assertTrue(hadError);
        assertEquals(List.of("format specifications in '%d' and '%s' are not equivalent"), reported);
    }

    @Test
    void identicalStringsAreEquivalent() {
        assertFalse(EquivalenceChecker.check(descriptor("%d"), descriptor("%d"), true, logger));
        assertTrue(reported.isEmpty());
    }

    @Test
    void reorderedNumberedArgumentsAreEquivalent() {
        assertFalse(EquivalenceChecker.check(
                descriptor("%1$s has %2$d files"), descriptor("%2$d Dateien in %1$s"), true, logger));
    }

    @Test
    void laxComparisonIsNotUsedEvenWhenRequested() {
        assertTrue(EquivalenceChecker.check(descriptor("%s"), descriptor("%d"), false, logger));
        assertEquals(1, reported.size());
    }

    @Test
    void missingTrailingArgumentIsReportedWithPrettyNames() {
        final boolean hadError = EquivalenceChecker.check(
                descriptor("%s and %s"), descriptor("%s"), true, logger, "msgid", "msgstr[0]");

        assertTrue(hadError);
        assertEquals(List.of("format specifications in 'msgid' and 'msgstr[0]' are not equivalent"), reported);
    }

    @Test
    void subsetComparisonAcceptsNarrowerTranslation() {
        assertFalse(EquivalenceChecker.checkSubset(descriptor("%s"), descriptor("%d"), logger, "msgid", "msgstr"));
        assertTrue(reported.isEmpty());
    }

    @Test
    void subsetComparisonRejectsWiderTranslation() {
        assertTrue(EquivalenceChecker.checkSubset(descriptor("%d"), descriptor("%s"), logger, "msgid", "msgstr"));
        assertEquals(List.of("format specifications in 'msgstr' are not a subset of those in 'msgid'"), reported);
    }

    @Test
    void subsetComparisonRejectsIncompatibleTranslation() {
        assertTrue(EquivalenceChecker.checkSubset(descriptor("%c"), descriptor("%f"), logger, "msgid", "msgstr"));
    }

    private FormatDescriptor descriptor(final String format) {
        return parser.parse(format, false).descriptor().orElseThrow();
    }
}
