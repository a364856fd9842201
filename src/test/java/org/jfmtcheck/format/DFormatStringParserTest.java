package org.jfmtcheck.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.jfmtcheck.arglist.ArgPresence;
import org.jfmtcheck.arglist.ArgType;
import org.jfmtcheck.arglist.ConstraintElement;
import org.jfmtcheck.arglist.ConstraintList;
import org.jfmtcheck.arglist.ConstraintListPrinter;
import org.junit.jupiter.api.Test;

class DFormatStringParserTest {
    private final DFormatStringParser parser = new DFormatStringParser();

    @Test
    void integerDirectiveRequiresOneIntegerArgument() {
        final FormatDescriptor descriptor = parseValid("%d");
        final ConstraintList list = descriptor.constraints();

        assertEquals(1, descriptor.directives());
        assertTrue(list.isFinite());
        assertEquals(1, list.initial().length());
        final ConstraintElement element = list.initial().get(0);
        assertEquals(ArgPresence.REQUIRED, element.presence());
        assertTrue((element.type() & ArgType.INTEGER) != 0);
        assertEquals("(bic)", ConstraintListPrinter.print(list));
    }

    @Test
    void numberedStringDirectivesRequireTwoArguments() {
        final ConstraintList list = parseValid("%1$s and %2$s").constraints();

        assertTrue(list.isFinite());
        assertEquals(2, list.initial().length());
        assertEquals(ArgPresence.REQUIRED, list.initial().get(0).presence());
        assertEquals(ArgType.ANY, list.initial().get(0).type());
        assertEquals("(* *)", ConstraintListPrinter.print(list));
    }

    @Test
    void sequentialAndNumberedArgumentsAreEquivalent() {
        assertEquals(parseValid("%s").constraints(), parseValid("%1$s").constraints());
        assertEquals(parseValid("%s %d").constraints(), parseValid("%2$d %1$s").constraints());
    }

    @Test
    void literalTextTakesNoArguments() {
        final FormatDescriptor descriptor = parseValid("hello");

        assertEquals(0, descriptor.directives());
        assertTrue(descriptor.constraints().isEmpty());
        assertEquals("()", ConstraintListPrinter.print(descriptor.constraints()));
    }

    @Test
    void doubledPercentCountsAsDirectiveWithoutArguments() {
        final ParseResult result = parser.parse("100%%", false);
        final FormatDescriptor descriptor = result.descriptor().orElseThrow();

        assertEquals(1, descriptor.directives());
        assertFalse(descriptor.isUnlikelyIntentional());
        assertTrue(descriptor.constraints().isEmpty());
        assertEquals(
                List.of(
                        new DirectiveIndicator(3, DirectiveIndicator.Tag.DIRECTIVE_START),
                        new DirectiveIndicator(4, DirectiveIndicator.Tag.DIRECTIVE_END)),
                result.indicators());
    }

    @Test
    void valueSpecifiersMapToTypeMasks() {
        assertEquals("(c)", print("%c"));
        assertEquals("(bicp)", print("%X"));
        assertEquals("(if)", print("%5.2f"));
        assertEquals("(bifcar)", print("%r"));
        assertEquals("(bic)", print("%+-#0=o"));
    }

    @Test
    void widthPrecisionAndSeparatorConsumeArguments() {
        assertEquals("(i bic)", print("%*d"));
        assertEquals("(i i if)", print("%*.*e"));
        assertEquals("(i c bic)", print("%,*?d"));
        assertEquals("(bic)", print("%,3d"));
        assertEquals("(i bic)", print("%2$*1$d"));
    }

    @Test
    void sameArgumentUsedTwiceNarrowsItsType() {
        assertEquals("(c)", print("%1$d %1$c"));
    }

    @Test
    void argumentSpanRequiresEveryArgumentInRange() {
        assertEquals("(bic bic)", print("%1:2$d"));
    }

    @Test
    void allFollowingArgumentsFormOptionalLoop() {
        assertEquals("(* bic | . bic)", print("%2:$d"));
    }

    @Test
    void compoundSpecifierWithTwoArgumentsIsElementwisePair() {
        final ConstraintList list = parseValid("%(%s %s%)").constraints();

        assertEquals(ArgType.ELEMENTWISE_2, list.initial().get(0).type());
        assertEquals("(2(* *))", ConstraintListPrinter.print(list));
    }

    @Test
    void compoundSpecifierWithDelimiterIsElementwiseSingle() {
        assertEquals("(1(*))", print("%(%s%|, %)"));
        assertEquals("(1(bic))", print("%-(%d%|%%%)"));
    }

    @Test
    void compoundSpecifierWithThreeArgumentsIsRejected() {
        assertInvalid("%(%s %s %s%)", "In the directive number 1, the compound specifier consumes 3 arguments.");
    }

    @Test
    void compoundSpecifierWithVariableArgumentsIsRejected() {
        assertInvalid(
                "%(%1:$s%)",
                "In the directive number 1, the compound specifier consumes a variable number of arguments.");
    }

    @Test
    void reportsSyntaxErrors() {
        assertInvalid("abc %", "The string ends in the middle of a directive.");
        assertInvalid("%5", "The string ends in the middle of a directive.");
        assertInvalid("%0$d", "In the directive number 1, the argument number 0 is not a positive integer.");
        assertInvalid(
                "%s %*0$d", "In the directive number 2, the width's argument number 0 is not a positive integer.");
        assertInvalid(
                "%.*0$d", "In the directive number 1, the precision's argument number 0 is not a positive integer.");
        assertInvalid(
                "%2:1$d",
                "In the directive number 1, the first argument number is greater than the second argument number.");
        assertInvalid("%y", "In the directive number 1, the character 'y' is not a valid conversion specifier.");
        assertInvalid("%|", "Found '%|' outside of '%(...%)'.");
        assertInvalid("%)", "Found '%)' without matching '%('.");
        assertInvalid("%(%s", "Found '%(' without matching '%)'.");
        assertInvalid("%(%s%|abc", "The string ends in the middle of a compound specifier.");
        assertInvalid(
                "%(%s%|%d%)",
                "In the directive number 2, there is an invalid directive in the delimiter part of a compound "
                        + "specifier.");
        assertInvalid(
                "%1:$s %d", "The directive number 2 references an argument after the last argument.");
        assertInvalid("%99999999999$d", "In the directive number 1, an argument number is too large.");
    }

    @Test
    void incompatibleUsesOfOneArgumentAreRejectedWithoutOffset() {
        final ParseResult.Invalid invalid = (ParseResult.Invalid) parser.parse("%1$c %1$f", false);

        assertEquals("The string refers to some argument in incompatible ways.", invalid.reason());
        assertEquals(-1, invalid.errorOffset());
    }

    @Test
    void errorIndicatorMarksOffendingCharacter() {
        final ParseResult.Invalid invalid = (ParseResult.Invalid) parser.parse("a%yb", false);

        assertEquals(2, invalid.errorOffset());
        assertEquals(
                List.of(
                        new DirectiveIndicator(1, DirectiveIndicator.Tag.DIRECTIVE_START),
                        new DirectiveIndicator(2, DirectiveIndicator.Tag.ERROR)),
                invalid.indicators());
    }

    @Test
    void errorInsideCompoundAlsoMarksCompoundBody() {
        final ParseResult.Invalid invalid = (ParseResult.Invalid) parser.parse("%(%y%)", false);

        assertEquals(3, invalid.errorOffset());
        assertTrue(invalid.indicators().contains(new DirectiveIndicator(3, DirectiveIndicator.Tag.ERROR)));
        assertTrue(invalid.indicators().contains(new DirectiveIndicator(2, DirectiveIndicator.Tag.ERROR)));
    }

    @Test
    void directiveWithSpaceFlagIsUnlikelyIntentional() {
        final FormatDescriptor descriptor = parseValid("100% done");

        assertEquals(1, descriptor.directives());
        assertEquals(0, descriptor.likelyIntentionalDirectives());
        assertTrue(parser.isUnlikelyIntentional(descriptor));
        assertFalse(parser.isUnlikelyIntentional(parseValid("%d% d")));
    }

    @Test
    void nestingUpToLimitIsAccepted() {
        final String format = nested(DFormatStringParser.MAX_NESTING_DEPTH);

        final ParseResult result = parser.parse(format, false);

        assertTrue(result.isValid());
        assertEquals(1, result.descriptor().orElseThrow().directives());
    }

    @Test
    void nestingBeyondLimitIsRejected() {
        final String format = nested(DFormatStringParser.MAX_NESTING_DEPTH + 1);

        final ParseResult.Invalid invalid = (ParseResult.Invalid) parser.parse(format, false);

        assertEquals(
                "In the directive number 1, compound specifiers are nested more than 1000 levels deep.",
                invalid.reason());
    }

    @Test
    void translatedFlagMakesNoDifference() {
        assertEquals(parseValid("%s %d").constraints(), parser.parse("%s %d", true).descriptor().orElseThrow()
                .constraints());
    }

    @Test
    void validResultExposesDescriptorDirectlyAndAsOptional() {
        final ParseResult result = parser.parse("%s %d", false);

        final ParseResult.Valid valid = (ParseResult.Valid) result;
        assertSame(valid.value(), result.descriptor().orElseThrow());
        assertEquals("%s %d", valid.value().format());
        assertTrue(parser.parse("%y", false).descriptor().isEmpty());
    }

    @Test
    void registryResolvesParserByName() {
        assertEquals("d", FormatStringParsers.forName("d").name());
        assertEquals("d", FormatStringParsers.forName("D-Format").name());
        assertTrue(FormatStringParsers.all().contains(FormatStringParsers.d()));
    }

    private static String nested(final int depth) {
        return "%(".repeat(depth) + "%s" + "%)".repeat(depth);
    }

    private String print(final String format) {
        return ConstraintListPrinter.print(parseValid(format).constraints());
    }

    private FormatDescriptor parseValid(final String format) {
        final ParseResult result = parser.parse(format, false);
        if (result instanceof ParseResult.Invalid invalid) {
            throw new AssertionError("expected valid format '" + format + "' but got: " + invalid.reason());
        }
        return result.descriptor().orElseThrow();
    }

    private void assertInvalid(final String format, final String expectedReason) {
        final ParseResult result = parser.parse(format, false);
        assertFalse(result.isValid(), () -> "expected invalid format: " + format);
        assertEquals(expectedReason, ((ParseResult.Invalid) result).reason(), format);
    }
}
