package org.jfmtcheck.format;

/**
 * User-facing explanations why a string is not a valid format string. Directive numbers are 1-based.
 */
public final class InvalidFormatReasons {
    private InvalidFormatReasons() {}

    public static String unterminatedDirective() {
        return "The string ends in the middle of a directive.";
    }

    public static String argumentNumberZero(final int directiveNumber) {
        return "In the directive number " + directiveNumber
                + ", the argument number 0 is not a positive integer.";
    }

    public static String widthArgumentNumberZero(final int directiveNumber) {
        return "In the directive number " + directiveNumber
                + ", the width's argument number 0 is not a positive integer.";
    }

    public static String precisionArgumentNumberZero(final int directiveNumber) {
        return "In the directive number " + directiveNumber
                + ", the precision's argument number 0 is not a positive integer.";
    }

    public static String argumentNumberTooLarge(final int directiveNumber) {
        return "In the directive number " + directiveNumber + ", an argument number is too large.";
    }

    public static String argumentNumberOrder(final int directiveNumber) {
        return "In the directive number " + directiveNumber
                + ", the first argument number is greater than the second argument number.";
    }

    public static String conversionSpecifier(final int directiveNumber, final char specifier) {
        if (specifier >= 0x20 && specifier < 0x7f) {
            return "In the directive number " + directiveNumber + ", the character '" + specifier
                    + "' is not a valid conversion specifier.";
        }
        return "The character that terminates the directive number " + directiveNumber
                + " is not a valid conversion specifier.";
    }

    public static String compoundVariableArguments(final int directiveNumber) {
        return "In the directive number " + directiveNumber
                + ", the compound specifier consumes a variable number of arguments.";
    }

    public static String compoundArgumentCount(final int directiveNumber, final int argumentCount) {
        return "In the directive number " + directiveNumber + ", the compound specifier consumes "
                + argumentCount + " arguments.";
    }

    public static String barOutsideCompound() {
        return "Found '%|' outside of '%(...%)'.";
    }

    public static String unterminatedCompound() {
        return "The string ends in the middle of a compound specifier.";
    }

    public static String invalidCompoundDelimiter(final int directiveNumber) {
        return "In the directive number " + directiveNumber
                + ", there is an invalid directive in the delimiter part of a compound specifier.";
    }

    public static String unmatchedNesting(final char found, final char notFound) {
        return "Found '%" + found + "' without matching '%" + notFound + "'.";
    }

    public static String argumentPastLast(final int directiveNumber) {
        return "The directive number " + directiveNumber + " references an argument after the last argument.";
    }

    public static String nestingTooDeep(final int directiveNumber, final int maxDepth) {
        return "In the directive number " + directiveNumber + ", compound specifiers are nested more than "
                + maxDepth + " levels deep.";
    }

    public static String incompatibleArgumentTypes() {
        return "The string refers to some argument in incompatible ways.";
    }
}
