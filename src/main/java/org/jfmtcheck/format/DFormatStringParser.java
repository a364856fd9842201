package org.jfmtcheck.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jfmtcheck.arglist.ArgType;
import org.jfmtcheck.arglist.ConstraintList;
import org.jfmtcheck.arglist.ListAlgebra;
import org.jfmtcheck.arglist.ListConstraints;
import org.jfmtcheck.arglist.ListOutcome;

/**
 * Parser for D format strings, as understood by the {@code std.format} module.
 *
 * <p>A format string consists of literal text, doubled percent signs and directives. A directive
 * <ul>
 *   <li>starts with {@code %},</li>
 *   <li>is optionally followed by an argument number {@code m$}, a span {@code m:m2$} with {@code m <= m2},
 *       or {@code m:$} for argument {@code m} and all following ones,</li>
 *   <li>is optionally followed by flags, each one of {@code ' ' + - # 0 =},</li>
 *   <li>is optionally followed by a width: digits, {@code *}, or {@code *m$},</li>
 *   <li>is optionally followed by a precision: {@code .} then optionally digits, {@code *}, or {@code *m$},</li>
 *   <li>is optionally followed by a separator: {@code ,} then optionally digits or {@code *}, then optionally
 *       {@code ?},</li>
 *   <li>ends with a value specifier, or with a compound specifier {@code %(...%)}: a nested format string that
 *       consumes one or two arguments, optionally followed by {@code %|} and literal delimiter text.</li>
 * </ul>
 *
 * <p>The {@code translated} flag makes no difference for this language.
 */
public final class DFormatStringParser implements FormatStringParser {
    public static final String NAME = "d";
    /** Maximum nesting depth of compound specifiers. */
    public static final int MAX_NESTING_DEPTH = ListAlgebra.MAX_NESTING_DEPTH;

    static final int MAX_ARGUMENT_NUMBER = Integer.MAX_VALUE - 2;

    private static final int CLOSES_COMPOUND = -1;
    private static final int END = -1;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ParseResult parse(final String format, final boolean translated) {
        Objects.requireNonNull(format, "format");
        final Scan scan = new Scan(format);
        final Level top = new Level();

        final ListOutcome outcome;
        try {
            outcome = parseUpTo(scan, top, false, 0);
        } catch (final FormatSyntaxException e) {
            return new ParseResult.Invalid(e.getMessage(), e.offset(), scan.indicators);
        }
        if (outcome.isContradiction()) {
            return new ParseResult.Invalid(InvalidFormatReasons.incompatibleArgumentTypes(), -1, scan.indicators);
        }

        final ConstraintList constraints = ListAlgebra.normalize(outcome.list());
        return new ParseResult.Valid(
                new FormatDescriptor(format, top.directives, top.likelyIntentionalDirectives, constraints),
                scan.indicators);
    }

    /**
     * Parses until the end of the string or, inside a compound specifier, until its closing {@code %)}. On a
     * regular return inside a compound specifier the scan position rests on the closing parenthesis.
     */
    private ListOutcome parseUpTo(final Scan scan, final Level level, final boolean compound, final int depth)
            throws FormatSyntaxException {
        boolean closed = false;

        scanning:
        while (!scan.atEnd()) {
            if (scan.next() != '%') {
                continue;
            }
            boolean likelyIntentional = true;
            scan.mark(scan.pos - 1, DirectiveIndicator.Tag.DIRECTIVE_START);
            level.directives++;

            if (scan.atEnd()) {
                throw scan.error(InvalidFormatReasons.unterminatedDirective(), scan.pos - 1);
            }
            if (scan.peek() != '%') {
                final Directive directive = new Directive();
                parseArgumentNumbers(scan, level, directive);
                while (isFlag(scan.peek())) {
                    if (scan.peek() == ' ') {
                        likelyIntentional = false;
                    }
                    scan.pos++;
                }
                parseWidth(scan, level, directive);
                parsePrecision(scan, level, directive);
                parseSeparator(scan, directive);

                final int type = parseSpecifier(scan, level, directive, compound, depth);
                if (type == CLOSES_COMPOUND) {
                    closed = true;
                    break scanning;
                }
                directive.type = type;
                applyArguments(scan, level, directive);
            }

            if (likelyIntentional) {
                level.likelyIntentionalDirectives++;
            }
            scan.mark(scan.pos, DirectiveIndicator.Tag.DIRECTIVE_END);
            scan.pos++;
        }

        if (compound && !closed) {
            throw new FormatSyntaxException(InvalidFormatReasons.unmatchedNesting('(', ')'), scan.length() - 1);
        }

        // Extra arguments at the end are not allowed.
        if (!level.pastLast) {
            final int end = level.argCount;
            level.list = level.list.then(list -> ListConstraints.addEndConstraint(list, end));
        }
        if (compound && level.list.isContradiction()) {
            throw scan.error(InvalidFormatReasons.incompatibleArgumentTypes(), scan.pos);
        }
        return level.list;
    }

    private static void parseArgumentNumbers(final Scan scan, final Level level, final Directive directive)
            throws FormatSyntaxException {
        if (!isDigit(scan.peek())) {
            return;
        }
        int f = scan.pos;
        final long m = scan.digitsAt(f);
        f = scan.skipDigits(f);

        if (scan.charAt(f) == '$') {
            directive.firstNumber = requireArgumentNumber(scan, level, m, f);
            scan.pos = f + 1;
        } else if (scan.charAt(f) == ':') {
            f++;
            if (isDigit(scan.charAt(f))) {
                final long m2 = scan.digitsAt(f);
                f = scan.skipDigits(f);
                if (scan.charAt(f) == '$') {
                    final int first = requireArgumentNumber(scan, level, m, f);
                    final int second = requireArgumentNumber(scan, level, m2, f);
                    if (first > second) {
                        throw scan.error(InvalidFormatReasons.argumentNumberOrder(level.directives), f);
                    }
                    directive.firstNumber = first;
                    directive.secondNumber = second;
                    scan.pos = f + 1;
                }
            } else if (scan.charAt(f) == '$') {
                directive.firstNumber = requireArgumentNumber(scan, level, m, f);
                directive.secondIsLast = true;
                scan.pos = f + 1;
            }
        }
    }

    private static void parseWidth(final Scan scan, final Level level, final Directive directive)
            throws FormatSyntaxException {
        if (isDigit(scan.peek())) {
            scan.pos = scan.skipDigits(scan.pos);
        } else if (scan.peek() == '*') {
            scan.pos++;
            if (isDigit(scan.peek())) {
                final long m = scan.digitsAt(scan.pos);
                final int f = scan.skipDigits(scan.pos);
                if (scan.charAt(f) == '$') {
                    if (m == 0) {
                        throw scan.error(InvalidFormatReasons.widthArgumentNumberZero(level.directives), f);
                    }
                    directive.widthNumber = requireArgumentNumber(scan, level, m, f);
                    scan.pos = f + 1;
                }
            }
            if (directive.widthNumber == 0) {
                directive.widthFromArg = true;
            }
        }
    }

    private static void parsePrecision(final Scan scan, final Level level, final Directive directive)
            throws FormatSyntaxException {
        if (scan.peek() != '.') {
            return;
        }
        scan.pos++;
        if (isDigit(scan.peek())) {
            scan.pos = scan.skipDigits(scan.pos);
        } else if (scan.peek() == '*') {
            scan.pos++;
            if (isDigit(scan.peek())) {
                final long m = scan.digitsAt(scan.pos);
                final int f = scan.skipDigits(scan.pos);
                if (scan.charAt(f) == '$') {
                    if (m == 0) {
                        throw scan.error(InvalidFormatReasons.precisionArgumentNumberZero(level.directives), f);
                    }
                    directive.precisionNumber = requireArgumentNumber(scan, level, m, f);
                    scan.pos = f + 1;
                }
            }
            if (directive.precisionNumber == 0) {
                directive.precisionFromArg = true;
            }
        }
    }

    private static void parseSeparator(final Scan scan, final Directive directive) {
        if (scan.peek() != ',') {
            return;
        }
        scan.pos++;
        if (isDigit(scan.peek())) {
            scan.pos = scan.skipDigits(scan.pos);
        } else if (scan.peek() == '*') {
            scan.pos++;
            directive.separatorDigitsFromArg = true;
        }
        if (scan.peek() == '?') {
            scan.pos++;
            directive.separatorCharFromArg = true;
        }
    }

    /**
     * Parses the terminating specifier and returns its argument type, or {@link #CLOSES_COMPOUND} for the
     * end of the enclosing compound specifier. Leaves the scan position on the last character of the directive.
     */
    private int parseSpecifier(
            final Scan scan, final Level level, final Directive directive, final boolean compound, final int depth)
            throws FormatSyntaxException {
        final int c = scan.peek();
        switch (c) {
            case 's':
                return ArgType.ANY;
            case 'c':
                return ArgType.CHAR;
            case 'd':
            case 'u':
            case 'b':
            case 'o':
                return ArgType.BOOL | ArgType.INTEGER | ArgType.CHAR;
            case 'x':
            case 'X':
                return ArgType.BOOL | ArgType.INTEGER | ArgType.CHAR | ArgType.POINTER;
            case 'e':
            case 'E':
            case 'f':
            case 'F':
            case 'g':
            case 'G':
            case 'a':
            case 'A':
                return ArgType.INTEGER | ArgType.FLOATING_POINT;
            case 'r':
                return ArgType.BOOL | ArgType.INTEGER | ArgType.FLOATING_POINT | ArgType.CHAR | ArgType.ARRAY
                        | ArgType.IRANGE;
            case '(':
                return parseCompound(scan, level, directive, depth);
            case '|':
                if (!compound) {
                    throw scan.error(InvalidFormatReasons.barOutsideCompound(), scan.pos);
                }
                skipDelimiter(scan, level);
                return CLOSES_COMPOUND;
            case ')':
                if (!compound) {
                    throw scan.error(InvalidFormatReasons.unmatchedNesting(')', '('), scan.pos);
                }
                return CLOSES_COMPOUND;
            case END:
                throw scan.error(InvalidFormatReasons.unterminatedDirective(), scan.pos - 1);
            default:
                throw scan.error(InvalidFormatReasons.conversionSpecifier(level.directives, (char) c), scan.pos);
        }
    }

    private int parseCompound(final Scan scan, final Level level, final Directive directive, final int depth)
            throws FormatSyntaxException {
        scan.pos++;
        final int bodyStart = scan.pos;
        if (depth >= MAX_NESTING_DEPTH) {
            throw scan.error(InvalidFormatReasons.nestingTooDeep(level.directives, MAX_NESTING_DEPTH), bodyStart - 1);
        }

        final ListOutcome body;
        try {
            body = parseUpTo(scan, new Level(), true, depth + 1);
        } catch (final FormatSyntaxException e) {
            scan.mark(bodyStart < scan.length() ? bodyStart : bodyStart - 1, DirectiveIndicator.Tag.ERROR);
            throw e;
        }

        final ConstraintList nested = body.list();
        if (!nested.isFinite()) {
            // e.g. "%(%1:$s%)"
            throw scan.error(InvalidFormatReasons.compoundVariableArguments(level.directives), scan.pos - 1);
        }
        final int argumentCount = nested.initial().length();
        directive.elementwise = nested;
        if (argumentCount == 1) {
            return ArgType.ELEMENTWISE_1;
        }
        if (argumentCount == 2) {
            return ArgType.ELEMENTWISE_2;
        }
        throw scan.error(InvalidFormatReasons.compoundArgumentCount(level.directives, argumentCount), scan.pos - 1);
    }

    /**
     * Skips the literal delimiter text after {@code %|}, up to the closing {@code %)}.
     */
    private static void skipDelimiter(final Scan scan, final Level level) throws FormatSyntaxException {
        scan.pos++;
        while (true) {
            if (scan.atEnd()) {
                throw scan.error(InvalidFormatReasons.unterminatedCompound(), scan.pos - 1);
            }
            if (scan.peek() != '%') {
                scan.pos++;
                continue;
            }
            scan.pos++;
            if (scan.peek() == '%') {
                scan.pos++;
            } else if (scan.peek() == ')') {
                return;
            } else {
                throw scan.error(
                        InvalidFormatReasons.invalidCompoundDelimiter(level.directives),
                        scan.atEnd() ? scan.pos - 1 : scan.pos);
            }
        }
    }

    private static void applyArguments(final Scan scan, final Level level, final Directive directive)
            throws FormatSyntaxException {
        if (directive.widthNumber > 0) {
            requireType(level, directive.widthNumber - 1, directive.widthNumber - 1, ArgType.INTEGER, null);
            level.raiseArgCount(directive.widthNumber);
        } else if (directive.widthFromArg) {
            consumeNext(scan, level, ArgType.INTEGER, null);
        }

        if (directive.precisionNumber > 0) {
            requireType(level, directive.precisionNumber - 1, directive.precisionNumber - 1, ArgType.INTEGER, null);
            level.raiseArgCount(directive.precisionNumber);
        } else if (directive.precisionFromArg) {
            consumeNext(scan, level, ArgType.INTEGER, null);
        }

        if (directive.separatorDigitsFromArg) {
            consumeNext(scan, level, ArgType.INTEGER, null);
        }
        if (directive.separatorCharFromArg) {
            consumeNext(scan, level, ArgType.CHAR, null);
        }

        final int first = directive.firstNumber;
        if (first == 0) {
            consumeNext(scan, level, directive.type, directive.elementwise);
        } else if (directive.secondNumber > 0) {
            requireType(level, first - 1, directive.secondNumber - 1, directive.type, directive.elementwise);
            level.raiseArgCount(directive.secondNumber);
        } else if (directive.secondIsLast) {
            requireType(level, first - 1, first - 1, directive.type, directive.elementwise);
            level.list = level.list.then(list -> ListConstraints.addRepeatedOptTypeConstraint(
                    list, first, directive.type, directive.elementwise));
            level.pastLast = true;
        } else {
            requireType(level, first - 1, first - 1, directive.type, directive.elementwise);
            level.raiseArgCount(first);
        }
    }

    private static void consumeNext(final Scan scan, final Level level, final int type, final ConstraintList sublist)
            throws FormatSyntaxException {
        if (level.pastLast) {
            throw scan.error(InvalidFormatReasons.argumentPastLast(level.directives), scan.pos);
        }
        if (level.argCount >= MAX_ARGUMENT_NUMBER) {
            throw scan.error(InvalidFormatReasons.argumentNumberTooLarge(level.directives), scan.pos);
        }
        requireType(level, level.argCount, level.argCount, type, sublist);
        level.argCount++;
    }

    private static void requireType(
            final Level level, final int position1, final int position2, final int type, final ConstraintList sublist) {
        level.list = level.list
                .then(list -> ListConstraints.addRequiredConstraint(list, position2))
                .then(list -> ListConstraints.addTypeConstraint(list, position1, position2, type, sublist));
    }

    private static int requireArgumentNumber(final Scan scan, final Level level, final long number, final int offset)
            throws FormatSyntaxException {
        if (number == 0) {
            throw scan.error(InvalidFormatReasons.argumentNumberZero(level.directives), offset);
        }
        if (number > MAX_ARGUMENT_NUMBER) {
            throw scan.error(InvalidFormatReasons.argumentNumberTooLarge(level.directives), offset);
        }
        return (int) number;
    }

    private static boolean isDigit(final int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isFlag(final int c) {
        return c == ' ' || c == '+' || c == '-' || c == '#' || c == '0' || c == '=';
    }

    /**
     * Parser state of one nesting level.
     */
    private static final class Level {
        private ListOutcome list = ListOutcome.of(ConstraintList.unconstrained());
        private int directives;
        private int likelyIntentionalDirectives;
        /** Index of the next argument consumed without an explicit number. */
        private int argCount;
        /** Set once a {@code m:$} directive has consumed all following arguments. */
        private boolean pastLast;

        void raiseArgCount(final int number) {
            if (!pastLast && argCount < number) {
                argCount = number;
            }
        }
    }

    private static final class Directive {
        private int firstNumber;
        private int secondNumber;
        private boolean secondIsLast;
        private int widthNumber;
        private boolean widthFromArg;
        private int precisionNumber;
        private boolean precisionFromArg;
        private boolean separatorDigitsFromArg;
        private boolean separatorCharFromArg;
        private int type;
        private ConstraintList elementwise;
    }

    private static final class Scan {
        private final String text;
        private final List<DirectiveIndicator> indicators = new ArrayList<>();
        private int pos;

        Scan(final String text) {
            this.text = text;
        }

        int length() {
            return text.length();
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char next() {
            return text.charAt(pos++);
        }

        int peek() {
            return charAt(pos);
        }

        int charAt(final int index) {
            return index < text.length() ? text.charAt(index) : END;
        }

        int skipDigits(final int from) {
            int i = from;
            while (isDigit(charAt(i))) {
                i++;
            }
            return i;
        }

        /**
         * Reads the decimal number starting at {@code from}, saturating above {@link #MAX_ARGUMENT_NUMBER}.
         */
        long digitsAt(final int from) {
            long value = 0;
            for (int i = from; isDigit(charAt(i)); i++) {
                value = Math.min(10 * value + (charAt(i) - '0'), (long) MAX_ARGUMENT_NUMBER + 1);
            }
            return value;
        }

        void mark(final int offset, final DirectiveIndicator.Tag tag) {
            if (offset >= 0 && offset < text.length()) {
                indicators.add(new DirectiveIndicator(offset, tag));
            }
        }

        FormatSyntaxException error(final String reason, final int offset) {
            mark(offset, DirectiveIndicator.Tag.ERROR);
            return new FormatSyntaxException(reason, offset);
        }
    }

    private static final class FormatSyntaxException extends Exception {
        private static final long serialVersionUID = 1L;

        private final int offset;

        FormatSyntaxException(final String reason, final int offset) {
            super(reason);
            this.offset = Math.max(offset, 0);
        }

        int offset() {
            return offset;
        }
    }
}
