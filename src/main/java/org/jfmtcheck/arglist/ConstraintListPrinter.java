package org.jfmtcheck.arglist;

/**
 * Renders a constraint list in a compact notation, one token per argument.
 *
 * <p>{@code (i . * | . *)} reads: a required integer, then an optional argument of any type, then endlessly
 * optional arguments of any type. Type letters are {@code b i f c a @ r s p} for bool, integer, floating point,
 * char, array, associative, irange, struct and pointer; {@code 1} and {@code 2} introduce an elementwise
 * nested list.
 */
public final class ConstraintListPrinter {
    private static final int[] TYPE_BITS = {
        ArgType.BOOL, ArgType.INTEGER, ArgType.FLOATING_POINT, ArgType.CHAR, ArgType.ARRAY,
        ArgType.ASSOCIATIVE, ArgType.IRANGE, ArgType.STRUCT, ArgType.POINTER
    };
    private static final char[] TYPE_LETTERS = {'b', 'i', 'f', 'c', 'a', '@', 'r', 's', 'p'};

    private ConstraintListPrinter() {}

    public static String print(final ConstraintList list) {
        final StringBuilder sb = new StringBuilder();
        appendList(sb, list);
        return sb.toString();
    }

    static String printElement(final ConstraintElement element) {
        final StringBuilder sb = new StringBuilder();
        appendElement(sb, element);
        return sb.toString();
    }

    private static void appendList(final StringBuilder sb, final ConstraintList list) {
        sb.append('(');
        boolean first = true;
        for (final ConstraintElement element : list.initial().elements()) {
            for (int j = 0; j < element.repeatCount(); j++) {
                if (!first) {
                    sb.append(' ');
                }
                first = false;
                appendElement(sb, element);
            }
        }
        if (!list.repeated().isEmpty()) {
            sb.append(" |");
            for (final ConstraintElement element : list.repeated().elements()) {
                for (int j = 0; j < element.repeatCount(); j++) {
                    sb.append(' ');
                    appendElement(sb, element);
                }
            }
        }
        sb.append(')');
    }

    private static void appendElement(final StringBuilder sb, final ConstraintElement element) {
        if (element.presence() == ArgPresence.OPTIONAL) {
            sb.append(". ");
        }
        final int type = element.type();
        if (element.isElementwise()) {
            if (type == ArgType.ELEMENTWISE_1) {
                sb.append('1');
            } else if (type == ArgType.ELEMENTWISE_2) {
                sb.append('2');
            } else {
                sb.append("E<");
                appendTypeLetters(sb, type);
                sb.append('>');
            }
            appendList(sb, element.elementwise());
            return;
        }
        if (type == ArgType.ANY) {
            sb.append('*');
            return;
        }
        if (type == ArgType.NONE) {
            sb.append('-');
            return;
        }
        appendTypeLetters(sb, type);
    }

    private static void appendTypeLetters(final StringBuilder sb, final int type) {
        for (int i = 0; i < TYPE_BITS.length; i++) {
            if ((type & TYPE_BITS[i]) != 0) {
                sb.append(TYPE_LETTERS[i]);
            }
        }
    }
}
