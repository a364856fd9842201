package org.jfmtcheck.arglist;

/**
 * Bit masks describing the kinds of values an argument may take.
 *
 * <p>Enum values are not listed separately since they can be formatted with any specifier available for
 * their base type.
 */
public final class ArgType {
    public static final int NONE = 0;
    public static final int BOOL = 1;
    public static final int INTEGER = 1 << 1;
    public static final int FLOATING_POINT = 1 << 2;
    public static final int CHAR = 1 << 3;
    /** String or array. */
    public static final int ARRAY = 1 << 4;
    public static final int ASSOCIATIVE = 1 << 5;
    /** Input range or SIMD vector. */
    public static final int IRANGE = 1 << 6;
    /** Struct, class or union. */
    public static final int STRUCT = 1 << 7;
    /** Pointer or null. */
    public static final int POINTER = 1 << 8;
    public static final int ANY =
            BOOL | INTEGER | FLOATING_POINT | CHAR | ARRAY | ASSOCIATIVE | IRANGE | STRUCT | POINTER;

    /** Flag: the argument is formatted element by element through a nested argument list. */
    public static final int ELEMENTWISE = 1 << 10;
    /** Compound specifier whose body consumes one argument per element. */
    public static final int ELEMENTWISE_1 = ELEMENTWISE | ARRAY | IRANGE;
    /** Compound specifier whose body consumes a key and a value per element. */
    public static final int ELEMENTWISE_2 = ELEMENTWISE | ASSOCIATIVE;

    private ArgType() {}

    public static boolean isElementwise(final int type) {
        return (type & ELEMENTWISE) != 0;
    }

    static void requireKnown(final int type) {
        if ((type & ~(ANY | ELEMENTWISE)) != 0) {
            throw new IllegalArgumentException("unknown argument type bits: 0x" + Integer.toHexString(type));
        }
    }
}
