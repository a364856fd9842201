package org.jfmtcheck.arglist;

import java.util.Objects;

/**
 * Constraint for a run of consecutive arguments.
 *
 * <p>The nested list is owned by this element; copies are always deep.
 */
public final class ConstraintElement {
    private int repeatCount;
    private ArgPresence presence;
    private int type;
    private ConstraintList elementwise;

    public ConstraintElement(
            final int repeatCount, final ArgPresence presence, final int type, final ConstraintList elementwise) {
        this.repeatCount = requirePositive(repeatCount);
        this.presence = Objects.requireNonNull(presence, "presence");
        setConstraint(type, elementwise);
    }

    public static ConstraintElement of(final int repeatCount, final ArgPresence presence, final int type) {
        return new ConstraintElement(repeatCount, presence, type, null);
    }

    public int repeatCount() {
        return repeatCount;
    }

    public ArgPresence presence() {
        return presence;
    }

    public int type() {
        return type;
    }

    public boolean isElementwise() {
        return ArgType.isElementwise(type);
    }

    /**
     * Returns the nested argument list of an elementwise constraint, or {@code null}.
     */
    public ConstraintList elementwise() {
        return elementwise;
    }

    public ConstraintElement copy() {
        return new ConstraintElement(repeatCount, presence, type, elementwise == null ? null : elementwise.copy());
    }

    ConstraintElement copyWithRepeatCount(final int newRepeatCount) {
        final ConstraintElement copy = copy();
        copy.repeatCount = requirePositive(newRepeatCount);
        return copy;
    }

    /**
     * Only {@link Segment} and elements not yet placed in a segment may change the repeat count, otherwise the
     * cached segment length goes stale.
     */
    void repeatCount(final int newRepeatCount) {
        this.repeatCount = requirePositive(newRepeatCount);
    }

    void presence(final ArgPresence newPresence) {
        this.presence = Objects.requireNonNull(newPresence, "presence");
    }

    void setConstraint(final int newType, final ConstraintList newElementwise) {
        ArgType.requireKnown(newType);
        if (ArgType.isElementwise(newType) != (newElementwise != null)) {
            throw new IllegalArgumentException("elementwise list must be present iff the type is elementwise");
        }
        this.type = newType;
        this.elementwise = newElementwise;
    }

    /**
     * Tests whether two normalized constraints are equivalent, ignoring the repeat count.
     */
    public boolean sameConstraint(final ConstraintElement other) {
        return presence == other.presence
                && type == other.type
                && (!isElementwise() || ListSetOperations.equalLists(elementwise, other.elementwise));
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ConstraintElement that)) {
            return false;
        }
        return repeatCount == that.repeatCount && sameConstraint(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(repeatCount, presence, type, elementwise);
    }

    @Override
    public String toString() {
        return repeatCount + "x" + ConstraintListPrinter.printElement(this);
    }

    private static int requirePositive(final int repeatCount) {
        if (repeatCount <= 0) {
            throw new IllegalArgumentException("repeatCount must be > 0: " + repeatCount);
        }
        return repeatCount;
    }
}
