package org.jfmtcheck.check;

import java.util.Objects;
import org.jfmtcheck.arglist.ConstraintList;
import org.jfmtcheck.arglist.ListAlgebra;
import org.jfmtcheck.arglist.ListOutcome;
import org.jfmtcheck.arglist.ListSetOperations;
import org.jfmtcheck.format.FormatDescriptor;

/**
 * Compares the argument constraints of a source string and its translation.
 *
 * <p>Unconsumed trailing arguments are a runtime error in D, so a translation must take exactly the
 * arguments of its source. {@link #check} therefore always compares for equality; the lax subset comparison
 * is kept as {@link #checkSubset} for callers that want it explicitly.
 */
public final class EquivalenceChecker {
    static final String NOT_EQUIVALENT = "format specifications in '%s' and '%s' are not equivalent";
    static final String NOT_SUBSET = "format specifications in '%s' are not a subset of those in '%s'";

    private EquivalenceChecker() {
    }

    public static boolean check(
            final FormatDescriptor source,
            final FormatDescriptor translation,
            final boolean equality,
            final FormatErrorLogger logger) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(translation, "translation");
        return check(source, translation, equality, logger, source.format(), translation.format());
    }

    /**
     * Checks a pair of descriptors and reports a mismatch to {@code logger}.
     *
     * @param equality requested comparison; ignored, the comparison is always strict
     * @return whether an error was reported
     */
    public static boolean check(
            final FormatDescriptor source,
            final FormatDescriptor translation,
            final boolean equality,
            final FormatErrorLogger logger,
            final String prettySource,
            final String prettyTranslation) {
        return checkEquivalent(source, translation, logger, prettySource, prettyTranslation);
    }

    public static boolean checkEquivalent(
            final FormatDescriptor source,
            final FormatDescriptor translation,
            final FormatErrorLogger logger,
            final String prettySource,
            final String prettyTranslation) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(translation, "translation");
        Objects.requireNonNull(logger, "logger");

        if (ListSetOperations.equalLists(source.constraints(), translation.constraints())) {
            return false;
        }
        logger.error(NOT_EQUIVALENT, prettySource, prettyTranslation);
        return true;
    }

    /**
     * Accepts a translation whose arguments are compatible with the source: intersecting both constraint
     * lists must give back the translation's own list.
     */
    public static boolean checkSubset(
            final FormatDescriptor source,
            final FormatDescriptor translation,
            final FormatErrorLogger logger,
            final String prettySource,
            final String prettyTranslation) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(translation, "translation");
        Objects.requireNonNull(logger, "logger");

        final ConstraintList translated = translation.constraints();
        final ListOutcome intersection = ListSetOperations.intersect(source.constraints(), translation.constraints());
        final boolean subset = !intersection.isContradiction()
                && ListSetOperations.equalLists(ListAlgebra.normalize(intersection.list()), translated);
        if (subset) {
            return false;
        }
        logger.error(NOT_SUBSET, prettyTranslation, prettySource);
        return true;
    }
}
