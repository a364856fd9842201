package org.jfmtcheck.arglist;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ListSetOperationsTest {
    private static final ConstraintElement REQUIRED_INT = ConstraintElement.of(1, ArgPresence.REQUIRED, ArgType.INTEGER);
    private static final ConstraintElement REQUIRED_CHAR = ConstraintElement.of(1, ArgPresence.REQUIRED, ArgType.CHAR);
    private static final ConstraintElement OPTIONAL_INT = ConstraintElement.of(1, ArgPresence.OPTIONAL, ArgType.INTEGER);
    private static final ConstraintElement OPTIONAL_CHAR = ConstraintElement.of(1, ArgPresence.OPTIONAL, ArgType.CHAR);
    private static final ConstraintElement REQUIRED_NUMERIC = ConstraintElement.of(
            1, ArgPresence.REQUIRED, ArgType.BOOL | ArgType.INTEGER | ArgType.CHAR);
    private static final ConstraintElement OPTIONAL_ANY = ConstraintElement.of(1, ArgPresence.OPTIONAL, ArgType.ANY);

    @Test
    void intersectionWithUnconstrainedListIsIdentity() {
        final ConstraintList list = ListAlgebra.normalize(
                ConstraintList.of(List.of(REQUIRED_INT), List.of(OPTIONAL_CHAR)));

        final ListOutcome outcome = ListSetOperations.intersect(list.copy(), ConstraintList.unconstrained());

        assertEquals(list, outcome.list());
    }

    @Test
    void intersectionIsCommutative() {
        final ConstraintList first = ConstraintList.of(List.of(REQUIRED_INT, OPTIONAL_CHAR), List.of());
        final ConstraintList second = ConstraintList.of(List.of(REQUIRED_NUMERIC), List.of(OPTIONAL_ANY));

        final ConstraintList forward = ListSetOperations.intersect(first.copy(), second.copy()).list();
        final ConstraintList backward = ListSetOperations.intersect(second.copy(), first.copy()).list();

        assertEquals(forward, backward);
        assertEquals("(i . c)", ConstraintListPrinter.print(forward));
    }

    @Test
    void intersectionOfInfiniteListsWithDifferentPeriods() {
        final ConstraintList first = ConstraintList.of(List.of(), List.of(OPTIONAL_ANY));
        final ConstraintList second = ConstraintList.of(List.of(), List.of(OPTIONAL_INT, OPTIONAL_CHAR));

        final ConstraintList result = ListSetOperations.intersect(first, second).list();

        assertEquals("( | . i . c)", ConstraintListPrinter.print(result));
        result.verify();
    }

    @Test
    void incompatibleRequiredPositionIsContradiction() {
        final ConstraintList first = ConstraintList.of(List.of(REQUIRED_INT), List.of());
        final ConstraintList second = ConstraintList.of(List.of(REQUIRED_CHAR), List.of());

        assertTrue(ListSetOperations.intersect(first, second).isContradiction());
    }

    @Test
    void incompatibleOptionalPositionEndsIntersection() {
        final ConstraintList first = ConstraintList.of(List.of(REQUIRED_INT, OPTIONAL_INT), List.of());
        final ConstraintList second = ConstraintList.of(List.of(REQUIRED_INT, OPTIONAL_CHAR), List.of());

        final ConstraintList result = ListSetOperations.intersect(first, second).list();

        assertEquals("(i)", ConstraintListPrinter.print(result));
    }

    @Test
    void contradictionIsAbsorbing() {
        final ListOutcome outcome = ListSetOperations.intersection(
                ListOutcome.contradiction(), ListOutcome.of(ConstraintList.unconstrained()));

        assertTrue(outcome.isContradiction());
        assertTrue(outcome.asOptional().isEmpty());
    }

    @Test
    void intersectionWithEmptyListDependsOnFirstPresence() {
        final ConstraintList required = ConstraintList.of(List.of(REQUIRED_INT), List.of());

        assertTrue(ListSetOperations.intersectWithEmptyList(required).isContradiction());
        assertTrue(ListSetOperations.intersectWithEmptyList(ConstraintList.unconstrained()).list().isEmpty());
    }

    @Test
    void unionWithEmptyListDemotesFirstPosition() {
        final ConstraintList list = ConstraintList.of(
                List.of(ConstraintElement.of(2, ArgPresence.REQUIRED, ArgType.INTEGER)), List.of());

        final ConstraintList result = ListSetOperations.unionWithEmptyList(list);

        assertEquals("(. i i)", ConstraintListPrinter.print(result));
        assertEquals(ArgPresence.OPTIONAL, result.initial().get(0).presence());
    }

    @Test
    void unionWithEmptyListKeepsOptionalList() {
        final ConstraintList result = ListSetOperations.unionWithEmptyList(ConstraintList.unconstrained());

        assertEquals(ConstraintList.unconstrained(), result);
    }

    @Test
    void elementIntersectionPrefersSpecificSideOfAnyType() {
        final ConstraintList nested = ConstraintList.of(List.of(REQUIRED_INT), List.of());
        final ConstraintElement elementwise =
                new ConstraintElement(1, ArgPresence.OPTIONAL, ArgType.ELEMENTWISE_1, nested);

        final ConstraintElement combined =
                ListSetOperations.intersectElements(requiredAny(), elementwise, 2).orElseThrow();

        assertEquals(ArgType.ELEMENTWISE_1, combined.type());
        assertEquals(ArgPresence.REQUIRED, combined.presence());
        assertEquals(2, combined.repeatCount());
        assertEquals(nested, combined.elementwise());
        assertNotSame(nested, combined.elementwise());
    }

    @Test
    void elementIntersectionRejectsDifferentElementwiseArity() {
        final ConstraintList one = ConstraintList.of(List.of(REQUIRED_INT), List.of());
        final ConstraintList two = ConstraintList.of(List.of(REQUIRED_INT, REQUIRED_INT), List.of());

        final Optional<ConstraintElement> combined = ListSetOperations.intersectElements(
                new ConstraintElement(1, ArgPresence.REQUIRED, ArgType.ELEMENTWISE_1, one),
                new ConstraintElement(1, ArgPresence.REQUIRED, ArgType.ELEMENTWISE_2, two),
                1);

        assertFalse(combined.isPresent());
    }

    @Test
    void elementIntersectionOfElementwiseListsIntersectsNestedLists() {
        final ConstraintList numeric = ConstraintList.of(List.of(REQUIRED_NUMERIC), List.of());
        final ConstraintList character = ConstraintList.of(List.of(REQUIRED_CHAR), List.of());

        final ConstraintElement combined = ListSetOperations.intersectElements(
                        new ConstraintElement(1, ArgPresence.REQUIRED, ArgType.ELEMENTWISE_1, numeric),
                        new ConstraintElement(1, ArgPresence.OPTIONAL, ArgType.ELEMENTWISE_1, character),
                        1)
                .orElseThrow();

        assertEquals("(c)", ConstraintListPrinter.print(combined.elementwise()));
    }

    @Test
    void equalListsComparesCanonicalForms() {
        final ConstraintList merged = ConstraintList.of(
                List.of(ConstraintElement.of(2, ArgPresence.REQUIRED, ArgType.INTEGER)), List.of());
        final ConstraintList split = ConstraintList.of(List.of(REQUIRED_INT, REQUIRED_INT), List.of());

        assertFalse(ListSetOperations.equalLists(merged, split));
        assertTrue(ListSetOperations.equalLists(merged, ListAlgebra.normalize(split)));
    }

    @Test
    void gcdOfLoopPeriods() {
        assertEquals(2, ListSetOperations.gcd(4, 6));
        assertEquals(1, ListSetOperations.gcd(3, 5));
    }

    private static ConstraintElement requiredAny() {
        return ConstraintElement.of(1, ArgPresence.REQUIRED, ArgType.ANY);
    }
}
