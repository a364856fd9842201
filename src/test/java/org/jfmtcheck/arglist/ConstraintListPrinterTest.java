package org.jfmtcheck.arglist;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class ConstraintListPrinterTest {
    @Test
    void printsEmptyAndUnconstrainedLists() {
        assertEquals("()", ConstraintListPrinter.print(ConstraintList.empty()));
        assertEquals("( | . *)", ConstraintListPrinter.print(ConstraintList.unconstrained()));
    }

    @Test
    void printsTypeLettersInFixedOrder() {
        final ConstraintList list = ConstraintList.of(
                List.of(ConstraintElement.of(
                        1, ArgPresence.REQUIRED, ArgType.POINTER | ArgType.CHAR | ArgType.BOOL | ArgType.INTEGER)),
                List.of());

        assertEquals("(bicp)", ConstraintListPrinter.print(list));
    }

    @Test
    void printsElementwiseListsAfterArity() {
        final ConstraintList pair = ConstraintList.of(
                List.of(ConstraintElement.of(2, ArgPresence.REQUIRED, ArgType.ANY)), List.of());
        final ConstraintList list = ConstraintList.of(
                List.of(new ConstraintElement(1, ArgPresence.OPTIONAL, ArgType.ELEMENTWISE_2, pair)), List.of());

        assertEquals("(. 2(* *))", ConstraintListPrinter.print(list));
        assertEquals("1x. 2(* *)", list.initial().get(0).toString());
    }
}
