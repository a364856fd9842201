package org.jfmtcheck.obs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CorrelationContextTest {
    @Test
    void optionalFieldsAreOmittedWhenBlank() {
        final CorrelationContext context = CorrelationContext.builder(" e1 ", "check").sourceRef("  ").build();

        assertEquals("e1", context.entryId());
        assertTrue(context.sourceRef().isEmpty());
        assertEquals(List.of("entryId", "operation"), List.copyOf(context.asFields().keySet()));
    }

    @Test
    void withOperationKeepsOtherFields() {
        final CorrelationContext context = CorrelationContext.builder("e1", "check")
                .sourceRef("app.po:3")
                .pluralIndex(2)
                .build()
                .withOperation("parse");

        assertEquals("parse", context.operation());
        assertEquals(Optional.of("app.po:3"), context.sourceRef());
        assertEquals(Optional.of(2), context.pluralIndex());
    }

    @Test
    void rejectsBlankIdentifiersAndNegativePluralIndex() {
        assertThrows(IllegalArgumentException.class, () -> CorrelationContext.of(" ", "check"));
        assertThrows(IllegalArgumentException.class, () -> CorrelationContext.of("e1", ""));
        assertThrows(
                IllegalArgumentException.class,
                () -> CorrelationContext.builder("e1", "check").pluralIndex(-1).build());
    }
}
