package org.jfmtcheck.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Correlation metadata emitted with every structured log event: which message entry is being processed,
 * and in which step.
 */
public final class CorrelationContext {
    private final String entryId;
    private final String operation;
    private final String sourceRef;
    private final Integer pluralIndex;

    private CorrelationContext(Builder builder) {
        this.entryId = requireText(builder.entryId, "entryId");
        this.operation = requireText(builder.operation, "operation");
        this.sourceRef = normalize(builder.sourceRef);
        if (builder.pluralIndex != null && builder.pluralIndex < 0) {
            throw new IllegalArgumentException("pluralIndex must be >= 0");
        }
        this.pluralIndex = builder.pluralIndex;
    }

    public static CorrelationContext of(String entryId, String operation) {
        return builder(entryId, operation).build();
    }

    public static Builder builder(String entryId, String operation) {
        return new Builder(entryId, operation);
    }

    public String entryId() {
        return entryId;
    }

    public String operation() {
        return operation;
    }

    /**
     * Location of the entry in its catalog, e.g. {@code app.po:42}.
     */
    public Optional<String> sourceRef() {
        return Optional.ofNullable(sourceRef);
    }

    public Optional<Integer> pluralIndex() {
        return Optional.ofNullable(pluralIndex);
    }

    public CorrelationContext withOperation(String newOperation) {
        return builder(entryId, newOperation).sourceRef(sourceRef).pluralIndex(pluralIndex).build();
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("entryId", entryId);
        fields.put("operation", operation);
        if (sourceRef != null) {
            fields.put("sourceRef", sourceRef);
        }
        if (pluralIndex != null) {
            fields.put("pluralIndex", pluralIndex);
        }
        return fields;
    }

    @Override
    public String toString() {
        return "CorrelationContext" + asFields();
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String entryId;
        private final String operation;
        private String sourceRef;
        private Integer pluralIndex;

        private Builder(String entryId, String operation) {
            this.entryId = Objects.requireNonNull(entryId, "entryId");
            this.operation = Objects.requireNonNull(operation, "operation");
        }

        public Builder sourceRef(String sourceRef) {
            this.sourceRef = sourceRef;
            return this;
        }

        public Builder pluralIndex(Integer pluralIndex) {
            this.pluralIndex = pluralIndex;
            return this;
        }

        public CorrelationContext build() {
            return new CorrelationContext(this);
        }
    }
}
