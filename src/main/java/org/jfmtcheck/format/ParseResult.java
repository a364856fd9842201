package org.jfmtcheck.format;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of parsing one candidate format string.
 */
public interface ParseResult {

    List<DirectiveIndicator> indicators();

    boolean isValid();

    Optional<FormatDescriptor> descriptor();

    record Valid(FormatDescriptor value, List<DirectiveIndicator> indicators) implements ParseResult {
        public Valid {
            Objects.requireNonNull(value, "value");
            indicators = List.copyOf(Objects.requireNonNull(indicators, "indicators"));
        }

        @Override
        public boolean isValid() {
            return true;
        }

        @Override
        public Optional<FormatDescriptor> descriptor() {
            return Optional.of(value);
        }
    }

    /**
     * A rejected string. {@code errorOffset} is the offset where the problem was recognized, or {@code -1}
     * when the problem is not tied to a single place, as for contradictory argument types.
     */
    record Invalid(String reason, int errorOffset, List<DirectiveIndicator> indicators) implements ParseResult {
        public Invalid {
            Objects.requireNonNull(reason, "reason");
            if (errorOffset < -1) {
                throw new IllegalArgumentException("errorOffset must be >= -1");
            }
            indicators = List.copyOf(Objects.requireNonNull(indicators, "indicators"));
        }

        @Override
        public boolean isValid() {
            return false;
        }

        @Override
        public Optional<FormatDescriptor> descriptor() {
            return Optional.empty();
        }
    }
}
