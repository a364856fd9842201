package org.jfmtcheck.obs;

import java.util.Locale;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    /**
     * Parses a level name case-insensitively; blank input means {@link #INFO}.
     */
    public static LogLevel parse(final String name) {
        if (name == null || name.isBlank()) {
            return INFO;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown log level: " + name, e);
        }
    }

    boolean isEnabledFor(final LogLevel minimum) {
        return compareTo(minimum) >= 0;
    }
}
