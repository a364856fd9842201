package org.jfmtcheck.obs;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * JSON-lines logger for check diagnostics. Events below the minimum level are dropped; keys of nested
 * objects are written in sorted order so that output is reproducible.
 */
public final class StructuredJsonLinesLogger implements JsonLinesLogger {
    private final Writer writer;
    private final Clock clock;
    private final LogLevel minimumLevel;
    private final boolean autoFlush;
    private boolean closed;

    public StructuredJsonLinesLogger(OutputStream outputStream) {
        this(outputStream, Clock.systemUTC(), LogLevel.INFO);
    }

    public StructuredJsonLinesLogger(OutputStream outputStream, Clock clock, LogLevel minimumLevel) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), clock, minimumLevel, true);
    }

    public StructuredJsonLinesLogger(Writer writer, Clock clock, LogLevel minimumLevel, boolean autoFlush) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.minimumLevel = Objects.requireNonNull(minimumLevel, "minimumLevel");
        this.autoFlush = autoFlush;
    }

    @Override
    public synchronized void log(
        LogLevel level,
        String message,
        CorrelationContext correlationContext,
        Map<String, ?> fields
    ) {
        ensureOpen();
        LogLevel safeLevel = level == null ? LogLevel.INFO : level;
        if (!safeLevel.isEnabledFor(minimumLevel)) {
            return;
        }
        CorrelationContext safeCorrelation = Objects.requireNonNull(correlationContext, "correlationContext");

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("timestamp", Instant.now(clock).toString());
        event.put("level", safeLevel.name());
        event.put("message", message == null ? "" : message);
        event.putAll(safeCorrelation.asFields());
        if (fields != null) {
            for (Map.Entry<String, ?> entry : fields.entrySet()) {
                String key = entry.getKey();
                // Reserved keys keep their values.
                if (key == null || key.isBlank() || event.containsKey(key)) {
                    continue;
                }
                event.put(key, entry.getValue());
            }
        }

        writeLine(JsonEncoder.encodeEvent(event));
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.flush();
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close logger writer", e);
        }
    }

    private void writeLine(String encoded) {
        try {
            writer.write(encoded);
            writer.write('\n');
            if (autoFlush) {
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write log event", e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("logger is already closed");
        }
    }

    static final class JsonEncoder {
        private JsonEncoder() {
        }

        /**
         * Encodes the top-level event keeping its insertion order.
         */
        static String encodeEvent(Map<String, Object> event) {
            StringBuilder sb = new StringBuilder();
            appendEntries(sb, event);
            return sb.toString();
        }

        static String encode(Object value) {
            StringBuilder sb = new StringBuilder();
            appendValue(sb, value);
            return sb.toString();
        }

        private static void appendValue(StringBuilder sb, Object value) {
            if (value == null) {
                sb.append("null");
            } else if (value instanceof String s) {
                appendString(sb, s);
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else if (value instanceof Enum<?> e) {
                appendString(sb, e.name());
            } else if (value instanceof Map<?, ?> map) {
                Map<String, Object> sorted = new TreeMap<>();
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    sorted.put(String.valueOf(entry.getKey()), entry.getValue());
                }
                appendEntries(sb, sorted);
            } else if (value instanceof Collection<?> collection) {
                sb.append('[');
                boolean first = true;
                for (Object item : collection) {
                    if (!first) {
                        sb.append(',');
                    }
                    first = false;
                    appendValue(sb, item);
                }
                sb.append(']');
            } else {
                appendString(sb, String.valueOf(value));
            }
        }

        private static void appendEntries(StringBuilder sb, Map<String, Object> entries) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<String, Object> entry : entries.entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                appendString(sb, entry.getKey());
                sb.append(':');
                appendValue(sb, entry.getValue());
            }
            sb.append('}');
        }

        private static void appendString(StringBuilder sb, String value) {
            sb.append('"');
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                switch (c) {
                    case '"' -> sb.append("\\\"");
                    case '\\' -> sb.append("\\\\");
                    case '\b' -> sb.append("\\b");
                    case '\f' -> sb.append("\\f");
                    case '\n' -> sb.append("\\n");
                    case '\r' -> sb.append("\\r");
                    case '\t' -> sb.append("\\t");
                    default -> {
                        if (c <= 0x1F) {
                            sb.append(String.format("\\u%04x", (int) c));
                        } else {
                            sb.append(c);
                        }
                    }
                }
            }
            sb.append('"');
        }
    }
}
