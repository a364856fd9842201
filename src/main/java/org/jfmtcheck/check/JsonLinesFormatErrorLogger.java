package org.jfmtcheck.check;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jfmtcheck.obs.CorrelationContext;
import org.jfmtcheck.obs.JsonLinesLogger;

/**
 * Forwards checker mismatch reports to a {@link JsonLinesLogger} as ERROR events.
 */
public final class JsonLinesFormatErrorLogger implements FormatErrorLogger {
    private final JsonLinesLogger logger;
    private final CorrelationContext correlationContext;

    public JsonLinesFormatErrorLogger(final JsonLinesLogger logger, final CorrelationContext correlationContext) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.correlationContext = Objects.requireNonNull(correlationContext, "correlationContext");
    }

    @Override
    public void error(final String template, final Object... args) {
        Objects.requireNonNull(template, "template");
        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("template", template);
        fields.put("args", Arrays.asList(args));
        logger.error(FormatErrorLogger.render(template, args), correlationContext, fields);
    }
}
