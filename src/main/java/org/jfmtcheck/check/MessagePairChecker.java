package org.jfmtcheck.check;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.jfmtcheck.format.FormatDescriptor;
import org.jfmtcheck.format.FormatStringParser;
import org.jfmtcheck.format.ParseResult;
import org.jfmtcheck.obs.CheckJournal;
import org.jfmtcheck.obs.CorrelationContext;
import org.jfmtcheck.obs.JsonLinesLogger;

/**
 * Validates a translated message against its source: both strings are parsed, and if both are valid their
 * argument constraints are compared. A string that does not parse is reported and the pair is skipped.
 */
public final class MessagePairChecker {
    private final FormatStringParser parser;
    private final JsonLinesLogger logger;
    private final CheckJournal journal;

    public MessagePairChecker(final FormatStringParser parser, final JsonLinesLogger logger) {
        this(parser, logger, null);
    }

    public MessagePairChecker(
            final FormatStringParser parser, final JsonLinesLogger logger, final CheckJournal journal) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.journal = journal;
    }

    public FormatStringParser parser() {
        return parser;
    }

    public CheckOutcome check(final CorrelationContext context, final String msgid, final String msgstr) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(msgid, "msgid");
        Objects.requireNonNull(msgstr, "msgstr");

        final CheckOutcome outcome = evaluate(context, msgid, msgstr);
        if (journal != null) {
            final BsonDocument input = new BsonDocument()
                    .append("format", new BsonString(parser.name()))
                    .append("msgid", new BsonString(msgid))
                    .append("msgstr", new BsonString(msgstr));
            journal.record(context, input, outcome.toDocument(), outcome.errorText());
        }
        return outcome;
    }

    private CheckOutcome evaluate(final CorrelationContext context, final String msgid, final String msgstr) {
        final ParseResult source = parser.parse(msgid, false);
        if (source instanceof ParseResult.Invalid invalid) {
            logger.warn(
                    "msgid is not a valid format string, skipping",
                    context.withOperation("parse"),
                    parseFields(invalid));
            return new CheckOutcome(CheckStatus.INVALID_MSGID, invalid.reason(), List.of(), -1, -1, false);
        }
        final FormatDescriptor sourceDescriptor = ((ParseResult.Valid) source).value();
        final boolean unlikely = parser.isUnlikelyIntentional(sourceDescriptor);

        final ParseResult translation = parser.parse(msgstr, true);
        if (translation instanceof ParseResult.Invalid invalid) {
            logger.warn(
                    "msgstr is not a valid format string",
                    context.withOperation("parse"),
                    parseFields(invalid));
            return new CheckOutcome(
                    CheckStatus.INVALID_MSGSTR,
                    invalid.reason(),
                    List.of(),
                    parser.directiveCount(sourceDescriptor),
                    -1,
                    unlikely);
        }
        final FormatDescriptor translationDescriptor = ((ParseResult.Valid) translation).value();

        final List<String> messages = new ArrayList<>();
        final JsonLinesFormatErrorLogger errorLogger =
                new JsonLinesFormatErrorLogger(logger, context.withOperation("check"));
        final boolean hadError = EquivalenceChecker.check(
                sourceDescriptor,
                translationDescriptor,
                true,
                (template, args) -> {
                    messages.add(FormatErrorLogger.render(template, args));
                    errorLogger.error(template, args);
                });

        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("format", parser.name());
        fields.put("equivalent", !hadError);
        logger.debug("checked message pair", context.withOperation("check"), fields);

        return new CheckOutcome(
                hadError ? CheckStatus.NOT_EQUIVALENT : CheckStatus.EQUIVALENT,
                null,
                messages,
                parser.directiveCount(sourceDescriptor),
                parser.directiveCount(translationDescriptor),
                unlikely);
    }

    private Map<String, Object> parseFields(final ParseResult.Invalid invalid) {
        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("format", parser.name());
        fields.put("reason", invalid.reason());
        fields.put("errorOffset", invalid.errorOffset());
        return fields;
    }
}
