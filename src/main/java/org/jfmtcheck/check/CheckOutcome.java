package org.jfmtcheck.check;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;

/**
 * Result of {@link MessagePairChecker#check}.
 *
 * @param reason parse diagnostic for the invalid statuses
 * @param messages rendered mismatch reports
 * @param sourceDirectives directive count of the source, or -1 if it did not parse
 * @param translationDirectives directive count of the translation, or -1 if it did not parse or was not parsed
 */
public record CheckOutcome(
        CheckStatus status,
        String reason,
        List<String> messages,
        int sourceDirectives,
        int translationDirectives,
        boolean unlikelyIntentional) {
    public CheckOutcome {
        Objects.requireNonNull(status, "status");
        messages = List.copyOf(Objects.requireNonNull(messages, "messages"));
        if ((status == CheckStatus.INVALID_MSGID || status == CheckStatus.INVALID_MSGSTR) && reason == null) {
            throw new IllegalArgumentException("reason is required for status " + status.code());
        }
    }

    public boolean hadError() {
        return status != CheckStatus.EQUIVALENT;
    }

    public Optional<String> reasonText() {
        return Optional.ofNullable(reason);
    }

    /**
     * A one-line description of the problem, or {@code null} for an equivalent pair.
     */
    public String errorText() {
        if (reason != null) {
            return reason;
        }
        return messages.isEmpty() ? null : String.join("; ", messages);
    }

    public BsonDocument toDocument() {
        final BsonArray encodedMessages = new BsonArray();
        for (String message : messages) {
            encodedMessages.add(new BsonString(message));
        }
        final BsonDocument document = new BsonDocument()
                .append("status", new BsonString(status.code()))
                .append("sourceDirectives", new BsonInt32(sourceDirectives))
                .append("translationDirectives", new BsonInt32(translationDirectives))
                .append("unlikelyIntentional", BsonBoolean.valueOf(unlikelyIntentional))
                .append("messages", encodedMessages);
        if (reason != null) {
            document.append("reason", new BsonString(reason));
        }
        return document;
    }
}
