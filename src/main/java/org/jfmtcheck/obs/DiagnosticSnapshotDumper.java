package org.jfmtcheck.obs;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonString;

/**
 * Serializes a {@link CheckJournal} into deterministic BSON/JSON snapshot payloads.
 */
public final class DiagnosticSnapshotDumper {

    public BsonDocument dumpDocument(final CheckJournal journal) {
        Objects.requireNonNull(journal, "journal");

        final List<CheckJournal.Entry> entries = journal.entries();
        final BsonArray encodedEntries = new BsonArray(entries.size());
        final Map<String, Integer> statusCounts = new TreeMap<>();
        int failed = 0;
        for (CheckJournal.Entry entry : entries) {
            encodedEntries.add(toDocument(entry));
            statusCounts.merge(entry.status(), 1, Integer::sum);
            if (entry.failed()) {
                failed++;
            }
        }

        final BsonDocument byStatus = new BsonDocument();
        statusCounts.forEach((status, count) -> byStatus.append(status, new BsonInt32(count)));

        return new BsonDocument()
                .append(
                        "journal",
                        new BsonDocument()
                                .append("capacity", new BsonInt32(journal.capacity()))
                                .append("size", new BsonInt32(entries.size()))
                                .append("dropped", new BsonInt64(journal.droppedCount()))
                                .append("entries", encodedEntries))
                .append(
                        "summary",
                        new BsonDocument()
                                .append("failed", new BsonInt32(failed))
                                .append("byStatus", byStatus));
    }

    public String dumpJson(final CheckJournal journal) {
        return dumpDocument(journal).toJson();
    }

    private static BsonDocument toDocument(final CheckJournal.Entry entry) {
        final CorrelationContext correlation = entry.correlationContext();
        final BsonDocument encoded = new BsonDocument()
                .append("sequence", new BsonInt64(entry.sequence()))
                .append("entryId", new BsonString(correlation.entryId()))
                .append("operation", new BsonString(correlation.operation()))
                .append("failed", BsonBoolean.valueOf(entry.failed()))
                .append("input", entry.input())
                .append("outcome", entry.outcome());

        correlation.sourceRef().ifPresent(sourceRef -> encoded.append("sourceRef", new BsonString(sourceRef)));
        correlation.pluralIndex().ifPresent(index -> encoded.append("pluralIndex", new BsonInt32(index)));

        final String error = entry.error();
        if (error != null) {
            encoded.append("error", new BsonString(error));
        }
        return encoded;
    }
}
