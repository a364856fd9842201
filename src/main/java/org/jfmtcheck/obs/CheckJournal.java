package org.jfmtcheck.obs;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonString;

/**
 * Fixed-capacity ring buffer of recently checked message pairs for diagnostics.
 */
public final class CheckJournal {
    public static final int DEFAULT_CAPACITY = 256;
    private static final BsonString UNKNOWN_STATUS = new BsonString("unknown");

    private final int capacity;
    private final Deque<Entry> entries;
    private long nextSequence;
    private long droppedCount;

    public CheckJournal() {
        this(DEFAULT_CAPACITY);
    }

    public CheckJournal(final int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be greater than zero");
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
        this.nextSequence = 1L;
    }

    public int capacity() {
        return capacity;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long droppedCount() {
        return droppedCount;
    }

    public synchronized List<Entry> entries() {
        return List.copyOf(entries);
    }

    /**
     * Records one check.
     *
     * @param input the checked strings
     * @param outcome the outcome document, carrying at least a {@code status} field
     * @param error the reported mismatch or parse problem, if any
     */
    public synchronized void record(
            final CorrelationContext correlationContext,
            final BsonDocument input,
            final BsonDocument outcome,
            final String error) {
        final Entry entry = new Entry(
                nextSequence++,
                Objects.requireNonNull(correlationContext, "correlationContext"),
                Objects.requireNonNull(input, "input").clone(),
                Objects.requireNonNull(outcome, "outcome").clone(),
                normalize(error));

        if (entries.size() == capacity) {
            entries.removeFirst();
            droppedCount++;
        }
        entries.addLast(entry);
    }

    public synchronized void clear() {
        entries.clear();
        droppedCount = 0L;
    }

    private static String normalize(final String error) {
        if (error == null) {
            return null;
        }
        final String trimmed = error.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Entry {
        private final long sequence;
        private final CorrelationContext correlationContext;
        private final BsonDocument input;
        private final BsonDocument outcome;
        private final String error;

        private Entry(
                final long sequence,
                final CorrelationContext correlationContext,
                final BsonDocument input,
                final BsonDocument outcome,
                final String error) {
            this.sequence = sequence;
            this.correlationContext = correlationContext;
            this.input = input;
            this.outcome = outcome;
            this.error = error;
        }

        public long sequence() {
            return sequence;
        }

        public CorrelationContext correlationContext() {
            return correlationContext;
        }

        public BsonDocument input() {
            return input.clone();
        }

        public BsonDocument outcome() {
            return outcome.clone();
        }

        public String status() {
            return outcome.getString("status", UNKNOWN_STATUS).getValue();
        }

        public String error() {
            return error;
        }

        public boolean failed() {
            return error != null;
        }
    }
}
