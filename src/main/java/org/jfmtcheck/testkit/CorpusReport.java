package org.jfmtcheck.testkit;

import java.util.List;
import java.util.Objects;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.jfmtcheck.check.CheckOutcome;
import org.jfmtcheck.check.CheckStatus;

/**
 * Result of running a {@link CheckCorpus}: one entry per case, in corpus order.
 */
public record CorpusReport(String format, List<CaseResult> results) {
    public CorpusReport {
        Objects.requireNonNull(format, "format");
        results = List.copyOf(Objects.requireNonNull(results, "results"));
    }

    public int total() {
        return results.size();
    }

    public int passedCount() {
        int passed = 0;
        for (final CaseResult result : results) {
            if (result.passed()) {
                passed++;
            }
        }
        return passed;
    }

    public int failedCount() {
        return total() - passedCount();
    }

    public boolean allPassed() {
        return failedCount() == 0;
    }

    public List<CaseResult> failures() {
        return results.stream().filter(result -> !result.passed()).toList();
    }

    public BsonDocument toDocument() {
        final BsonArray encodedResults = new BsonArray(results.size());
        for (final CaseResult result : results) {
            encodedResults.add(result.toDocument());
        }
        return new BsonDocument()
                .append("format", new BsonString(format))
                .append(
                        "summary",
                        new BsonDocument()
                                .append("total", new BsonInt32(total()))
                                .append("passed", new BsonInt32(passedCount()))
                                .append("failed", new BsonInt32(failedCount())))
                .append("results", encodedResults);
    }

    public String toJson() {
        return toDocument().toJson();
    }

    public record CaseResult(String caseId, CheckStatus expected, CheckOutcome outcome) {
        public CaseResult {
            Objects.requireNonNull(caseId, "caseId");
            Objects.requireNonNull(expected, "expected");
            Objects.requireNonNull(outcome, "outcome");
        }

        public CheckStatus actual() {
            return outcome.status();
        }

        public boolean passed() {
            return expected == outcome.status();
        }

        BsonDocument toDocument() {
            return new BsonDocument()
                    .append("id", new BsonString(caseId))
                    .append("expected", new BsonString(expected.code()))
                    .append("actual", new BsonString(actual().code()))
                    .append("passed", BsonBoolean.valueOf(passed()))
                    .append("outcome", outcome.toDocument());
        }
    }
}
