package org.jfmtcheck.testkit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.bson.BsonDocument;
import org.jfmtcheck.check.CheckStatus;
import org.jfmtcheck.obs.CheckJournal;
import org.jfmtcheck.obs.JsonLinesLogger;
import org.jfmtcheck.obs.LogLevel;
import org.jfmtcheck.obs.StructuredJsonLinesLogger;
import org.junit.jupiter.api.Test;

class CheckCorpusRunnerTest {
    @Test
    void everyCaseOfBasicCorporaMeetsItsExpectation() throws Exception {
        for (final String name : new String[] {"d-basic.yaml", "d-basic.json"}) {
            final CheckCorpus corpus = CheckCorpusLoader.load(Path.of("src/test/resources/corpus", name));

            final CorpusReport report = new CheckCorpusRunner(JsonLinesLogger.noop(), null).run(corpus);

            assertTrue(report.allPassed(), () -> name + ": " + report.failures());
            assertEquals(corpus.cases().size(), report.total());
            assertEquals("d", report.format());
        }
    }

    @Test
    void unmetExpectationIsReportedAndLogged() throws Exception {
        final ByteArrayOutputStream logs = new ByteArrayOutputStream();
        final StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(
                logs, Clock.fixed(Instant.parse("2026-05-05T10:00:00Z"), ZoneOffset.UTC), LogLevel.INFO);
        final CheckJournal journal = new CheckJournal(4);
        final CheckCorpus corpus = CheckCorpusLoader.load(Path.of("src/test/resources/corpus/d-failing.yaml"));

        final CorpusReport report = new CheckCorpusRunner(logger, journal).run(corpus);

        assertFalse(report.allPassed());
        assertEquals(1, report.failedCount());
        final CorpusReport.CaseResult failure = report.failures().get(0);
        assertEquals("wrong-expectation", failure.caseId());
        assertEquals(CheckStatus.NOT_EQUIVALENT, failure.actual());
        assertEquals(1, journal.size());

        final BsonDocument document = BsonDocument.parse(report.toJson());
        assertEquals(1, document.getDocument("summary").getInt32("failed").getValue());
        final BsonDocument result = document.getArray("results").get(0).asDocument();
        assertEquals("ok", result.getString("expected").getValue());
        assertEquals("mismatch", result.getString("actual").getValue());
        assertFalse(result.getBoolean("passed").getValue());

        final String logText = logs.toString(StandardCharsets.UTF_8);
        assertTrue(logText.contains("\"message\":\"corpus case did not meet its expectation\""), logText);
        assertTrue(logText.contains("\"message\":\"corpus run finished\""), logText);
    }
}
