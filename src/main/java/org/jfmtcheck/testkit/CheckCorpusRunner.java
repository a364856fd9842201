package org.jfmtcheck.testkit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jfmtcheck.check.CheckOutcome;
import org.jfmtcheck.check.MessagePairChecker;
import org.jfmtcheck.format.FormatStringParsers;
import org.jfmtcheck.obs.CheckJournal;
import org.jfmtcheck.obs.CorrelationContext;
import org.jfmtcheck.obs.JsonLinesLogger;

/**
 * Runs every case of a {@link CheckCorpus} through a {@link MessagePairChecker} and compares the outcome
 * with the expected one.
 */
public final class CheckCorpusRunner {
    private final JsonLinesLogger logger;
    private final CheckJournal journal;

    public CheckCorpusRunner(final JsonLinesLogger logger, final CheckJournal journal) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.journal = journal;
    }

    public CorpusReport run(final CheckCorpus corpus) {
        Objects.requireNonNull(corpus, "corpus");
        final MessagePairChecker checker =
                new MessagePairChecker(FormatStringParsers.forName(corpus.format()), logger, journal);

        final List<CorpusReport.CaseResult> results = new ArrayList<>(corpus.cases().size());
        for (final CheckCorpus.Case item : corpus.cases()) {
            final CorrelationContext context = CorrelationContext.builder(item.id(), "check")
                    .sourceRef(item.sourceRef())
                    .pluralIndex(item.pluralIndex())
                    .build();
            final CheckOutcome outcome = checker.check(context, item.msgid(), item.msgstr());
            final CorpusReport.CaseResult result = new CorpusReport.CaseResult(item.id(), item.expect(), outcome);
            if (!result.passed()) {
                final Map<String, Object> fields = new LinkedHashMap<>();
                fields.put("expected", item.expect().code());
                fields.put("actual", outcome.status().code());
                logger.error("corpus case did not meet its expectation", context, fields);
            }
            results.add(result);
        }

        final CorpusReport report = new CorpusReport(checker.parser().name(), results);
        final Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total", report.total());
        summary.put("failed", report.failedCount());
        logger.info("corpus run finished", CorrelationContext.of("corpus", "run"), summary);
        return report;
    }
}
