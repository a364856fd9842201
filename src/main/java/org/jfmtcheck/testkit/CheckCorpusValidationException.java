package org.jfmtcheck.testkit;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Thrown when a corpus file has cases that cannot be read or that break the corpus rules. Carries every issue
 * found, so one run reports all of them.
 */
public final class CheckCorpusValidationException extends IllegalArgumentException {
    private final String sourceName;
    private final List<CorpusIssue> issues;

    public CheckCorpusValidationException(final String sourceName, final List<CorpusIssue> issues) {
        super(formatMessage(sourceName, issues));
        this.sourceName = sourceName;
        this.issues = List.copyOf(issues);
    }

    public String sourceName() {
        return sourceName;
    }

    public List<CorpusIssue> issues() {
        return issues;
    }

    public List<String> errors() {
        return issues.stream().map(CorpusIssue::render).toList();
    }

    /**
     * Ids of the cases that have at least one issue, in corpus order.
     */
    public Set<String> failingCaseIds() {
        final Set<String> ids = new LinkedHashSet<>();
        for (final CorpusIssue issue : issues) {
            if (issue.caseId() != null) {
                ids.add(issue.caseId());
            }
        }
        return Collections.unmodifiableSet(ids);
    }

    private static String formatMessage(final String sourceName, final List<CorpusIssue> issues) {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(issues, "issues");
        final StringBuilder sb = new StringBuilder("check corpus ")
                .append(sourceName)
                .append(" is invalid (")
                .append(issues.size())
                .append(" issue(s))");
        for (final CorpusIssue issue : issues) {
            sb.append('\n').append("- ").append(issue.render());
        }
        return sb.toString();
    }
}
