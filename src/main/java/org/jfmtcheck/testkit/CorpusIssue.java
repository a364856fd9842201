package org.jfmtcheck.testkit;

import java.util.Objects;

/**
 * One problem found in a check corpus.
 *
 * @param path location in the corpus, e.g. {@code cases[3].expect}
 * @param caseId id of the case the problem belongs to; {@code null} for corpus-level problems or when the
 *     case has no readable id
 * @param message self-contained description, including the path
 */
public record CorpusIssue(String path, String caseId, String message) {
    public CorpusIssue {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(message, "message");
    }

    static CorpusIssue corpusLevel(final String path, final String message) {
        return new CorpusIssue(path, null, message);
    }

    public String render() {
        return caseId == null ? message : message + " [case " + caseId + "]";
    }
}
