package org.jfmtcheck.testkit;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.jfmtcheck.format.FormatStringParsers;

/**
 * Static validator for {@link CheckCorpus}.
 */
public final class CheckCorpusValidator {
    private static final Pattern CASE_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9._-]+$");

    private CheckCorpusValidator() {}

    public static void validateOrThrow(final CheckCorpus corpus, final String sourceName) {
        final List<CorpusIssue> issues = validate(corpus);
        if (!issues.isEmpty()) {
            throw new CheckCorpusValidationException(sourceName, issues);
        }
    }

    public static List<CorpusIssue> validate(final CheckCorpus corpus) {
        Objects.requireNonNull(corpus, "corpus");
        final List<CorpusIssue> issues = new ArrayList<>();

        if (!CheckCorpus.SCHEMA_VERSION.equals(corpus.schemaVersion())) {
            issues.add(CorpusIssue.corpusLevel("schemaVersion", "schemaVersion must be '"
                    + CheckCorpus.SCHEMA_VERSION + "' (actual: " + corpus.schemaVersion() + ")"));
        }
        try {
            FormatStringParsers.forName(corpus.format());
        } catch (final IllegalArgumentException e) {
            issues.add(CorpusIssue.corpusLevel("format", "format is not supported: " + corpus.format()));
        }
        if (corpus.cases().isEmpty()) {
            issues.add(CorpusIssue.corpusLevel("cases", "cases must not be empty"));
        }

        final Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < corpus.cases().size(); i++) {
            final CheckCorpus.Case item = corpus.cases().get(i);
            final String path = CheckCorpus.casePath(i);
            if (!CASE_ID_PATTERN.matcher(item.id()).matches()) {
                issues.add(new CorpusIssue(path + ".id", item.id(),
                        path + ".id may contain only letters, numbers, dot, underscore, and hyphen"));
            }
            if (!seenIds.add(item.id())) {
                issues.add(new CorpusIssue(path + ".id", item.id(), path + ".id is duplicated"));
            }
            if (item.pluralIndex() != null && item.pluralIndex() < 0) {
                issues.add(new CorpusIssue(path + ".pluralIndex", item.id(), path + ".pluralIndex must be >= 0"));
            }
        }
        return List.copyOf(issues);
    }
}
