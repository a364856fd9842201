package org.jfmtcheck.testkit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads check corpus files. Every case is read even after one fails, so a broken file reports all of its
 * unreadable cases at once; a readable corpus is then validated as a whole.
 */
public final class CheckCorpusLoader {
    private CheckCorpusLoader() {}

    public static CheckCorpus load(final Path corpusPath) throws IOException {
        Objects.requireNonNull(corpusPath, "corpusPath");
        final Path normalized = corpusPath.toAbsolutePath().normalize();
        if (!Files.isRegularFile(normalized)) {
            throw new IllegalArgumentException(Files.exists(normalized)
                    ? "corpus path must be a file: " + normalized
                    : "corpus path does not exist: " + normalized);
        }
        return parse(Files.readString(normalized, StandardCharsets.UTF_8), normalized.getFileName().toString());
    }

    /**
     * Parses corpus text. {@code sourceName} names the corpus in errors, and its extension selects YAML
     * ({@code .yaml}, {@code .yml}) or JSON (anything else).
     *
     * @throws CheckCorpusValidationException if cases cannot be read or the corpus breaks a rule
     * @throws IllegalArgumentException if the document itself is malformed
     */
    public static CheckCorpus parse(final String content, final String sourceName) {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(sourceName, "sourceName");
        final Map<String, Object> root = isYaml(sourceName) ? yamlRoot(content) : Document.parse(content);

        final List<Object> rawCases = CheckCorpus.readRawCases(root);
        final List<CheckCorpus.Case> cases = new ArrayList<>(rawCases.size());
        final List<CorpusIssue> unreadable = new ArrayList<>();
        for (int i = 0; i < rawCases.size(); i++) {
            final String path = CheckCorpus.casePath(i);
            try {
                cases.add(CheckCorpus.Case.fromRaw(rawCases.get(i), path));
            } catch (final IllegalArgumentException e) {
                unreadable.add(new CorpusIssue(path, CheckCorpus.Case.peekId(rawCases.get(i)), e.getMessage()));
            }
        }
        if (!unreadable.isEmpty()) {
            throw new CheckCorpusValidationException(sourceName, unreadable);
        }

        final CheckCorpus corpus =
                new CheckCorpus(CheckCorpus.readSchemaVersion(root), CheckCorpus.readFormat(root), cases);
        CheckCorpusValidator.validateOrThrow(corpus, sourceName);
        return corpus;
    }

    private static boolean isYaml(final String sourceName) {
        final String lower = sourceName.trim().toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml");
    }

    private static Map<String, Object> yamlRoot(final String content) {
        final Object root = new Yaml().load(content);
        if (root == null) {
            throw new IllegalArgumentException("corpus is empty");
        }
        if (!(root instanceof Map<?, ?> rawMap)) {
            throw new IllegalArgumentException("corpus root must be an object");
        }
        final Map<String, Object> normalized = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : rawMap.entrySet()) {
            normalized.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return normalized;
    }
}
