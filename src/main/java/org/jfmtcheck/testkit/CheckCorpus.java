package org.jfmtcheck.testkit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.Document;
import org.jfmtcheck.check.CheckStatus;

/**
 * Declarative corpus of message pairs together with the check outcome each pair is expected to produce.
 */
public record CheckCorpus(String schemaVersion, String format, List<Case> cases) {
    public static final String SCHEMA_VERSION = "check-corpus.v1";

    public CheckCorpus {
        schemaVersion = requireText(schemaVersion, "schemaVersion");
        format = requireText(format, "format");
        cases = List.copyOf(Objects.requireNonNull(cases, "cases"));
    }

    static String readSchemaVersion(final Map<String, Object> root) {
        return requireText(asString(root.get("schemaVersion"), "schemaVersion"), "schemaVersion");
    }

    static String readFormat(final Map<String, Object> root) {
        return requireText(asString(root.getOrDefault("format", "d"), "format"), "format");
    }

    static List<Object> readRawCases(final Map<String, Object> root) {
        return asList(root.get("cases"), "cases");
    }

    static String casePath(final int index) {
        return "cases[" + index + "]";
    }

    public String toJson() {
        return new Document(toMap()).toJson();
    }

    Map<String, Object> toMap() {
        final Map<String, Object> root = new LinkedHashMap<>();
        root.put("schemaVersion", schemaVersion);
        root.put("format", format);
        final List<Map<String, Object>> caseItems = new ArrayList<>(cases.size());
        for (final Case item : cases) {
            caseItems.add(item.toMap());
        }
        root.put("cases", caseItems);
        return root;
    }

    /**
     * One message pair.
     *
     * @param sourceRef where the pair came from, e.g. {@code app.po:17}; may be {@code null}
     * @param pluralIndex plural form index of {@code msgstr}; may be {@code null}
     */
    public record Case(
            String id,
            String msgid,
            String msgstr,
            CheckStatus expect,
            String sourceRef,
            Integer pluralIndex) {
        public Case {
            id = requireText(id, "id");
            msgid = Objects.requireNonNull(msgid, "msgid");
            msgstr = Objects.requireNonNull(msgstr, "msgstr");
            expect = Objects.requireNonNull(expect, "expect");
        }

        static Case fromRaw(final Object raw, final String path) {
            return fromMap(asStringMap(raw, path), path);
        }

        /**
         * Reads the id of a raw case entry without validating the rest; {@code null} if it has none.
         */
        static String peekId(final Object raw) {
            if (raw instanceof Map<?, ?> map && map.get("id") instanceof String id && !id.isBlank()) {
                return id.trim();
            }
            return null;
        }

        private static Case fromMap(final Map<String, Object> root, final String path) {
            final String id = requireText(asString(root.get("id"), path + ".id"), path + ".id");
            final String msgid = requirePresent(root.get("msgid"), path + ".msgid");
            final String msgstr = requirePresent(root.get("msgstr"), path + ".msgstr");
            final String expectRaw = requireText(asString(root.get("expect"), path + ".expect"), path + ".expect");
            final CheckStatus expect;
            try {
                expect = CheckStatus.fromCode(expectRaw);
            } catch (final IllegalArgumentException e) {
                throw new IllegalArgumentException(path + ".expect must be one of: "
                        + "ok|mismatch|invalid-msgid|invalid-msgstr (actual: " + expectRaw + ")", e);
            }
            final String sourceRef = asString(root.get("sourceRef"), path + ".sourceRef");
            final Object pluralRaw = root.get("pluralIndex");
            final Integer pluralIndex;
            if (pluralRaw == null) {
                pluralIndex = null;
            } else if (pluralRaw instanceof Number number) {
                pluralIndex = number.intValue();
            } else {
                throw new IllegalArgumentException(path + ".pluralIndex must be a number");
            }
            return new Case(id, msgid, msgstr, expect, sourceRef, pluralIndex);
        }

        Map<String, Object> toMap() {
            final Map<String, Object> root = new LinkedHashMap<>();
            root.put("id", id);
            root.put("msgid", msgid);
            root.put("msgstr", msgstr);
            root.put("expect", expect.code());
            if (sourceRef != null) {
                root.put("sourceRef", sourceRef);
            }
            if (pluralIndex != null) {
                root.put("pluralIndex", pluralIndex);
            }
            return root;
        }
    }

    private static Map<String, Object> asStringMap(final Object value, final String fieldName) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException(fieldName + " must be an object");
        }
        final Map<String, Object> normalized = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : map.entrySet()) {
            normalized.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return Collections.unmodifiableMap(normalized);
    }

    private static List<Object> asList(final Object value, final String fieldName) {
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(fieldName + " must be an array");
        }
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    private static String asString(final Object value, final String fieldName) {
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new IllegalArgumentException(fieldName + " must be a string");
    }

    /**
     * Format strings are taken verbatim: they may be empty and their whitespace matters.
     */
    private static String requirePresent(final Object value, final String fieldName) {
        final String text = asString(value, fieldName);
        if (text == null) {
            throw new IllegalArgumentException(fieldName + " must not be null");
        }
        return text;
    }

    private static String requireText(final String value, final String fieldName) {
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " must not be null");
        }
        final String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return trimmed;
    }
}
