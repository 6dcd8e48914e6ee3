package com.cluster.state.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * A predicate over a single stored document, used both as a transaction
 * assertion and as a query filter. The document passed to {@link #test} is
 * {@code null} when it does not exist; every field condition fails on a
 * missing document.
 */
public final class Condition {

    private static final Condition ALWAYS = new Condition("always", doc -> true, true);
    private static final Condition DOC_EXISTS = new Condition("docExists", doc -> true);
    private static final Condition DOC_MISSING = new Condition("docMissing", doc -> false, true);

    private final String description;
    private final Predicate<Map<String, Object>> predicate;
    private final boolean matchesMissing;

    private Condition(String description, Predicate<Map<String, Object>> predicate) {
        this(description, predicate, false);
    }

    private Condition(String description, Predicate<Map<String, Object>> predicate, boolean matchesMissing) {
        this.description = description;
        this.predicate = predicate;
        this.matchesMissing = matchesMissing;
    }

    public boolean test(Map<String, Object> doc) {
        if (doc == null) {
            return matchesMissing;
        }
        return predicate.test(doc);
    }

    // ========== Existence ==========

    /**
     * Matches every document, including a missing one. Used for queries.
     */
    public static Condition always() {
        return ALWAYS;
    }

    public static Condition docExists() {
        return DOC_EXISTS;
    }

    public static Condition docMissing() {
        return DOC_MISSING;
    }

    // ========== Field comparisons ==========

    public static Condition eq(String field, Object value) {
        return new Condition(field + " == " + value,
                doc -> Documents.valuesEqual(doc.get(field), value));
    }

    /**
     * Matches when the field differs from {@code value} or is absent.
     */
    public static Condition ne(String field, Object value) {
        return new Condition(field + " != " + value,
                doc -> !Documents.valuesEqual(doc.get(field), value));
    }

    public static Condition in(String field, Collection<?> values) {
        List<?> candidates = List.copyOf(values);
        return new Condition(field + " in " + candidates,
                doc -> candidates.stream().anyMatch(v -> Documents.valuesEqual(doc.get(field), v)));
    }

    public static Condition notIn(String field, Collection<?> values) {
        List<?> candidates = List.copyOf(values);
        return new Condition(field + " not in " + candidates,
                doc -> candidates.stream().noneMatch(v -> Documents.valuesEqual(doc.get(field), v)));
    }

    public static Condition gt(String field, long value) {
        return new Condition(field + " > " + value,
                doc -> doc.get(field) instanceof Number n && n.longValue() > value);
    }

    public static Condition gte(String field, long value) {
        return new Condition(field + " >= " + value,
                doc -> doc.get(field) instanceof Number n && n.longValue() >= value);
    }

    public static Condition revno(long expected) {
        return eq(Documents.REVNO, expected);
    }

    public static Condition exists(String field) {
        return new Condition(field + " exists", doc -> doc.containsKey(field));
    }

    // ========== Array fields ==========

    /**
     * Matches when the list field is absent or has no elements.
     */
    public static Condition emptyOrMissing(String field) {
        return new Condition(field + " is empty", doc -> Documents.listValue(doc, field).isEmpty());
    }

    public static Condition size(String field, int size) {
        return new Condition(field + " has size " + size, doc -> Documents.listValue(doc, field).size() == size);
    }

    public static Condition contains(String field, Object value) {
        return new Condition(field + " contains " + value,
                doc -> Documents.listValue(doc, field).stream().anyMatch(v -> Documents.valuesEqual(v, value)));
    }

    public static Condition notContains(String field, Object value) {
        return new Condition(field + " lacks " + value,
                doc -> Documents.listValue(doc, field).stream().noneMatch(v -> Documents.valuesEqual(v, value)));
    }

    /**
     * Matches when the list field holds exactly {@code values}, in order.
     */
    public static Condition listEquals(String field, List<?> values) {
        List<Object> expected = new ArrayList<>();
        values.forEach(v -> expected.add(Documents.normalize(v)));
        return new Condition(field + " == " + expected, doc -> {
            List<Object> actual = Documents.listValue(doc, field);
            if (actual.size() != expected.size()) {
                return false;
            }
            for (int i = 0; i < actual.size(); i++) {
                if (!Documents.valuesEqual(actual.get(i), expected.get(i))) {
                    return false;
                }
            }
            return true;
        });
    }

    public static Condition noElementStartsWith(String field, String prefix) {
        return new Condition("no " + field + " starts with " + prefix,
                doc -> Documents.listValue(doc, field).stream()
                        .noneMatch(v -> v != null && v.toString().startsWith(prefix)));
    }

    /**
     * Matches when the field is a string starting with {@code prefix}.
     */
    public static Condition startsWith(String field, String prefix) {
        return new Condition(field + " starts with " + prefix,
                doc -> doc.get(field) instanceof String s && s.startsWith(prefix));
    }

    // ========== Combinators ==========

    public static Condition and(Condition... conditions) {
        List<Condition> parts = Arrays.asList(conditions);
        boolean missing = parts.stream().allMatch(c -> c.matchesMissing);
        return new Condition(join(parts, " && "),
                doc -> parts.stream().allMatch(c -> c.test(doc)), missing);
    }

    public static Condition or(Condition... conditions) {
        List<Condition> parts = Arrays.asList(conditions);
        boolean missing = parts.stream().anyMatch(c -> c.matchesMissing);
        return new Condition(join(parts, " || "),
                doc -> parts.stream().anyMatch(c -> c.test(doc)), missing);
    }

    public static Condition not(Condition condition) {
        return new Condition("!(" + condition + ")", doc -> !condition.test(doc), !condition.matchesMissing);
    }

    private static String join(List<Condition> parts, String separator) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                sb.append(separator);
            }
            sb.append(parts.get(i));
        }
        return sb.append(')').toString();
    }

    @Override
    public String toString() {
        return description;
    }
}
