package com.cluster.state.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Helpers for the plain map representation of stored documents.
 * Enums are stored by name, integral numbers as {@code Long}.
 */
public final class Documents {

    public static final String ID = "_id";
    public static final String REVNO = "txn-revno";

    private Documents() {
    }

    /**
     * Converts a value into its stored form.
     */
    public static Object normalize(Object value) {
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Collection<?> c) {
            List<Object> copy = new ArrayList<>(c.size());
            for (Object element : c) {
                copy.add(normalize(element));
            }
            return copy;
        }
        if (value instanceof Map<?, ?> m) {
            Map<String, Object> copy = new LinkedHashMap<>();
            m.forEach((k, v) -> copy.put(String.valueOf(k), normalize(v)));
            return copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> normalizeDocument(Map<String, Object> doc) {
        return (Map<String, Object>) normalize(doc);
    }

    /**
     * Compares two stored values, treating integral numbers of different widths as equal.
     */
    public static boolean valuesEqual(Object a, Object b) {
        Object left = normalize(a);
        Object right = normalize(b);
        if (left instanceof Number l && right instanceof Number r) {
            return l.longValue() == r.longValue();
        }
        return Objects.equals(left, right);
    }

    public static long longValue(Map<String, Object> doc, String field) {
        Object value = doc != null ? doc.get(field) : null;
        return value instanceof Number n ? n.longValue() : 0L;
    }

    public static String stringValue(Map<String, Object> doc, String field) {
        Object value = doc != null ? doc.get(field) : null;
        return value != null ? value.toString() : "";
    }

    public static List<Object> listValue(Map<String, Object> doc, String field) {
        Object value = doc != null ? doc.get(field) : null;
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        return new ArrayList<>();
    }

    public static long revno(Map<String, Object> doc) {
        return longValue(doc, REVNO);
    }

    /**
     * Deep copies a document so callers never share mutable state with the store.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> copy(Map<String, Object> doc) {
        if (doc == null) {
            return null;
        }
        return (Map<String, Object>) deepCopy(doc);
    }

    /**
     * Deep copies a single stored value.
     */
    public static Object copyValue(Object value) {
        return deepCopy(value);
    }

    private static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> m) {
            Map<String, Object> copy = new LinkedHashMap<>();
            m.forEach((k, v) -> copy.put(String.valueOf(k), deepCopy(v)));
            return copy;
        }
        if (value instanceof Collection<?> c) {
            List<Object> copy = new ArrayList<>(c.size());
            for (Object element : c) {
                copy.add(deepCopy(element));
            }
            return copy;
        }
        return value;
    }
}
