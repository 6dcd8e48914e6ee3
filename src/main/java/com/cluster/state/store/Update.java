package com.cluster.state.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Field-level modifications applied to an existing document.
 * Modifiers run in the order they were added.
 */
public final class Update {

    private enum Kind { SET, UNSET, INC, ADD_TO_SET, PULL }

    private record Modifier(Kind kind, String field, Object value) {
    }

    private final List<Modifier> modifiers = new ArrayList<>();

    public Update set(String field, Object value) {
        modifiers.add(new Modifier(Kind.SET, field, Documents.normalize(value)));
        return this;
    }

    public Update unset(String field) {
        modifiers.add(new Modifier(Kind.UNSET, field, null));
        return this;
    }

    public Update inc(String field, long delta) {
        modifiers.add(new Modifier(Kind.INC, field, delta));
        return this;
    }

    /**
     * Appends {@code value} to a list field unless it is already present.
     */
    public Update addToSet(String field, Object value) {
        modifiers.add(new Modifier(Kind.ADD_TO_SET, field, Documents.normalize(value)));
        return this;
    }

    /**
     * Removes every occurrence of {@code value} from a list field.
     */
    public Update pull(String field, Object value) {
        modifiers.add(new Modifier(Kind.PULL, field, Documents.normalize(value)));
        return this;
    }

    public boolean isEmpty() {
        return modifiers.isEmpty();
    }

    /**
     * Applies the modifiers to {@code doc} in place.
     */
    void applyTo(Map<String, Object> doc) {
        for (Modifier m : modifiers) {
            switch (m.kind()) {
                case SET -> doc.put(m.field(), Documents.copyValue(m.value()));
                case UNSET -> doc.remove(m.field());
                case INC -> doc.put(m.field(), Documents.longValue(doc, m.field()) + (Long) m.value());
                case ADD_TO_SET -> {
                    List<Object> list = Documents.listValue(doc, m.field());
                    if (list.stream().noneMatch(v -> Documents.valuesEqual(v, m.value()))) {
                        list.add(Documents.copyValue(m.value()));
                    }
                    doc.put(m.field(), list);
                }
                case PULL -> {
                    List<Object> list = Documents.listValue(doc, m.field());
                    list.removeIf(v -> Documents.valuesEqual(v, m.value()));
                    doc.put(m.field(), list);
                }
            }
        }
    }

    @Override
    public String toString() {
        return modifiers.toString();
    }
}
