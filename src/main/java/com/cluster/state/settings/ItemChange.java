package com.cluster.state.settings;

/**
 * A single change made to a settings document by {@link Settings#write()}.
 *
 * @param type     what happened to the key
 * @param key      the settings key
 * @param oldValue value before the write, {@code null} when added
 * @param newValue value after the write, {@code null} when deleted
 */
public record ItemChange(Type type, String key, Object oldValue, Object newValue) implements Comparable<ItemChange> {

    public enum Type { ADDED, MODIFIED, DELETED }

    public static ItemChange added(String key, Object newValue) {
        return new ItemChange(Type.ADDED, key, null, newValue);
    }

    public static ItemChange modified(String key, Object oldValue, Object newValue) {
        return new ItemChange(Type.MODIFIED, key, oldValue, newValue);
    }

    public static ItemChange deleted(String key, Object oldValue) {
        return new ItemChange(Type.DELETED, key, oldValue, null);
    }

    @Override
    public int compareTo(ItemChange other) {
        return key.compareTo(other.key);
    }

    @Override
    public String toString() {
        return switch (type) {
            case ADDED -> "setting added: " + key + " = " + newValue;
            case MODIFIED -> "setting modified: " + key + " = " + newValue + " (was " + oldValue + ")";
            case DELETED -> "setting deleted: " + key + " (was " + oldValue + ")";
        };
    }
}
