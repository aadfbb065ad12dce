package org.javai.resilience;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * String-keyed property bag carried by a {@link ResilienceContext}.
 * Callers and strategies may both read and write it during one execution.
 * Not thread-safe; a context, and therefore its properties, belongs to a single execution.
 */
public final class ResilienceProperties {

    private final Map<String, Object> values = new HashMap<>();

    /**
     * Returns the value stored under the key, if present and of the key's type.
     */
    public <V> Optional<V> get(ResiliencePropertyKey<V> key) {
        Objects.requireNonNull(key, "key must not be null");
        Object value = values.get(key.key());
        if (key.type().isInstance(value)) {
            return Optional.of(key.type().cast(value));
        }
        return Optional.empty();
    }

    public <V> V getOrDefault(ResiliencePropertyKey<V> key, V defaultValue) {
        return get(key).orElse(defaultValue);
    }

    public <V> void set(ResiliencePropertyKey<V> key, V value) {
        Objects.requireNonNull(key, "key must not be null");
        values.put(key.key(), value);
    }

    public boolean remove(ResiliencePropertyKey<?> key) {
        Objects.requireNonNull(key, "key must not be null");
        return values.remove(key.key()) != null;
    }

    public boolean contains(ResiliencePropertyKey<?> key) {
        return values.containsKey(key.key());
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Returns an unmodifiable snapshot of all entries.
     */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(new HashMap<>(values));
    }

    void clear() {
        values.clear();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
