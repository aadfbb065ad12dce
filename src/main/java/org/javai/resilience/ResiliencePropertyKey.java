package org.javai.resilience;

import java.util.Objects;

/**
 * A typed key into {@link ResilienceProperties}.
 * Two keys are equal when their names are equal; the type is only used for safe access.
 *
 * @param key the property name
 * @param type the type of the property value
 */
public record ResiliencePropertyKey<V>(String key, Class<V> type) {

    public ResiliencePropertyKey {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public static <V> ResiliencePropertyKey<V> of(String key, Class<V> type) {
        return new ResiliencePropertyKey<>(key, type);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ResiliencePropertyKey<?> other && key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return key;
    }
}
