package com.dmn.feel.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable string-keyed FEEL context. Insertion order of the keys is preserved.
 */
public record ObjectValue(Map<String, Value> entries) implements Value {

    public static final ObjectValue EMPTY = new ObjectValue(Map.of());

    public ObjectValue {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public Optional<Value> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Copy of this context with one entry added or replaced.
     */
    public ObjectValue with(String key, Value value) {
        Map<String, Value> copy = new LinkedHashMap<>(entries);
        copy.put(key, value);
        return new ObjectValue(copy);
    }

    @Override
    public String asText() {
        return toString();
    }

    @Override
    public String toString() {
        return entries.entrySet().stream()
                .map(e -> "\"" + e.getKey() + "\": " + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
