package com.dmn.feel.value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable FEEL list. Elements are never Java null; missing elements are {@link Value#NULL}.
 */
public record ListValue(List<Value> items) implements Value {

    public ListValue {
        items = List.copyOf(items);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public Value get(int index) {
        return items.get(index);
    }

    @Override
    public String asText() {
        return toString();
    }

    @Override
    public String toString() {
        return items.stream()
                .map(Value::toString)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
