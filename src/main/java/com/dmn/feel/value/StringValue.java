package com.dmn.feel.value;

import java.util.Objects;

public record StringValue(String value) implements Value {

    public StringValue {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String asText() {
        return value;
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }
}
