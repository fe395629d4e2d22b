package com.dmn.feel.value;

public record BooleanValue(boolean value) implements Value {

    @Override
    public String asText() {
        return Boolean.toString(value);
    }

    @Override
    public String toString() {
        return asText();
    }
}
