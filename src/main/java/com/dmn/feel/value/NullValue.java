package com.dmn.feel.value;

/**
 * The FEEL null value.
 */
public record NullValue() implements Value {

    static final NullValue INSTANCE = new NullValue();

    @Override
    public String asText() {
        return "null";
    }

    @Override
    public String toString() {
        return "null";
    }
}
