package com.dmn.feel.value;

import java.util.List;
import java.util.Map;

/**
 * Runtime value produced by FEEL evaluation.
 * <p>
 * The domain is closed: Null, Boolean, Number, String, List and Object (string keyed).
 * Null is an ordinary value here, so DMN "invalid input yields null" outcomes travel
 * through normal returns rather than exceptions.
 */
public sealed interface Value
        permits NullValue, BooleanValue, NumberValue, StringValue, ListValue, ObjectValue {

    Value NULL = NullValue.INSTANCE;
    Value TRUE = new BooleanValue(true);
    Value FALSE = new BooleanValue(false);

    /**
     * Text form used for string concatenation, unary tests and allowed-value checks.
     * Integral numbers print without a fractional part and Null prints as {@code null}.
     */
    String asText();

    default boolean isNull() {
        return this instanceof NullValue;
    }

    static Value of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static Value of(double value) {
        return new NumberValue(value);
    }

    static Value of(String value) {
        return value == null ? NULL : new StringValue(value);
    }

    static Value list(List<Value> items) {
        return new ListValue(items);
    }

    static Value object(Map<String, Value> entries) {
        return new ObjectValue(entries);
    }
}
