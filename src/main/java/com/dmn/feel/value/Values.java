package com.dmn.feel.value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Coercion and comparison helpers shared by the evaluator, the function library
 * and the decision table engine.
 */
public final class Values {

    private Values() {
    }

    /**
     * Numeric view of a value: numbers as is, booleans as 1/0, numeric strings parsed.
     *
     * @return number, or empty if the value does not coerce
     */
    public static Optional<Double> toNumber(Value value) {
        if (value instanceof NumberValue n) {
            return Optional.of(n.value());
        }
        if (value instanceof BooleanValue b) {
            return Optional.of(b.value() ? 1.0 : 0.0);
        }
        if (value instanceof StringValue s) {
            return parseNumber(s.value());
        }
        return Optional.empty();
    }

    /**
     * Strict numeric view: only FEEL numbers.
     */
    public static Optional<Double> asNumber(Value value) {
        if (value instanceof NumberValue n) {
            return Optional.of(n.value());
        }
        return Optional.empty();
    }

    public static Optional<String> asString(Value value) {
        if (value instanceof StringValue s) {
            return Optional.of(s.value());
        }
        return Optional.empty();
    }

    public static Optional<Boolean> asBoolean(Value value) {
        if (value instanceof BooleanValue b) {
            return Optional.of(b.value());
        }
        return Optional.empty();
    }

    public static Optional<List<Value>> asList(Value value) {
        if (value instanceof ListValue l) {
            return Optional.of(l.items());
        }
        return Optional.empty();
    }

    public static Optional<Map<String, Value>> asObject(Value value) {
        if (value instanceof ObjectValue o) {
            return Optional.of(o.entries());
        }
        return Optional.empty();
    }

    /**
     * Parse decimal text (with optional exponent) into a number.
     */
    public static Optional<Double> parseNumber(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty() || !looksNumeric(trimmed)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(trimmed));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * FEEL equality: values of different kinds are never equal, numbers compare numerically.
     */
    public static boolean feelEquals(Value left, Value right) {
        if (left instanceof NumberValue a && right instanceof NumberValue b) {
            return a.value() == b.value();
        }
        if (left instanceof ListValue a && right instanceof ListValue b) {
            if (a.size() != b.size()) {
                return false;
            }
            for (int i = 0; i < a.size(); i++) {
                if (!feelEquals(a.get(i), b.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof ObjectValue a && right instanceof ObjectValue b) {
            if (!a.entries().keySet().equals(b.entries().keySet())) {
                return false;
            }
            for (Map.Entry<String, Value> entry : a.entries().entrySet()) {
                if (!feelEquals(entry.getValue(), b.entries().get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        return left.equals(right);
    }

    /**
     * Kind name used in diagnostics.
     */
    public static String typeName(Value value) {
        if (value instanceof NullValue) {
            return "null";
        }
        if (value instanceof BooleanValue) {
            return "boolean";
        }
        if (value instanceof NumberValue) {
            return "number";
        }
        if (value instanceof StringValue) {
            return "string";
        }
        if (value instanceof ListValue) {
            return "list";
        }
        return "context";
    }

    private static boolean looksNumeric(String text) {
        char first = text.charAt(0);
        char last = text.charAt(text.length() - 1);
        return (Character.isDigit(first) || first == '-' || first == '+' || first == '.')
                && (Character.isDigit(last) || last == '.');
    }
}
