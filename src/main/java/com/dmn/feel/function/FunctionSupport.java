package com.dmn.feel.function;

import com.dmn.feel.value.ListValue;
import com.dmn.feel.value.NumberValue;
import com.dmn.feel.value.StringValue;
import com.dmn.feel.value.Value;

import java.util.List;
import java.util.Optional;

/**
 * Argument access helpers for built-in function bodies.
 */
final class FunctionSupport {

    private FunctionSupport() {
    }

    static Value arg(List<Value> args, int index) {
        return index < args.size() ? args.get(index) : Value.NULL;
    }

    static Optional<Double> number(List<Value> args, int index) {
        return arg(args, index) instanceof NumberValue n ? Optional.of(n.value()) : Optional.empty();
    }

    /**
     * Integer argument; fractional values are truncated toward zero.
     */
    static Optional<Integer> integer(List<Value> args, int index) {
        return number(args, index)
                .filter(d -> !d.isNaN() && !d.isInfinite())
                .map(Double::intValue);
    }

    static Optional<String> string(List<Value> args, int index) {
        return arg(args, index) instanceof StringValue s ? Optional.of(s.value()) : Optional.empty();
    }

    static Optional<List<Value>> list(List<Value> args, int index) {
        return arg(args, index) instanceof ListValue l ? Optional.of(l.items()) : Optional.empty();
    }

    static boolean anyNull(List<Value> args) {
        return args.stream().anyMatch(Value::isNull);
    }

    /**
     * Numbers of a list, or empty if any element is not a number.
     */
    static Optional<double[]> numbers(List<Value> items) {
        double[] result = new double[items.size()];
        for (int i = 0; i < items.size(); i++) {
            if (!(items.get(i) instanceof NumberValue n)) {
                return Optional.empty();
            }
            result[i] = n.value();
        }
        return Optional.of(result);
    }

    /**
     * Convert a 1-based, possibly negative, position into a 0-based index.
     *
     * @return index, or -1 if the position is zero or outside {@code [1, size]} / {@code [-size, -1]}
     */
    static int toIndex(int position, int size) {
        if (position > 0 && position <= size) {
            return position - 1;
        }
        if (position < 0 && -position <= size) {
            return size + position;
        }
        return -1;
    }
}
