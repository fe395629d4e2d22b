package com.dmn.feel.evaluator;

import com.dmn.feel.ast.BinaryOperator;
import com.dmn.feel.value.StringValue;
import com.dmn.feel.value.Value;
import com.dmn.feel.value.Values;

import java.util.Optional;

/**
 * Arithmetic and comparison operators over evaluated operands.
 */
final class BinaryOperations {

    private BinaryOperations() {
    }

    static Value apply(BinaryOperator operator, Value left, Value right) {
        return switch (operator) {
            case ADD -> add(left, right);
            case SUBTRACT -> arithmetic(left, right, (a, b) -> a - b);
            case MULTIPLY -> arithmetic(left, right, (a, b) -> a * b);
            case DIVIDE -> divide(left, right);
            case POWER -> arithmetic(left, right, Math::pow);
            case EQUAL -> Value.of(Values.feelEquals(left, right));
            case NOT_EQUAL -> Value.of(!Values.feelEquals(left, right));
            case LESS_THAN -> compare(left, right, c -> c < 0);
            case GREATER_THAN -> compare(left, right, c -> c > 0);
            case LESS_OR_EQUAL -> compare(left, right, c -> c <= 0);
            case GREATER_OR_EQUAL -> compare(left, right, c -> c >= 0);
            case AND, OR -> throw new IllegalStateException("Logical operator " + operator + " is short-circuited");
        };
    }

    /**
     * String concatenation wins over null propagation: {@code "a" + null} is {@code "anull"}.
     */
    private static Value add(Value left, Value right) {
        if (left instanceof StringValue || right instanceof StringValue) {
            return Value.of(left.asText() + right.asText());
        }
        return arithmetic(left, right, Double::sum);
    }

    private static Value divide(Value left, Value right) {
        Optional<Double> divisor = Values.toNumber(right);
        if (divisor.isPresent() && divisor.get() == 0.0) {
            return Value.NULL;
        }
        return arithmetic(left, right, (a, b) -> a / b);
    }

    private static Value arithmetic(Value left, Value right, NumericOperation operation) {
        if (left.isNull() || right.isNull()) {
            return Value.NULL;
        }
        Optional<Double> a = Values.toNumber(left);
        Optional<Double> b = Values.toNumber(right);
        if (a.isEmpty() || b.isEmpty()) {
            return Value.NULL;
        }
        double result = operation.apply(a.get(), b.get());
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            return Value.NULL;
        }
        return Value.of(result);
    }

    private static Value compare(Value left, Value right, ComparisonTest test) {
        if (left.isNull() || right.isNull()) {
            return Value.NULL;
        }
        if (left instanceof StringValue a && right instanceof StringValue b) {
            return Value.of(test.accept(a.value().compareTo(b.value())));
        }
        Optional<Double> a = Values.toNumber(left);
        Optional<Double> b = Values.toNumber(right);
        if (a.isEmpty() || b.isEmpty()) {
            return Value.NULL;
        }
        double x = a.get();
        double y = b.get();
        return Value.of(test.accept(x < y ? -1 : (x > y ? 1 : 0)));
    }

    @FunctionalInterface
    private interface NumericOperation {
        double apply(double a, double b);
    }

    @FunctionalInterface
    private interface ComparisonTest {
        boolean accept(int comparison);
    }
}
