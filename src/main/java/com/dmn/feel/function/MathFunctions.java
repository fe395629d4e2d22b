package com.dmn.feel.function;

import com.dmn.feel.value.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;
import java.util.function.DoubleFunction;

import static com.dmn.feel.function.FormalParameter.required;
import static com.dmn.feel.function.FunctionSupport.integer;
import static com.dmn.feel.function.FunctionSupport.number;

/**
 * Numeric functions.
 * <p>
 * Rounding family, all with a {@code (n, scale)} signature:
 * <ul>
 *   <li>{@code decimal}, {@code round}: half-even</li>
 *   <li>{@code round up}: away from zero</li>
 *   <li>{@code round down}: toward zero</li>
 *   <li>{@code round half up}: ties away from zero</li>
 *   <li>{@code round half down}: ties toward zero</li>
 * </ul>
 */
final class MathFunctions {

    private static final int MAX_SCALE = 6176;

    private MathFunctions() {
    }

    static void register(FunctionLibrary.Builder library) {
        library.define(FunctionSignature.of("abs", required("n")), unary(Math::abs));
        library.define(FunctionSignature.of("floor", required("n")), unary(Math::floor));
        library.define(FunctionSignature.of("ceiling", required("n")), unary(Math::ceil));

        library.define(FunctionSignature.of("sqrt", required("number")),
                unary(n -> n < 0 ? null : Math.sqrt(n)));
        library.define(FunctionSignature.of("exp", required("number")), unary(Math::exp));
        library.define(FunctionSignature.of("log", required("number")),
                unary(n -> n <= 0 ? null : Math.log(n)));
        library.define(FunctionSignature.of("odd", required("number")), args -> parity(args, 1));
        library.define(FunctionSignature.of("even", required("number")), args -> parity(args, 0));

        library.define(FunctionSignature.of("modulo", required("dividend"), required("divisor")),
                MathFunctions::modulo);

        library.define(FunctionSignature.of("decimal", required("n"), required("scale")),
                rounding(RoundingMode.HALF_EVEN));
        library.define(FunctionSignature.of("round", required("n"), required("scale")),
                rounding(RoundingMode.HALF_EVEN));
        library.define(FunctionSignature.of("round up", required("n"), required("scale")),
                rounding(RoundingMode.UP));
        library.define(FunctionSignature.of("round down", required("n"), required("scale")),
                rounding(RoundingMode.DOWN));
        library.define(FunctionSignature.of("round half up", required("n"), required("scale")),
                rounding(RoundingMode.HALF_UP));
        library.define(FunctionSignature.of("round half down", required("n"), required("scale")),
                rounding(RoundingMode.HALF_DOWN));
    }

    /**
     * Wraps a single-number function. A null result from {@code body} means out of domain.
     */
    private static FeelFunction unary(DoubleFunction<Double> body) {
        return args -> number(args, 0)
                .map(body::apply)
                .filter(result -> !result.isNaN())
                .map(Value::of)
                .orElse(Value.NULL);
    }

    private static FeelFunction rounding(RoundingMode mode) {
        return args -> round(args, mode);
    }

    static Value round(List<Value> args, RoundingMode mode) {
        Optional<Double> n = number(args, 0);
        Optional<Integer> scale = integer(args, 1);
        if (n.isEmpty() || scale.isEmpty() || !Double.isFinite(n.get()) || Math.abs(scale.get()) > MAX_SCALE) {
            return Value.NULL;
        }
        BigDecimal rounded = BigDecimal.valueOf(n.get()).setScale(scale.get(), mode);
        return Value.of(rounded.doubleValue());
    }

    /**
     * {@code a - b * floor(a / b)}; the result takes the sign of the divisor.
     */
    static Value modulo(List<Value> args) {
        Optional<Double> dividend = number(args, 0);
        Optional<Double> divisor = number(args, 1);
        if (dividend.isEmpty() || divisor.isEmpty() || divisor.get() == 0.0) {
            return Value.NULL;
        }
        double a = dividend.get();
        double b = divisor.get();
        return Value.of(a - b * Math.floor(a / b));
    }

    private static Value parity(List<Value> args, int remainder) {
        Optional<Double> n = number(args, 0);
        if (n.isEmpty() || n.get() != Math.rint(n.get()) || Double.isInfinite(n.get())) {
            return Value.NULL;
        }
        return Value.of(Math.abs(n.get() % 2) == remainder);
    }
}
