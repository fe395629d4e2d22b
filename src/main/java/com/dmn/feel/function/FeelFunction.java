package com.dmn.feel.function;

import com.dmn.feel.value.Value;

import java.util.List;

/**
 * Built-in function body.
 * <p>
 * Receives the argument vector produced by {@link ParameterBinder}: one slot per formal
 * parameter in declaration order (omitted optional ones are null values), followed by any
 * variadic extras. Implementations return {@link Value#NULL} for invalid input rather than throw.
 */
@FunctionalInterface
public interface FeelFunction {

    Value apply(List<Value> args);
}
