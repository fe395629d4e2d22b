package com.dmn.feel.function;

import com.dmn.feel.value.BooleanValue;
import com.dmn.feel.value.StringValue;
import com.dmn.feel.value.Value;

import java.util.List;
import java.util.Optional;

import static com.dmn.feel.function.FormalParameter.required;
import static com.dmn.feel.function.FunctionSupport.arg;
import static com.dmn.feel.function.FunctionSupport.list;

/**
 * Boolean functions: {@code not}, {@code all}, {@code any}.
 * The strings "true" and "false" are accepted where a boolean is expected.
 */
final class BooleanFunctions {

    private BooleanFunctions() {
    }

    static void register(FunctionLibrary.Builder library) {
        library.define(FunctionSignature.of("not", required("negand")), BooleanFunctions::not);
        library.define(FunctionSignature.of("all", required("list")), BooleanFunctions::all);
        library.define(FunctionSignature.of("any", required("list")), BooleanFunctions::any);
    }

    static Value not(List<Value> args) {
        return toBoolean(arg(args, 0))
                .map(b -> Value.of(!b))
                .orElse(Value.NULL);
    }

    /**
     * False if any element is false, true otherwise. Null elements are skipped and the empty list is true.
     */
    static Value all(List<Value> args) {
        Optional<List<Value>> items = list(args, 0);
        if (items.isEmpty()) {
            return Value.NULL;
        }
        for (Value item : items.get()) {
            if (item.isNull()) {
                continue;
            }
            Optional<Boolean> b = toBoolean(item);
            if (b.isEmpty()) {
                return Value.NULL;
            }
            if (!b.get()) {
                return Value.FALSE;
            }
        }
        return Value.TRUE;
    }

    /**
     * True if any element is true, false otherwise. Null elements are skipped and the empty list is false.
     */
    static Value any(List<Value> args) {
        Optional<List<Value>> items = list(args, 0);
        if (items.isEmpty()) {
            return Value.NULL;
        }
        for (Value item : items.get()) {
            if (item.isNull()) {
                continue;
            }
            Optional<Boolean> b = toBoolean(item);
            if (b.isEmpty()) {
                return Value.NULL;
            }
            if (b.get()) {
                return Value.TRUE;
            }
        }
        return Value.FALSE;
    }

    private static Optional<Boolean> toBoolean(Value value) {
        if (value instanceof BooleanValue b) {
            return Optional.of(b.value());
        }
        if (value instanceof StringValue s) {
            if ("true".equals(s.value())) {
                return Optional.of(true);
            }
            if ("false".equals(s.value())) {
                return Optional.of(false);
            }
        }
        return Optional.empty();
    }
}
