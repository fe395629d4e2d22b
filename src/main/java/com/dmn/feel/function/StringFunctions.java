package com.dmn.feel.function;

import com.dmn.feel.value.StringValue;
import com.dmn.feel.value.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

import static com.dmn.feel.function.FormalParameter.optional;
import static com.dmn.feel.function.FormalParameter.required;
import static com.dmn.feel.function.FunctionSupport.arg;
import static com.dmn.feel.function.FunctionSupport.integer;
import static com.dmn.feel.function.FunctionSupport.list;
import static com.dmn.feel.function.FunctionSupport.string;

/**
 * String functions. Positions are 1-based; negative positions count from the end.
 * {@code matches} and {@code replace} work on plain substrings, not regular expressions.
 */
final class StringFunctions {

    private StringFunctions() {
    }

    static void register(FunctionLibrary.Builder library) {
        library.define(FunctionSignature.of("substring",
                        required("string"), required("start position"), optional("length")),
                StringFunctions::substring);
        library.define(FunctionSignature.of("string length", required("string")),
                unary(s -> Value.of(s.codePointCount(0, s.length()))));
        library.define(FunctionSignature.of("upper case", required("string")),
                unary(s -> Value.of(s.toUpperCase(Locale.ROOT))));
        library.define(FunctionSignature.of("lower case", required("string")),
                unary(s -> Value.of(s.toLowerCase(Locale.ROOT))));

        library.define(FunctionSignature.of("substring before", required("string"), required("match")),
                binary((s, m) -> {
                    int at = s.indexOf(m);
                    return Value.of(at < 0 ? "" : s.substring(0, at));
                }));
        library.define(FunctionSignature.of("substring after", required("string"), required("match")),
                binary((s, m) -> {
                    int at = s.indexOf(m);
                    return Value.of(at < 0 ? "" : s.substring(at + m.length()));
                }));
        library.define(FunctionSignature.of("contains", required("string"), required("match")),
                binary((s, m) -> Value.of(s.contains(m))));
        library.define(FunctionSignature.of("starts with", required("string"), required("match")),
                binary((s, m) -> Value.of(s.startsWith(m))));
        library.define(FunctionSignature.of("ends with", required("string"), required("match")),
                binary((s, m) -> Value.of(s.endsWith(m))));

        library.define(FunctionSignature.of("replace",
                        required("input"), required("pattern"), required("replacement"), optional("flags")),
                StringFunctions::replace);
        library.define(FunctionSignature.of("matches",
                        required("input"), required("pattern"), optional("flags")),
                StringFunctions::matches);
        library.define(FunctionSignature.of("split", required("string"), required("delimiter")),
                StringFunctions::split);
        library.define(FunctionSignature.of("string join", required("list"), optional("delimiter")),
                StringFunctions::join);
    }

    private static FeelFunction unary(Function<String, Value> body) {
        return args -> string(args, 0).map(body).orElse(Value.NULL);
    }

    private static FeelFunction binary(BiFunction<String, String, Value> body) {
        return args -> {
            Optional<String> first = string(args, 0);
            Optional<String> second = string(args, 1);
            if (first.isEmpty() || second.isEmpty()) {
                return Value.NULL;
            }
            return body.apply(first.get(), second.get());
        };
    }

    /**
     * Positions count code points. Out-of-range start or a negative length yields the empty string;
     * a null length means "to the end".
     */
    static Value substring(List<Value> args) {
        Optional<String> text = string(args, 0);
        Optional<Integer> start = integer(args, 1);
        if (text.isEmpty() || start.isEmpty()) {
            return Value.NULL;
        }
        String s = text.get();
        int count = s.codePointCount(0, s.length());
        int startIndex = start.get() - 1;
        if (startIndex < 0) {
            startIndex = count + startIndex + 1;
        }
        if (startIndex < 0 || startIndex >= count) {
            return Value.of("");
        }
        int from = s.offsetByCodePoints(0, startIndex);

        Value lengthArg = arg(args, 2);
        if (lengthArg.isNull()) {
            return Value.of(s.substring(from));
        }
        Optional<Integer> length = integer(args, 2);
        if (length.isEmpty()) {
            return Value.NULL;
        }
        if (length.get() < 0) {
            return Value.of("");
        }
        int end = (int) Math.min((long) startIndex + length.get(), count);
        return Value.of(s.substring(from, s.offsetByCodePoints(from, end - startIndex)));
    }

    static Value replace(List<Value> args) {
        Optional<String> input = string(args, 0);
        Optional<String> pattern = string(args, 1);
        Optional<String> replacement = string(args, 2);
        if (input.isEmpty() || pattern.isEmpty() || replacement.isEmpty()) {
            return Value.NULL;
        }
        if (pattern.get().isEmpty()) {
            return Value.of(input.get());
        }
        return Value.of(input.get().replace(pattern.get(), replacement.get()));
    }

    static Value matches(List<Value> args) {
        Optional<String> input = string(args, 0);
        Optional<String> pattern = string(args, 1);
        if (input.isEmpty() || pattern.isEmpty()) {
            return Value.NULL;
        }
        return Value.of(input.get().contains(pattern.get()));
    }

    /**
     * An empty delimiter splits into single characters.
     */
    static Value split(List<Value> args) {
        Optional<String> text = string(args, 0);
        Optional<String> delimiter = string(args, 1);
        if (text.isEmpty() || delimiter.isEmpty()) {
            return Value.NULL;
        }
        String s = text.get();
        String d = delimiter.get();
        List<Value> parts = new ArrayList<>();

        if (d.isEmpty()) {
            s.codePoints().forEach(cp -> parts.add(Value.of(new String(Character.toChars(cp)))));
            return Value.list(parts);
        }

        int start = 0;
        int at = s.indexOf(d);
        while (at >= 0) {
            parts.add(Value.of(s.substring(start, at)));
            start = at + d.length();
            at = s.indexOf(d, start);
        }
        parts.add(Value.of(s.substring(start)));
        return Value.list(parts);
    }

    /**
     * Null elements contribute empty text; a null delimiter joins without separator.
     */
    static Value join(List<Value> args) {
        Optional<List<Value>> items = list(args, 0);
        if (items.isEmpty()) {
            return Value.NULL;
        }
        Value delimiterArg = arg(args, 1);
        String delimiter = "";
        if (delimiterArg instanceof StringValue s) {
            delimiter = s.value();
        } else if (!delimiterArg.isNull()) {
            return Value.NULL;
        }

        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (Value item : items.get()) {
            if (!first) {
                sb.append(delimiter);
            }
            first = false;
            if (!item.isNull()) {
                sb.append(item.asText());
            }
        }
        return Value.of(sb.toString());
    }
}
