package com.dmn.feel.function;

import com.dmn.feel.value.ListValue;
import com.dmn.feel.value.StringValue;
import com.dmn.feel.value.Value;
import com.dmn.feel.value.Values;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static com.dmn.feel.function.FormalParameter.optional;
import static com.dmn.feel.function.FormalParameter.required;
import static com.dmn.feel.function.FunctionSupport.arg;
import static com.dmn.feel.function.FunctionSupport.integer;
import static com.dmn.feel.function.FunctionSupport.list;
import static com.dmn.feel.function.FunctionSupport.numbers;
import static com.dmn.feel.function.FunctionSupport.toIndex;

/**
 * List functions. Positions are 1-based; negative positions count from the end.
 */
final class ListFunctions {

    private ListFunctions() {
    }

    static void register(FunctionLibrary.Builder library) {
        library.define(FunctionSignature.of("list contains", required("list"), required("element")),
                ListFunctions::listContains);
        library.define(FunctionSignature.of("count", required("list")),
                onList(items -> Value.of(items.size())));
        library.define(FunctionSignature.of("min", required("list")), args -> extreme(args, -1));
        library.define(FunctionSignature.of("max", required("list")), args -> extreme(args, 1));
        library.define(FunctionSignature.of("sum", required("list")),
                onNumbers(n -> Value.of(Arrays.stream(n).sum())));
        library.define(FunctionSignature.of("mean", required("list")),
                onNumbers(n -> Value.of(Arrays.stream(n).sum() / n.length)));
        library.define(FunctionSignature.of("product", required("list")),
                onNumbers(n -> Value.of(Arrays.stream(n).reduce(1.0, (a, b) -> a * b))));
        library.define(FunctionSignature.of("median", required("list")), onNumbers(ListFunctions::median));
        library.define(FunctionSignature.of("stddev", required("list")), onNumbers(ListFunctions::stddev));
        library.define(FunctionSignature.of("mode", required("list")), ListFunctions::mode);

        library.define(FunctionSignature.of("sublist",
                        required("list"), required("start position"), optional("length")),
                ListFunctions::sublist);
        library.define(FunctionSignature.variadic("append", required("list")), ListFunctions::append);
        library.define(FunctionSignature.variadic("concatenate", required("list")), ListFunctions::concatenate);
        library.define(FunctionSignature.variadic("union", required("list")),
                args -> distinct(concatenate(args)));
        library.define(FunctionSignature.of("insert before",
                        required("list"), required("position"), required("newItem")),
                ListFunctions::insertBefore);
        library.define(FunctionSignature.of("remove", required("list"), required("position")),
                ListFunctions::remove);
        library.define(FunctionSignature.of("list replace",
                        required("list"), required("position"), required("newItem")),
                ListFunctions::listReplace);
        library.define(FunctionSignature.of("reverse", required("list")), onList(items -> {
            List<Value> reversed = new ArrayList<>(items);
            Collections.reverse(reversed);
            return Value.list(reversed);
        }));
        library.define(FunctionSignature.of("index of", required("list"), required("match")),
                ListFunctions::indexOf);
        library.define(FunctionSignature.of("distinct values", required("list")),
                args -> distinct(arg(args, 0)));
        library.define(FunctionSignature.of("flatten", required("list")), onList(items -> {
            List<Value> flat = new ArrayList<>();
            flattenInto(items, flat);
            return Value.list(flat);
        }));
    }

    private static FeelFunction onList(Function<List<Value>, Value> body) {
        return args -> list(args, 0).map(body).orElse(Value.NULL);
    }

    /**
     * Body over a non-empty all-number list; anything else yields null.
     */
    private static FeelFunction onNumbers(Function<double[], Value> body) {
        return args -> list(args, 0)
                .flatMap(FunctionSupport::numbers)
                .filter(n -> n.length > 0)
                .map(body)
                .orElse(Value.NULL);
    }

    static Value listContains(List<Value> args) {
        Optional<List<Value>> items = list(args, 0);
        if (items.isEmpty()) {
            return Value.NULL;
        }
        Value element = arg(args, 1);
        return Value.of(items.get().stream().anyMatch(item -> Values.feelEquals(item, element)));
    }

    /**
     * Minimum (direction -1) or maximum (direction 1) of a list of numbers or of strings.
     */
    private static Value extreme(List<Value> args, int direction) {
        Optional<List<Value>> items = list(args, 0);
        if (items.isEmpty() || items.get().isEmpty()) {
            return Value.NULL;
        }
        List<Value> values = items.get();
        Optional<double[]> nums = numbers(values);
        if (nums.isPresent()) {
            double best = nums.get()[0];
            for (double n : nums.get()) {
                if (Double.compare(n, best) * direction > 0) {
                    best = n;
                }
            }
            return Value.of(best);
        }
        if (values.stream().allMatch(v -> v instanceof StringValue)) {
            String best = ((StringValue) values.get(0)).value();
            for (Value v : values) {
                String s = ((StringValue) v).value();
                if (s.compareTo(best) * direction > 0) {
                    best = s;
                }
            }
            return Value.of(best);
        }
        return Value.NULL;
    }

    private static Value median(double[] numbers) {
        double[] sorted = numbers.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return Value.of(sorted[mid]);
        }
        return Value.of((sorted[mid - 1] + sorted[mid]) / 2.0);
    }

    /**
     * Sample standard deviation; fewer than two values yields null.
     */
    private static Value stddev(double[] numbers) {
        if (numbers.length < 2) {
            return Value.NULL;
        }
        double mean = Arrays.stream(numbers).sum() / numbers.length;
        double squares = Arrays.stream(numbers).map(n -> (n - mean) * (n - mean)).sum();
        return Value.of(Math.sqrt(squares / (numbers.length - 1)));
    }

    /**
     * Most frequent numbers, ascending. The empty list yields the empty list.
     */
    static Value mode(List<Value> args) {
        Optional<double[]> nums = list(args, 0).flatMap(FunctionSupport::numbers);
        if (nums.isEmpty()) {
            return Value.NULL;
        }
        Map<Double, Integer> counts = new LinkedHashMap<>();
        for (double n : nums.get()) {
            counts.merge(n, 1, Integer::sum);
        }
        int top = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        List<Value> modes = counts.entrySet().stream()
                .filter(e -> e.getValue() == top)
                .map(Map.Entry::getKey)
                .sorted()
                .map(Value::of)
                .toList();
        return Value.list(modes);
    }

    static Value sublist(List<Value> args) {
        Optional<List<Value>> items = list(args, 0);
        Optional<Integer> start = integer(args, 1);
        if (items.isEmpty() || start.isEmpty()) {
            return Value.NULL;
        }
        List<Value> values = items.get();
        int from = toIndex(start.get(), values.size());
        if (from < 0) {
            return Value.NULL;
        }
        if (arg(args, 2).isNull()) {
            return Value.list(values.subList(from, values.size()));
        }
        Optional<Integer> length = integer(args, 2);
        if (length.isEmpty() || length.get() < 0 || from + length.get() > values.size()) {
            return Value.NULL;
        }
        return Value.list(values.subList(from, from + length.get()));
    }

    static Value append(List<Value> args) {
        Optional<List<Value>> items = list(args, 0);
        if (items.isEmpty()) {
            return Value.NULL;
        }
        List<Value> result = new ArrayList<>(items.get());
        result.addAll(args.subList(1, args.size()));
        return Value.list(result);
    }

    static Value concatenate(List<Value> args) {
        List<Value> result = new ArrayList<>();
        for (Value arg : args) {
            if (!(arg instanceof ListValue l)) {
                return Value.NULL;
            }
            result.addAll(l.items());
        }
        return Value.list(result);
    }

    static Value insertBefore(List<Value> args) {
        Optional<List<Value>> items = list(args, 0);
        Optional<Integer> position = integer(args, 1);
        if (items.isEmpty() || position.isEmpty()) {
            return Value.NULL;
        }
        int index = toIndex(position.get(), items.get().size());
        if (index < 0) {
            return Value.NULL;
        }
        List<Value> result = new ArrayList<>(items.get());
        result.add(index, arg(args, 2));
        return Value.list(result);
    }

    static Value remove(List<Value> args) {
        Optional<List<Value>> items = list(args, 0);
        Optional<Integer> position = integer(args, 1);
        if (items.isEmpty() || position.isEmpty()) {
            return Value.NULL;
        }
        int index = toIndex(position.get(), items.get().size());
        if (index < 0) {
            return Value.NULL;
        }
        List<Value> result = new ArrayList<>(items.get());
        result.remove(index);
        return Value.list(result);
    }

    static Value listReplace(List<Value> args) {
        Optional<List<Value>> items = list(args, 0);
        Optional<Integer> position = integer(args, 1);
        if (items.isEmpty() || position.isEmpty()) {
            return Value.NULL;
        }
        int index = toIndex(position.get(), items.get().size());
        if (index < 0) {
            return Value.NULL;
        }
        List<Value> result = new ArrayList<>(items.get());
        result.set(index, arg(args, 2));
        return Value.list(result);
    }

    static Value indexOf(List<Value> args) {
        Optional<List<Value>> items = list(args, 0);
        if (items.isEmpty()) {
            return Value.NULL;
        }
        Value match = arg(args, 1);
        List<Value> positions = new ArrayList<>();
        for (int i = 0; i < items.get().size(); i++) {
            if (Values.feelEquals(items.get().get(i), match)) {
                positions.add(Value.of(i + 1));
            }
        }
        return Value.list(positions);
    }

    private static Value distinct(Value value) {
        if (!(value instanceof ListValue l)) {
            return Value.NULL;
        }
        List<Value> result = new ArrayList<>();
        for (Value item : l.items()) {
            if (result.stream().noneMatch(existing -> Values.feelEquals(existing, item))) {
                result.add(item);
            }
        }
        return Value.list(result);
    }

    private static void flattenInto(List<Value> items, List<Value> out) {
        for (Value item : items) {
            if (item instanceof ListValue nested) {
                flattenInto(nested.items(), out);
            } else {
                out.add(item);
            }
        }
    }
}
