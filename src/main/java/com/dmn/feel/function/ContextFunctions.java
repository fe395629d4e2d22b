package com.dmn.feel.function;

import com.dmn.feel.value.ListValue;
import com.dmn.feel.value.ObjectValue;
import com.dmn.feel.value.StringValue;
import com.dmn.feel.value.Value;
import com.dmn.feel.value.Values;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.dmn.feel.function.FormalParameter.required;
import static com.dmn.feel.function.FunctionSupport.arg;

/**
 * Context functions. Entries are exchanged as {@code {key, value}} contexts.
 */
final class ContextFunctions {

    private ContextFunctions() {
    }

    static void register(FunctionLibrary.Builder library) {
        library.define(FunctionSignature.of("get value", required("m"), required("key")),
                ContextFunctions::getValue);
        library.define(FunctionSignature.of("get entries", required("m")), ContextFunctions::getEntries);
        library.define(FunctionSignature.of("context", required("entries")), ContextFunctions::context);
        library.define(FunctionSignature.of("context put", required("context"), required("key"), required("value")),
                ContextFunctions::contextPut);
        library.define(FunctionSignature.of("context merge", required("contexts")), ContextFunctions::contextMerge);
        library.define(FunctionSignature.of("is", required("value1"), required("value2")),
                args -> Value.of(Values.typeName(arg(args, 0)).equals(Values.typeName(arg(args, 1)))
                        && Values.feelEquals(arg(args, 0), arg(args, 1))));
    }

    static Value getValue(List<Value> args) {
        if (arg(args, 0) instanceof ObjectValue m && arg(args, 1) instanceof StringValue key) {
            return m.get(key.value()).orElse(Value.NULL);
        }
        return Value.NULL;
    }

    static Value getEntries(List<Value> args) {
        if (!(arg(args, 0) instanceof ObjectValue m)) {
            return Value.NULL;
        }
        List<Value> entries = new ArrayList<>();
        for (Map.Entry<String, Value> entry : m.entries().entrySet()) {
            Map<String, Value> pair = new LinkedHashMap<>();
            pair.put("key", Value.of(entry.getKey()));
            pair.put("value", entry.getValue());
            entries.add(Value.object(pair));
        }
        return Value.list(entries);
    }

    /**
     * Build a context from a list of {@code {key, value}} entries. A later duplicate key is invalid.
     */
    static Value context(List<Value> args) {
        if (!(arg(args, 0) instanceof ListValue entries)) {
            return Value.NULL;
        }
        Map<String, Value> result = new LinkedHashMap<>();
        for (Value entry : entries.items()) {
            if (!(entry instanceof ObjectValue pair)
                    || !(pair.get("key").orElse(Value.NULL) instanceof StringValue key)
                    || !pair.containsKey("value")
                    || result.containsKey(key.value())) {
                return Value.NULL;
            }
            result.put(key.value(), pair.get("value").orElse(Value.NULL));
        }
        return Value.object(result);
    }

    static Value contextPut(List<Value> args) {
        if (arg(args, 0) instanceof ObjectValue m && arg(args, 1) instanceof StringValue key) {
            return m.with(key.value(), arg(args, 2));
        }
        return Value.NULL;
    }

    static Value contextMerge(List<Value> args) {
        if (!(arg(args, 0) instanceof ListValue contexts)) {
            return Value.NULL;
        }
        Map<String, Value> merged = new LinkedHashMap<>();
        for (Value item : contexts.items()) {
            if (!(item instanceof ObjectValue m)) {
                return Value.NULL;
            }
            merged.putAll(m.entries());
        }
        return Value.object(merged);
    }
}
