package com.dmn.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.dmn.exception.EvaluationException;
import com.dmn.feel.value.BooleanValue;
import com.dmn.feel.value.ListValue;
import com.dmn.feel.value.NullValue;
import com.dmn.feel.value.NumberValue;
import com.dmn.feel.value.ObjectValue;
import com.dmn.feel.value.StringValue;
import com.dmn.feel.value.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between FEEL values and plain Java/JSON data.
 * <p>
 * Java numbers become FEEL numbers; integral FEEL numbers come back as {@link Long}, others as
 * {@link Double}. Anything that is not a map, list, string, number or boolean is mapped through
 * its string form.
 */
public class ValueMapper {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    // 2^53: beyond this doubles no longer hold every integer
    private static final double MAX_EXACT_LONG = 9007199254740992.0;

    /**
     * Parse a JSON object into a context.
     *
     * @param json JSON object text; blank means an empty context
     * @throws EvaluationException if the text is not a JSON object
     */
    public static ObjectValue fromJson(String json) {
        if (json == null || json.isBlank()) {
            return ObjectValue.EMPTY;
        }
        return fromMap(parseJson(json));
    }

    public static ObjectValue fromMap(Map<String, ?> map) {
        if (map == null) {
            return ObjectValue.EMPTY;
        }
        Map<String, Value> entries = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : map.entrySet()) {
            entries.put(entry.getKey(), toValue(entry.getValue()));
        }
        return new ObjectValue(entries);
    }

    public static Value toValue(Object object) {
        if (object == null) {
            return Value.NULL;
        }
        if (object instanceof Value value) {
            return value;
        }
        if (object instanceof Boolean b) {
            return Value.of(b);
        }
        if (object instanceof Number n) {
            return Value.of(n.doubleValue());
        }
        if (object instanceof String s) {
            return Value.of(s);
        }
        if (object instanceof Map<?, ?> map) {
            Map<String, Value> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                entries.put(String.valueOf(entry.getKey()), toValue(entry.getValue()));
            }
            return new ObjectValue(entries);
        }
        if (object instanceof List<?> list) {
            List<Value> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(toValue(item));
            }
            return Value.list(items);
        }
        return Value.of(object.toString());
    }

    /**
     * Plain Java form: null, Boolean, Long, Double, String, List or Map.
     */
    public static Object toObject(Value value) {
        if (value instanceof NullValue) {
            return null;
        }
        if (value instanceof BooleanValue b) {
            return b.value();
        }
        if (value instanceof NumberValue n) {
            if (n.isIntegral() && Math.abs(n.value()) < MAX_EXACT_LONG) {
                return (long) n.value();
            }
            return n.value();
        }
        if (value instanceof StringValue s) {
            return s.value();
        }
        if (value instanceof ListValue l) {
            List<Object> items = new ArrayList<>(l.size());
            for (Value item : l.items()) {
                items.add(toObject(item));
            }
            return items;
        }
        ObjectValue o = (ObjectValue) value;
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<String, Value> entry : o.entries().entrySet()) {
            map.put(entry.getKey(), toObject(entry.getValue()));
        }
        return map;
    }

    public static String toJson(Value value) {
        try {
            return objectMapper.writeValueAsString(toObject(value));
        } catch (JsonProcessingException e) {
            throw new EvaluationException("Cannot serialize value to JSON: " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new EvaluationException("Invalid JSON context: " + e.getMessage(), e);
        }
    }
}
