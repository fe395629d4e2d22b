package com.dmn.feel.variable;

import com.dmn.feel.value.ObjectValue;
import com.dmn.feel.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Default implementation of VariableResolver.
 * <p>
 * Variables are looked up as written, then with spaces replaced by underscores, lower-cased,
 * lower-cased with underscores, and finally with spaces removed. Properties are looked up as
 * written, with underscores for spaces, converted from camelCase to snake_case, and lower-cased.
 */
public class DefaultVariableResolver implements VariableResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultVariableResolver.class);

    @Override
    public Optional<Value> resolveVariable(String name, ObjectValue context) {
        if (name == null || name.isEmpty() || context == null) {
            return Optional.empty();
        }

        String underscored = name.replace(' ', '_');
        String lower = name.toLowerCase(Locale.ROOT);
        List<String> candidates = List.of(
                name,
                underscored,
                lower,
                lower.replace(' ', '_'),
                name.replace(" ", ""));

        return firstPresent(candidates, context, name);
    }

    @Override
    public Optional<Value> resolveProperty(String property, ObjectValue object) {
        if (property == null || property.isEmpty() || object == null) {
            return Optional.empty();
        }

        List<String> candidates = List.of(
                property,
                property.replace(' ', '_'),
                camelToSnake(property),
                property.toLowerCase(Locale.ROOT));

        return firstPresent(candidates, object, property);
    }

    @Override
    public Optional<Value> resolvePath(String label, ObjectValue context) {
        if (label == null || label.isEmpty() || context == null) {
            return Optional.empty();
        }
        Optional<Value> direct = context.get(label);
        if (direct.isPresent() || label.indexOf('.') < 0) {
            return direct;
        }

        Value current = context;
        for (String segment : label.split("\\.")) {
            if (!(current instanceof ObjectValue object)) {
                return Optional.empty();
            }
            Optional<Value> next = object.get(segment.trim());
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    private Optional<Value> firstPresent(List<String> candidates, ObjectValue object, String original) {
        for (String candidate : candidates) {
            Optional<Value> value = object.get(candidate);
            if (value.isPresent()) {
                if (!candidate.equals(original)) {
                    log.debug("Resolved '{}' as '{}'", original, candidate);
                }
                return value;
            }
        }
        return Optional.empty();
    }

    static String camelToSnake(String name) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) {
                    sb.append('_');
                }
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
