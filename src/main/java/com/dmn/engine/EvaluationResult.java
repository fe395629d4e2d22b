package com.dmn.engine;

import com.dmn.feel.value.ObjectValue;
import com.dmn.feel.value.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Result of evaluating every decision of a model.
 *
 * @param decisions Result per decision name
 * @param errors    Error message per literal decision that evaluated to null because it failed
 */
public record EvaluationResult(ObjectValue decisions, Map<String, String> errors) {

    public EvaluationResult {
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public Optional<Value> get(String decisionName) {
        return decisions.get(decisionName);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> toMap() {
        return (Map<String, Object>) ValueMapper.toObject(decisions);
    }

    public String toJson() {
        return ValueMapper.toJson(decisions);
    }
}
