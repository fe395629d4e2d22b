package com.dmn.feel.evaluator;

import com.dmn.feel.value.ObjectValue;
import com.dmn.model.BusinessKnowledgeModel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * State threaded explicitly through one evaluation: variable bindings, the BKMs callable by
 * name, and the current BKM call depth. Immutable; every change returns a new context.
 */
public final class EvaluationContext {

    private final ObjectValue variables;
    private final Map<String, BusinessKnowledgeModel> bkms;
    private final int depth;

    private EvaluationContext(ObjectValue variables, Map<String, BusinessKnowledgeModel> bkms, int depth) {
        this.variables = variables == null ? ObjectValue.EMPTY : variables;
        this.bkms = bkms;
        this.depth = depth;
    }

    public static EvaluationContext of(ObjectValue variables) {
        return new EvaluationContext(variables, Map.of(), 0);
    }

    public static EvaluationContext empty() {
        return of(ObjectValue.EMPTY);
    }

    public EvaluationContext withVariables(ObjectValue newVariables) {
        return new EvaluationContext(newVariables, bkms, depth);
    }

    public EvaluationContext withBkms(Map<String, BusinessKnowledgeModel> available) {
        return new EvaluationContext(variables, Collections.unmodifiableMap(new LinkedHashMap<>(available)), depth);
    }

    /**
     * Context for the body of a BKM call one level deeper.
     */
    public EvaluationContext nested(ObjectValue boundVariables) {
        return new EvaluationContext(boundVariables, bkms, depth + 1);
    }

    public ObjectValue variables() {
        return variables;
    }

    public Map<String, BusinessKnowledgeModel> bkms() {
        return bkms;
    }

    public Optional<BusinessKnowledgeModel> bkm(String name) {
        return Optional.ofNullable(bkms.get(name));
    }

    public int depth() {
        return depth;
    }
}
