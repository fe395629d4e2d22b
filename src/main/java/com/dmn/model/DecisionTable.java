package com.dmn.model;

import java.util.List;

/**
 * Decision table. Built once at load time and read concurrently afterwards.
 */
public record DecisionTable(String id, String name, HitPolicy hitPolicy, CollectAggregation aggregation,
                            List<InputClause> inputs, List<OutputClause> outputs, List<Rule> rules) {

    public DecisionTable {
        hitPolicy = hitPolicy == null ? HitPolicy.FIRST : hitPolicy;
        aggregation = aggregation == null ? CollectAggregation.NONE : aggregation;
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        rules = List.copyOf(rules);
    }

    public boolean isSingleOutput() {
        return outputs.size() == 1;
    }

    /**
     * Copy with another hit policy, used for engine-level overrides.
     */
    public DecisionTable withHitPolicy(HitPolicy policy, CollectAggregation collectAggregation) {
        return new DecisionTable(id, name, policy, collectAggregation, inputs, outputs, rules);
    }
}
