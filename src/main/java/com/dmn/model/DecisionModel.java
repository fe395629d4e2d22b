package com.dmn.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loaded decision model: decision tables, BKMs and literal decisions, each keyed by name in
 * declaration order.
 */
public record DecisionModel(String name,
                            Map<String, DecisionTable> decisionTables,
                            Map<String, BusinessKnowledgeModel> bkms,
                            Map<String, LiteralDecision> literalDecisions) {

    public DecisionModel {
        decisionTables = Collections.unmodifiableMap(new LinkedHashMap<>(decisionTables));
        bkms = Collections.unmodifiableMap(new LinkedHashMap<>(bkms));
        literalDecisions = Collections.unmodifiableMap(new LinkedHashMap<>(literalDecisions));
    }

    public static DecisionModel empty(String name) {
        return new DecisionModel(name, Map.of(), Map.of(), Map.of());
    }

    public Optional<DecisionTable> table(String tableName) {
        return Optional.ofNullable(decisionTables.get(tableName));
    }

    public Optional<BusinessKnowledgeModel> bkm(String bkmName) {
        return Optional.ofNullable(bkms.get(bkmName));
    }

    public Optional<LiteralDecision> literalDecision(String decisionName) {
        return Optional.ofNullable(literalDecisions.get(decisionName));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Assembles a model; later entries replace earlier ones with the same name.
     */
    public static final class Builder {

        private final String name;
        private final Map<String, DecisionTable> tables = new LinkedHashMap<>();
        private final Map<String, BusinessKnowledgeModel> bkms = new LinkedHashMap<>();
        private final Map<String, LiteralDecision> literals = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder table(DecisionTable table) {
            tables.put(table.name(), table);
            return this;
        }

        public Builder bkm(BusinessKnowledgeModel bkm) {
            bkms.put(bkm.name(), bkm);
            return this;
        }

        public Builder literalDecision(LiteralDecision decision) {
            literals.put(decision.name(), decision);
            return this;
        }

        public Builder tables(List<DecisionTable> decisionTables) {
            decisionTables.forEach(this::table);
            return this;
        }

        public DecisionModel build() {
            return new DecisionModel(name, tables, bkms, literals);
        }
    }
}
