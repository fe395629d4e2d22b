package com.dmn.model;

import com.dmn.exception.ModelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads decision models from YAML files.
 * <p>
 * FEEL text in the model (rule cells, input expressions, BKM bodies, literal decisions) is
 * parsed once here, so evaluation never re-parses.
 */
public class ModelLoader {

    private static final Logger log = LoggerFactory.getLogger(ModelLoader.class);

    /**
     * Load a model from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the model file
     * @return Loaded model
     * @throws ModelException if the file cannot be read or is malformed
     */
    public static DecisionModel load(String path) {
        log.info("Loading decision model from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parse(inputStream);
            }
        } catch (IOException e) {
            throw new ModelException("Failed to load decision model from: " + path, e);
        }
    }

    /**
     * Load a model from YAML text.
     */
    public static DecisionModel loadFromString(String yamlText) {
        return parseRoot(readYaml(yamlText));
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    private static DecisionModel parse(InputStream inputStream) {
        Object root;
        try {
            root = new Yaml().load(inputStream);
        } catch (YAMLException e) {
            throw new ModelException("Malformed decision model YAML", e);
        }
        return parseRoot(root);
    }

    private static Object readYaml(String yamlText) {
        try {
            return new Yaml().load(yamlText);
        } catch (YAMLException e) {
            throw new ModelException("Malformed decision model YAML", e);
        }
    }

    @SuppressWarnings("unchecked")
    private static DecisionModel parseRoot(Object root) {
        if (!(root instanceof Map<?, ?>)) {
            throw new ModelException("Decision model file is empty or not a mapping");
        }
        Map<String, Object> rootMap = (Map<String, Object>) root;

        // The model may sit at the root or under a 'model' key
        Map<String, Object> modelMap = rootMap.containsKey("model")
                ? asMap(rootMap.get("model"), "model")
                : rootMap;

        String name = getString(modelMap, "name", "default-model");
        DecisionModel.Builder builder = DecisionModel.builder(name);

        for (Map<String, Object> tableMap : getList(modelMap, "decision-tables")) {
            builder.table(parseTable(tableMap));
        }
        for (Map<String, Object> bkmMap : getList(modelMap, "bkms")) {
            builder.bkm(parseBkm(bkmMap));
        }
        for (Map<String, Object> decisionMap : getList(modelMap, "literal-decisions")) {
            builder.literalDecision(parseLiteralDecision(decisionMap));
        }

        DecisionModel model = builder.build();
        log.info("Loaded decision model '{}' with {} decision tables, {} BKMs, {} literal decisions",
                name, model.decisionTables().size(), model.bkms().size(), model.literalDecisions().size());
        return model;
    }

    // ==================== Decision tables ====================

    private static DecisionTable parseTable(Map<String, Object> tableMap) {
        String name = requireString(tableMap, "name", "decision table");
        String id = getString(tableMap, "id", name);
        String policyText = getString(tableMap, "hit-policy", "FIRST");
        HitPolicy hitPolicy = HitPolicy.parse(policyText);

        // Short forms such as C+ carry the aggregation themselves
        String aggregationText = getString(tableMap, "aggregation", null);
        CollectAggregation aggregation = HitPolicy.parseAggregation(
                aggregationText != null ? aggregationText : policyText);
        if (hitPolicy != HitPolicy.COLLECT && aggregation != CollectAggregation.NONE) {
            log.warn("Aggregation {} ignored for table '{}' with hit policy {}", aggregation, name, hitPolicy);
            aggregation = CollectAggregation.NONE;
        }

        List<InputClause> inputs = new ArrayList<>();
        for (Map<String, Object> inputMap : getList(tableMap, "inputs")) {
            inputs.add(parseInput(inputMap));
        }
        List<OutputClause> outputs = new ArrayList<>();
        for (Map<String, Object> outputMap : getList(tableMap, "outputs")) {
            outputs.add(parseOutput(outputMap));
        }
        if (outputs.isEmpty()) {
            throw new ModelException("Decision table '" + name + "' has no outputs");
        }

        List<Rule> rules = new ArrayList<>();
        List<Map<String, Object>> ruleMaps = getList(tableMap, "rules");
        for (int i = 0; i < ruleMaps.size(); i++) {
            rules.add(parseRule(ruleMaps.get(i), i, name, inputs.size(), outputs.size()));
        }

        log.debug("Parsed decision table '{}': {} inputs, {} outputs, {} rules, hit policy {}",
                name, inputs.size(), outputs.size(), rules.size(), hitPolicy);
        return new DecisionTable(id, name, hitPolicy, aggregation, inputs, outputs, rules);
    }

    private static InputClause parseInput(Map<String, Object> inputMap) {
        String label = requireString(inputMap, "label", "input");
        String expression = getString(inputMap, "input-expression", null);
        InputClause parsed = expression != null
                ? InputClause.withExpression(label, expression)
                : InputClause.of(label);
        return new InputClause(label, getString(inputMap, "type-ref", null), expression,
                parsed.expressionAst(), getStrings(inputMap, "allowed-values"));
    }

    private static OutputClause parseOutput(Map<String, Object> outputMap) {
        return new OutputClause(
                requireString(outputMap, "label", "output"),
                getString(outputMap, "type-ref", null),
                getStrings(outputMap, "output-values"),
                getString(outputMap, "default-output", null));
    }

    private static Rule parseRule(Map<String, Object> ruleMap, int index, String tableName,
                                  int inputCount, int outputCount) {
        String id = getString(ruleMap, "id", "rule-" + (index + 1));
        List<String> inputEntries = getStrings(ruleMap, "input-entries");
        List<String> outputEntries = getStrings(ruleMap, "output-entries");

        if (inputEntries.size() != inputCount) {
            throw new ModelException("Rule '" + id + "' of table '" + tableName + "' has "
                    + inputEntries.size() + " input entries, expected " + inputCount);
        }
        if (outputEntries.size() != outputCount) {
            throw new ModelException("Rule '" + id + "' of table '" + tableName + "' has "
                    + outputEntries.size() + " output entries, expected " + outputCount);
        }

        Rule rule = Rule.of(id, inputEntries, outputEntries);
        return new Rule(id, getString(ruleMap, "description", null), rule.inputEntries(), rule.outputEntries());
    }

    // ==================== BKMs and literal decisions ====================

    private static BusinessKnowledgeModel parseBkm(Map<String, Object> bkmMap) {
        String name = requireString(bkmMap, "name", "BKM");
        String expression = requireString(bkmMap, "expression", "BKM '" + name + "'");
        BusinessKnowledgeModel bkm = BusinessKnowledgeModel.of(name, getStrings(bkmMap, "parameters"), expression);
        if (bkm.ast() == null) {
            log.warn("Body of BKM '{}' does not parse: {}", name, expression);
        }
        return bkm;
    }

    private static LiteralDecision parseLiteralDecision(Map<String, Object> decisionMap) {
        String name = requireString(decisionMap, "name", "literal decision");
        String expression = requireString(decisionMap, "expression", "literal decision '" + name + "'");
        LiteralDecision decision = LiteralDecision.of(name, expression);
        if (decision.ast() == null) {
            log.warn("Expression of literal decision '{}' does not parse: {}", name, expression);
        }
        return decision;
    }

    // ==================== Helpers ====================

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String what) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new ModelException("Expected a mapping for '" + what + "'");
    }

    private static List<Map<String, Object>> getList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ModelException("Expected a list for '" + key + "'");
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : list) {
            result.add(asMap(item, key));
        }
        return result;
    }

    private static List<String> getStrings(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ModelException("Expected a list for '" + key + "'");
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            result.add(item == null ? "" : item.toString());
        }
        return result;
    }

    private static String requireString(Map<String, Object> map, String key, String owner) {
        String value = getString(map, key, null);
        if (value == null || value.isBlank()) {
            throw new ModelException("Missing '" + key + "' in " + owner);
        }
        return value;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
