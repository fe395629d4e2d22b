package com.dmn.table;

import com.dmn.exception.EvaluationException;
import com.dmn.exception.ModelException;
import com.dmn.feel.ast.AstNode;
import com.dmn.feel.evaluator.AstEvaluator;
import com.dmn.feel.evaluator.EvaluationContext;
import com.dmn.feel.expression.FeelExpressions;
import com.dmn.feel.value.ObjectValue;
import com.dmn.feel.value.Value;
import com.dmn.feel.value.Values;
import com.dmn.model.DecisionTable;
import com.dmn.model.InputClause;
import com.dmn.model.OutputClause;
import com.dmn.model.Rule;
import com.dmn.model.RuleEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates decision tables.
 * <p>
 * Evaluation runs in three steps:
 * <ol>
 *   <li>Input values are read and checked against each input's allowed values.</li>
 *   <li>Rules are tested in declaration order. A rule matches only if every input cell matches.
 *       A cell matches if its FEEL expression evaluates to the input value, otherwise it is
 *       tried as a unary test.</li>
 *   <li>The matched rules are reduced by {@link HitPolicyResolver}.</li>
 * </ol>
 * FIRST, UNIQUE and ANY stop at the first match. With no match the result is the output's
 * default value for single-output tables that declare one, otherwise an empty object.
 */
public class DecisionTableEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DecisionTableEvaluator.class);

    private final AstEvaluator evaluator;

    public DecisionTableEvaluator(AstEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * Evaluate a table.
     *
     * @param table   Decision table
     * @param context Input data and callable BKMs
     * @return Table result
     * @throws ModelException if an input value is outside its allowed values or a rule has the
     *                        wrong number of entries
     */
    public Value evaluate(DecisionTable table, EvaluationContext context) {
        List<Value> inputValues = readInputs(table, context);
        List<RuleMatch> matches = findMatches(table, inputValues, context);

        if (matches.isEmpty()) {
            log.debug("No rule matched in table '{}'", table.name());
            return defaultResult(table, context);
        }
        Value result = HitPolicyResolver.resolve(table, matches);
        log.debug("Table '{}' ({}) matched {} rule(s), result {}",
                table.name(), table.hitPolicy(), matches.size(), result);
        return result;
    }

    /**
     * All rules that match, in declaration order, regardless of the hit policy.
     */
    public List<RuleMatch> matchingRules(DecisionTable table, EvaluationContext context) {
        List<Value> inputValues = readInputs(table, context);
        List<RuleMatch> matches = new ArrayList<>();
        List<Rule> rules = table.rules();
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            if (ruleMatches(table, rule, inputValues, context)) {
                matches.add(new RuleMatch(i, rule.id(), computeOutput(table, rule, context)));
            }
        }
        return matches;
    }

    private List<RuleMatch> findMatches(DecisionTable table, List<Value> inputValues, EvaluationContext context) {
        List<RuleMatch> matches = new ArrayList<>();
        List<Rule> rules = table.rules();
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            if (!ruleMatches(table, rule, inputValues, context)) {
                continue;
            }
            log.debug("Rule {} of table '{}' matched", rule.id() != null ? rule.id() : i + 1, table.name());
            matches.add(new RuleMatch(i, rule.id(), computeOutput(table, rule, context)));
            if (table.hitPolicy().isSingleHit()) {
                break;
            }
        }
        return matches;
    }

    // ==================== Inputs ====================

    private List<Value> readInputs(DecisionTable table, EvaluationContext context) {
        List<Value> values = new ArrayList<>(table.inputs().size());
        for (InputClause input : table.inputs()) {
            Optional<Value> value = readInput(input, context);
            value.ifPresent(v -> checkAllowed(input, v));
            values.add(value.orElse(Value.NULL));
        }
        return values;
    }

    private Optional<Value> readInput(InputClause input, EvaluationContext context) {
        ObjectValue variables = context.variables();
        if (input.parsedExpression().isPresent()) {
            try {
                return Optional.of(evaluator.evaluate(input.parsedExpression().get(), context));
            } catch (EvaluationException e) {
                log.debug("Input expression '{}' could not be evaluated: {}",
                        input.inputExpression(), e.getMessage());
            }
        }
        Optional<Value> byLabel = evaluator.resolver().resolvePath(input.label(), variables);
        if (byLabel.isPresent() || input.inputExpression() == null) {
            return byLabel;
        }
        return evaluator.resolver().resolvePath(input.inputExpression().trim(), variables);
    }

    private static void checkAllowed(InputClause input, Value value) {
        if (input.allowedValues().isEmpty() || value.isNull()) {
            return;
        }
        String text = value.asText();
        for (String allowed : input.allowedValues()) {
            if (UnaryTestMatcher.unquote(allowed).equals(text)) {
                return;
            }
        }
        throw new ModelException("Input value for '" + input.label() + "' not in allowed values: " + text);
    }

    // ==================== Matching ====================

    private boolean ruleMatches(DecisionTable table, Rule rule, List<Value> inputValues, EvaluationContext context) {
        List<RuleEntry> entries = rule.inputEntries();
        if (entries.size() != inputValues.size()) {
            throw new ModelException("Rule " + rule.id() + " of table '" + table.name() + "' has "
                    + entries.size() + " input entries but the table has " + inputValues.size() + " inputs");
        }
        for (int i = 0; i < entries.size(); i++) {
            if (!cellMatches(entries.get(i), inputValues.get(i), context)) {
                return false;
            }
        }
        return true;
    }

    private boolean cellMatches(RuleEntry entry, Value input, EvaluationContext context) {
        if (entry.isWildcard()) {
            return true;
        }
        Optional<AstNode> ast = entry.parsed();
        if (ast.isPresent()) {
            try {
                if (Values.feelEquals(evaluator.evaluate(ast.get(), context), input)) {
                    return true;
                }
            } catch (EvaluationException e) {
                log.debug("Cell '{}' is not a FEEL expression here, trying unary test: {}",
                        entry.text(), e.getMessage());
            }
        }
        return UnaryTestMatcher.matches(entry.text(), input);
    }

    // ==================== Outputs ====================

    private Value computeOutput(DecisionTable table, Rule rule, EvaluationContext context) {
        List<RuleEntry> entries = rule.outputEntries();
        List<OutputClause> outputs = table.outputs();
        if (entries.size() != outputs.size()) {
            throw new ModelException("Rule " + rule.id() + " of table '" + table.name() + "' has "
                    + entries.size() + " output entries but the table has " + outputs.size() + " outputs");
        }
        if (table.isSingleOutput()) {
            return outputValue(entries.get(0), context);
        }
        Map<String, Value> result = new LinkedHashMap<>();
        for (int i = 0; i < outputs.size(); i++) {
            result.put(outputs.get(i).label(), outputValue(entries.get(i), context));
        }
        return Value.object(result);
    }

    private Value outputValue(RuleEntry entry, EvaluationContext context) {
        Optional<AstNode> ast = entry.parsed();
        if (ast.isPresent()) {
            try {
                return evaluator.evaluate(ast.get(), context);
            } catch (EvaluationException e) {
                log.debug("Output entry '{}' kept as literal text: {}", entry.text(), e.getMessage());
            }
        }
        return Value.of(UnaryTestMatcher.unquote(entry.text()));
    }

    private Value defaultResult(DecisionTable table, EvaluationContext context) {
        if (!table.isSingleOutput()) {
            return ObjectValue.EMPTY;
        }
        return table.outputs().get(0).defaultOutputText()
                .map(text -> outputValue(new RuleEntry(text, FeelExpressions.tryParse(text).orElse(null)), context))
                .orElse(ObjectValue.EMPTY);
    }
}
