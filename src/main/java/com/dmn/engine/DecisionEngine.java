package com.dmn.engine;

import com.dmn.bkm.BkmRegistry;
import com.dmn.exception.BkmInvocationException;
import com.dmn.exception.EvaluationException;
import com.dmn.exception.FeelSyntaxException;
import com.dmn.exception.ModelException;
import com.dmn.feel.ast.AstNode;
import com.dmn.feel.evaluator.AstEvaluator;
import com.dmn.feel.evaluator.EvaluationContext;
import com.dmn.feel.expression.FeelExpressions;
import com.dmn.feel.value.ObjectValue;
import com.dmn.feel.value.Value;
import com.dmn.model.BusinessKnowledgeModel;
import com.dmn.model.CollectAggregation;
import com.dmn.model.DecisionModel;
import com.dmn.model.DecisionTable;
import com.dmn.model.HitPolicy;
import com.dmn.model.LiteralDecision;
import com.dmn.model.ModelLoader;
import com.dmn.model.OutputClause;
import com.dmn.model.Rule;
import com.dmn.model.RuleEntry;
import com.dmn.table.DecisionTableEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Entry point for evaluating decision models.
 * <p>
 * Holds decision tables, literal decisions and BKMs by name. {@link #evaluate(ObjectValue)}
 * runs every decision table and then every literal decision against the same input; literal
 * decisions can call any registered BKM. A failing literal decision yields null and is
 * reported in {@link EvaluationResult#errors()}, unless strict mode is on.
 * <p>
 * Thread-safe: decisions can be added or removed while evaluations run.
 */
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final EvaluationOptions options;
    private final AstEvaluator evaluator;
    private final DecisionTableEvaluator tableEvaluator;

    private final Map<String, DecisionTable> tables = new ConcurrentSkipListMap<>();
    private final Map<String, LiteralDecision> literalDecisions = new ConcurrentSkipListMap<>();
    private final BkmRegistry bkms = new BkmRegistry();

    public DecisionEngine() {
        this(EvaluationOptions.defaults());
    }

    public DecisionEngine(EvaluationOptions options) {
        this.options = options;
        this.evaluator = new AstEvaluator(options.maxBkmDepth());
        this.tableEvaluator = new DecisionTableEvaluator(evaluator);
    }

    public DecisionEngine(DecisionModel model, EvaluationOptions options) {
        this(options);
        loadModel(model);
    }

    // ==================== Loading ====================

    public void loadModel(DecisionModel model) {
        model.decisionTables().values().forEach(this::addTable);
        model.literalDecisions().values().forEach(this::addLiteralDecision);
        model.bkms().values().forEach(this::addBkm);
        log.info("Loaded model '{}' into engine: {} tables, {} literal decisions, {} BKMs",
                model.name(), tables.size(), literalDecisions.size(), bkms.size());
    }

    /**
     * Load a YAML model; see {@link ModelLoader#load(String)}.
     */
    public void loadModel(String path) {
        loadModel(ModelLoader.load(path));
    }

    public void addTable(DecisionTable table) {
        tables.put(table.name(), table);
    }

    public void addLiteralDecision(LiteralDecision decision) {
        literalDecisions.put(decision.name(), decision);
    }

    public void addBkm(BusinessKnowledgeModel bkm) {
        bkms.add(bkm);
    }

    // ==================== Evaluation ====================

    /**
     * Evaluate every decision.
     *
     * @param input Input data
     * @return Result keyed by decision name
     * @throws ModelException          on structural table problems such as a disallowed input value
     * @throws BkmInvocationException  if a BKM cannot be invoked
     * @throws EvaluationException     in strict mode, when a literal decision fails
     */
    public EvaluationResult evaluate(ObjectValue input) {
        EvaluationContext context = contextFor(input);
        Map<String, Value> results = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();

        for (DecisionTable table : tables.values()) {
            results.put(table.name(), tableEvaluator.evaluate(withOverride(table), context));
        }

        for (LiteralDecision decision : literalDecisions.values()) {
            try {
                results.put(decision.name(), evaluateLiteral(decision, context));
            } catch (EvaluationException | FeelSyntaxException e) {
                if (options.strictMode()) {
                    throw e;
                }
                log.warn("Literal decision '{}' evaluated to null: {}", decision.name(), e.getMessage());
                results.put(decision.name(), Value.NULL);
                errors.put(decision.name(), e.getMessage());
            }
        }

        return new EvaluationResult(new ObjectValue(results), errors);
    }

    public EvaluationResult evaluate(Map<String, ?> input) {
        return evaluate(ValueMapper.fromMap(input));
    }

    /**
     * Evaluate every decision against a JSON object.
     */
    public EvaluationResult evaluate(String jsonInput) {
        return evaluate(ValueMapper.fromJson(jsonInput));
    }

    public String evaluateToJson(String jsonInput) {
        return evaluate(jsonInput).toJson();
    }

    /**
     * Evaluate a single decision table.
     *
     * @throws ModelException if no table has this name
     */
    public Value evaluateTable(String name, ObjectValue input) {
        DecisionTable table = tables.get(name);
        if (table == null) {
            throw new ModelException("Unknown decision table: '" + name + "'");
        }
        return tableEvaluator.evaluate(withOverride(table), contextFor(input));
    }

    /**
     * Evaluate a single decision, literal or table.
     *
     * @throws ModelException if no decision has this name
     */
    public Value evaluateDecision(String name, ObjectValue input) {
        LiteralDecision decision = literalDecisions.get(name);
        if (decision == null) {
            return evaluateTable(name, input);
        }
        try {
            return evaluateLiteral(decision, contextFor(input));
        } catch (EvaluationException | FeelSyntaxException e) {
            if (options.strictMode()) {
                throw e;
            }
            log.warn("Literal decision '{}' evaluated to null: {}", name, e.getMessage());
            return Value.NULL;
        }
    }

    /**
     * Call a registered BKM directly.
     *
     * @throws BkmInvocationException if no BKM has this name
     */
    public Value invokeBkm(String name, List<Value> args, ObjectValue input) {
        BusinessKnowledgeModel bkm = bkms.get(name)
                .orElseThrow(() -> new BkmInvocationException("Unknown BKM: '" + name + "'"));
        return evaluator.bkmInvoker().invoke(bkm, args, contextFor(input));
    }

    /**
     * Evaluate a standalone FEEL expression with the registered BKMs callable.
     */
    public Value evaluateExpression(String expression, ObjectValue input) {
        return evaluator.evaluate(FeelExpressions.parse(expression), contextFor(input));
    }

    private Value evaluateLiteral(LiteralDecision decision, EvaluationContext context) {
        if (decision.expression() == null || decision.expression().isBlank()) {
            return Value.NULL;
        }
        AstNode ast = decision.parsed().orElseGet(() -> FeelExpressions.parse(decision.expression()));
        return evaluator.evaluate(ast, context);
    }

    private EvaluationContext contextFor(ObjectValue input) {
        return EvaluationContext.of(input).withBkms(bkms.snapshot());
    }

    private DecisionTable withOverride(DecisionTable table) {
        return options.hitPolicy()
                .map(policy -> table.withHitPolicy(policy, options.aggregation()))
                .orElse(table);
    }

    // ==================== Management ====================

    public List<String> tableNames() {
        return List.copyOf(tables.keySet());
    }

    public List<String> literalDecisionNames() {
        return List.copyOf(literalDecisions.keySet());
    }

    public List<String> bkmNames() {
        return bkms.names();
    }

    public boolean removeTable(String name) {
        return tables.remove(name) != null;
    }

    public boolean removeLiteralDecision(String name) {
        return literalDecisions.remove(name) != null;
    }

    public boolean removeBkm(String name) {
        return bkms.remove(name);
    }

    public void clear() {
        tables.clear();
        literalDecisions.clear();
        bkms.clear();
        log.info("Cleared all decisions and BKMs");
    }

    public EvaluationOptions options() {
        return options;
    }

    // ==================== Validation ====================

    /**
     * Check the loaded decisions for structural problems.
     *
     * @return One message per problem, empty if none
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        for (DecisionTable table : tables.values()) {
            validateTable(table, problems);
        }
        for (LiteralDecision decision : literalDecisions.values()) {
            if (decision.ast() == null) {
                problems.add("Literal decision '" + decision.name() + "' does not parse: " + decision.expression());
            }
        }
        for (String name : bkms.names()) {
            bkms.get(name)
                    .filter(bkm -> bkm.ast() == null)
                    .ifPresent(bkm -> problems.add("BKM '" + name + "' does not parse: " + bkm.expression()));
        }
        return problems;
    }

    private static void validateTable(DecisionTable table, List<String> problems) {
        String name = table.name();
        if (table.hitPolicy() != HitPolicy.COLLECT && table.aggregation() != CollectAggregation.NONE) {
            problems.add("Table '" + name + "' has aggregation " + table.aggregation()
                    + " but hit policy " + table.hitPolicy());
        }
        if (table.hitPolicy() == HitPolicy.PRIORITY
                && table.outputs().stream().allMatch(o -> o.outputValues().isEmpty())) {
            problems.add("Table '" + name + "' uses PRIORITY but no output declares output values");
        }
        for (Rule rule : table.rules()) {
            if (rule.inputEntries().size() != table.inputs().size()) {
                problems.add("Rule '" + rule.id() + "' of table '" + name + "' has "
                        + rule.inputEntries().size() + " input entries, expected " + table.inputs().size());
            }
            if (rule.outputEntries().size() != table.outputs().size()) {
                problems.add("Rule '" + rule.id() + "' of table '" + name + "' has "
                        + rule.outputEntries().size() + " output entries, expected " + table.outputs().size());
            }
            for (RuleEntry entry : rule.outputEntries()) {
                if (entry.ast() == null) {
                    problems.add("Output entry '" + entry.text() + "' of rule '" + rule.id()
                            + "' in table '" + name + "' is not a FEEL expression");
                }
            }
        }
        for (OutputClause output : table.outputs()) {
            if (output.label() == null || output.label().isBlank()) {
                problems.add("Table '" + name + "' has an output without a label");
            }
        }
    }
}
