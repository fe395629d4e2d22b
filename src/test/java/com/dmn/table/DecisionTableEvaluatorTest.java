package com.dmn.table;

import com.dmn.exception.ModelException;
import com.dmn.feel.evaluator.AstEvaluator;
import com.dmn.feel.evaluator.EvaluationContext;
import com.dmn.feel.value.ObjectValue;
import com.dmn.feel.value.Value;
import com.dmn.model.CollectAggregation;
import com.dmn.model.DecisionTable;
import com.dmn.model.HitPolicy;
import com.dmn.model.InputClause;
import com.dmn.model.OutputClause;
import com.dmn.model.Rule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DecisionTableEvaluator.
 */
class DecisionTableEvaluatorTest {

    private final DecisionTableEvaluator evaluator = new DecisionTableEvaluator(new AstEvaluator());

    private static EvaluationContext context(String key, Value value) {
        return EvaluationContext.of(new ObjectValue(Map.of(key, value)));
    }

    private static DecisionTable table(HitPolicy policy, CollectAggregation aggregation,
                                       List<InputClause> inputs, List<OutputClause> outputs, Rule... rules) {
        return new DecisionTable("t1", "Test Table", policy, aggregation, inputs, outputs, List.of(rules));
    }

    private static DecisionTable singleInput(HitPolicy policy, CollectAggregation aggregation, Rule... rules) {
        return table(policy, aggregation, List.of(InputClause.of("Age")), List.of(OutputClause.of("Result")), rules);
    }

    private static Rule rule(String input, String output) {
        return Rule.of(null, List.of(input), List.of(output));
    }

    private static Value strings(String... values) {
        return Value.list(List.of(values).stream().map(Value::of).toList());
    }

    // =====================================================================
    // Single-hit policies
    // =====================================================================

    @Nested
    @DisplayName("Single-hit policies")
    class SingleHit {

        private final Rule[] ageRules = {
                rule("< 18", "\"Minor\""),
                rule("[18..65)", "\"Adult\""),
                rule(">= 65", "\"Senior\""),
                rule("> 60", "\"Veteran\"")
        };

        @ParameterizedTest
        @CsvSource({
                "10, Minor",
                "18, Adult",
                "64.5, Adult",
                "70, Senior"
        })
        @DisplayName("FIRST returns the first matching rule")
        void firstReturnsFirstMatch(double age, String expected) {
            DecisionTable table = singleInput(HitPolicy.FIRST, null, ageRules);
            assertEquals(Value.of(expected), evaluator.evaluate(table, context("Age", Value.of(age))));
        }

        @Test
        @DisplayName("UNIQUE and ANY stop at the first match")
        void uniqueAndAnyStopAtFirst() {
            EvaluationContext ctx = context("Age", Value.of(70));
            assertEquals(Value.of("Senior"), evaluator.evaluate(singleInput(HitPolicy.UNIQUE, null, ageRules), ctx));
            assertEquals(Value.of("Senior"), evaluator.evaluate(singleInput(HitPolicy.ANY, null, ageRules), ctx));
        }

        @Test
        @DisplayName("matchingRules reports every match whatever the policy")
        void matchingRulesReportsAll() {
            List<RuleMatch> matches = evaluator.matchingRules(
                    singleInput(HitPolicy.FIRST, null, ageRules), context("Age", Value.of(70)));

            assertEquals(List.of(2, 3), matches.stream().map(RuleMatch::ruleIndex).toList());
            assertEquals(Value.of("Veteran"), matches.get(1).output());
        }
    }

    // =====================================================================
    // Multi-hit policies
    // =====================================================================

    @Nested
    @DisplayName("Multi-hit policies")
    class MultiHit {

        private final Rule[] feeRules = {
                rule("-", "10"),
                rule("> 5", "20"),
                rule("> 10", "30"),
                rule("> 100", "40")
        };

        @Test
        @DisplayName("RULE_ORDER lists outputs in declaration order")
        void ruleOrder() {
            Value result = evaluator.evaluate(singleInput(HitPolicy.RULE_ORDER, null,
                    rule("-", "\"c\""), rule("-", "\"a\""), rule("> 100", "\"x\""), rule("-", "\"b\"")),
                    context("Age", Value.of(1)));

            assertEquals(strings("c", "a", "b"), result);
        }

        @Test
        @DisplayName("OUTPUT_ORDER sorts outputs")
        void outputOrder() {
            Value result = evaluator.evaluate(singleInput(HitPolicy.OUTPUT_ORDER, null,
                    rule("-", "\"c\""), rule("-", "\"a\""), rule("-", "\"b\"")),
                    context("Age", Value.of(1)));

            assertEquals(strings("a", "b", "c"), result);
        }

        @ParameterizedTest
        @CsvSource({
                "SUM, 60",
                "COUNT, 3",
                "MIN, 10",
                "MAX, 30"
        })
        @DisplayName("COLLECT aggregates the matched outputs")
        void collectAggregates(CollectAggregation aggregation, double expected) {
            Value result = evaluator.evaluate(singleInput(HitPolicy.COLLECT, aggregation, feeRules),
                    context("Age", Value.of(15)));

            assertEquals(Value.of(expected), result);
        }

        @Test
        @DisplayName("COLLECT without aggregation returns the list")
        void collectList() {
            Value result = evaluator.evaluate(singleInput(HitPolicy.COLLECT, CollectAggregation.NONE, feeRules),
                    context("Age", Value.of(8)));

            assertEquals(Value.list(List.of(Value.of(10), Value.of(20))), result);
        }

        @Test
        @DisplayName("COLLECT MIN over non-numeric outputs is null")
        void collectMinNonNumeric() {
            Value result = evaluator.evaluate(singleInput(HitPolicy.COLLECT, CollectAggregation.MIN,
                    rule("-", "\"a\""), rule("-", "\"b\"")), context("Age", Value.of(1)));

            assertEquals(Value.NULL, result);
        }

        @Test
        @DisplayName("PRIORITY picks the output ranked highest")
        void priority() {
            DecisionTable table = table(HitPolicy.PRIORITY, null,
                    List.of(InputClause.of("Age")),
                    List.of(OutputClause.of("Status", List.of("\"Approved\"", "\"Declined\""))),
                    rule("-", "\"Declined\""),
                    rule(">= 18", "\"Approved\""));

            assertEquals(Value.of("Approved"), evaluator.evaluate(table, context("Age", Value.of(30))));
            assertEquals(Value.of("Declined"), evaluator.evaluate(table, context("Age", Value.of(12))));
        }

        @Test
        @DisplayName("PRIORITY ties go to the earlier rule")
        void priorityTie() {
            DecisionTable table = table(HitPolicy.PRIORITY, null,
                    List.of(InputClause.of("Age")),
                    List.of(OutputClause.of("Status", List.of("High")), OutputClause.of("Reason")),
                    Rule.of("r1", List.of("-"), List.of("\"High\"", "\"first\"")),
                    Rule.of("r2", List.of("-"), List.of("\"High\"", "\"second\"")));

            ObjectValue result = assertInstanceOf(ObjectValue.class,
                    evaluator.evaluate(table, context("Age", Value.of(1))));
            assertEquals(Value.of("first"), result.get("Reason").orElseThrow());
        }
    }

    // =====================================================================
    // Inputs
    // =====================================================================

    @Nested
    @DisplayName("Inputs")
    class Inputs {

        @Test
        @DisplayName("Input expressions are evaluated with the FEEL evaluator")
        void inputExpression() {
            DecisionTable table = table(HitPolicy.FIRST, null,
                    List.of(InputClause.withExpression("Score", "Applicant.creditScore")),
                    List.of(OutputClause.of("Band")),
                    rule(">= 700", "\"Good\""), rule("-", "\"Poor\""));
            EvaluationContext ctx = context("Applicant", Value.object(Map.of("credit_score", Value.of(720))));

            assertEquals(Value.of("Good"), evaluator.evaluate(table, ctx));
        }

        @Test
        @DisplayName("A dotted label is read as a path")
        void dottedLabel() {
            DecisionTable table = table(HitPolicy.FIRST, null,
                    List.of(InputClause.of("Applicant.age")),
                    List.of(OutputClause.of("Adult")),
                    rule(">= 18", "true"), rule("-", "false"));
            EvaluationContext ctx = context("Applicant", Value.object(Map.of("age", Value.of(17))));

            assertEquals(Value.FALSE, evaluator.evaluate(table, ctx));
        }

        @Test
        @DisplayName("Values outside the allowed values are rejected")
        void allowedValues() {
            DecisionTable table = table(HitPolicy.FIRST, null,
                    List.of(InputClause.withAllowedValues("Employment", List.of("\"EMPLOYED\"", "\"UNEMPLOYED\""))),
                    List.of(OutputClause.of("Result")),
                    rule("\"EMPLOYED\"", "1"), rule("-", "0"));

            assertEquals(Value.of(1), evaluator.evaluate(table, context("Employment", Value.of("EMPLOYED"))));
            ModelException e = assertThrows(ModelException.class,
                    () -> evaluator.evaluate(table, context("Employment", Value.of("RETIRED"))));
            assertEquals("Input value for 'Employment' not in allowed values: RETIRED", e.getMessage());
        }

        @Test
        @DisplayName("A cell may reference other variables")
        void cellReferencesVariable() {
            DecisionTable table = table(HitPolicy.FIRST, null,
                    List.of(InputClause.of("Age")),
                    List.of(OutputClause.of("Result")),
                    rule("Limit", "\"at limit\""), rule("-", "\"other\""));
            EvaluationContext ctx = EvaluationContext.of(new ObjectValue(Map.of(
                    "Age", Value.of(21), "Limit", Value.of(21))));

            assertEquals(Value.of("at limit"), evaluator.evaluate(table, ctx));
        }

        @Test
        @DisplayName("Unquoted text cells are matched literally")
        void unquotedTextCell() {
            DecisionTable table = table(HitPolicy.FIRST, null,
                    List.of(InputClause.of("Tier")),
                    List.of(OutputClause.of("Discount")),
                    rule("Gold", "0.2"), rule("Silver, Bronze", "0.1"), rule("-", "0"));

            assertEquals(Value.of(0.2), evaluator.evaluate(table, context("Tier", Value.of("Gold"))));
            assertEquals(Value.of(0.1), evaluator.evaluate(table, context("Tier", Value.of("Bronze"))));
        }

        @Test
        @DisplayName("A rule with the wrong number of input entries is a model error")
        void wrongEntryCount() {
            DecisionTable table = table(HitPolicy.FIRST, null,
                    List.of(InputClause.of("Age"), InputClause.of("Income")),
                    List.of(OutputClause.of("Result")),
                    rule("-", "1"));

            assertThrows(ModelException.class, () -> evaluator.evaluate(table, context("Age", Value.of(1))));
        }
    }

    // =====================================================================
    // Outputs
    // =====================================================================

    @Nested
    @DisplayName("Outputs")
    class Outputs {

        @Test
        @DisplayName("Multiple outputs produce an object keyed by label")
        void multipleOutputs() {
            DecisionTable table = table(HitPolicy.FIRST, null,
                    List.of(InputClause.of("Age")),
                    List.of(OutputClause.of("Category"), OutputClause.of("Rate")),
                    Rule.of("r1", List.of("-"), List.of("\"Standard\"", "0.05")));

            Value result = evaluator.evaluate(table, context("Age", Value.of(30)));

            assertEquals(Value.object(Map.of("Category", Value.of("Standard"), "Rate", Value.of(0.05))), result);
        }

        @Test
        @DisplayName("Output entries may be FEEL expressions")
        void outputExpression() {
            DecisionTable table = singleInput(HitPolicy.FIRST, null, rule("-", "Age * 2"));

            assertEquals(Value.of(84), evaluator.evaluate(table, context("Age", Value.of(42))));
        }

        @Test
        @DisplayName("Unparseable or unresolvable output text is kept literally")
        void literalOutput() {
            DecisionTable table = singleInput(HitPolicy.FIRST, null, rule("-", "Approved"));

            assertEquals(Value.of("Approved"), evaluator.evaluate(table, context("Age", Value.of(1))));
        }

        @Test
        @DisplayName("No match yields the default output")
        void defaultOutput() {
            DecisionTable table = table(HitPolicy.FIRST, null,
                    List.of(InputClause.of("Age")),
                    List.of(new OutputClause("Result", null, List.of(), "\"none\"")),
                    rule("> 100", "\"old\""));

            assertEquals(Value.of("none"), evaluator.evaluate(table, context("Age", Value.of(5))));
        }

        @Test
        @DisplayName("No match without a default yields an empty object")
        void emptyResult() {
            DecisionTable table = singleInput(HitPolicy.FIRST, null, rule("> 100", "\"old\""));

            assertEquals(ObjectValue.EMPTY, evaluator.evaluate(table, context("Age", Value.of(5))));
        }

        @Test
        @DisplayName("Tables without rules yield an empty object")
        void noRules() {
            assertEquals(ObjectValue.EMPTY,
                    evaluator.evaluate(singleInput(HitPolicy.COLLECT, CollectAggregation.SUM), context("Age", Value.of(5))));
        }
    }
}
