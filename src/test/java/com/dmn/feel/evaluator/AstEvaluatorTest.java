package com.dmn.feel.evaluator;

import com.dmn.exception.EvaluationException;
import com.dmn.feel.ast.AstNode;
import com.dmn.feel.expression.FeelExpressions;
import com.dmn.feel.value.ObjectValue;
import com.dmn.feel.value.Value;
import com.dmn.model.BusinessKnowledgeModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AstEvaluator.
 */
class AstEvaluatorTest {

    private final AstEvaluator evaluator = new AstEvaluator();

    private Value eval(String expression) {
        return eval(expression, ObjectValue.EMPTY);
    }

    private Value eval(String expression, ObjectValue variables) {
        return evaluator.evaluate(FeelExpressions.parse(expression), EvaluationContext.of(variables));
    }

    private static Value literal(String text) {
        return switch (text) {
            case "true" -> Value.TRUE;
            case "false" -> Value.FALSE;
            default -> Value.NULL;
        };
    }

    // =====================================================================
    // Arithmetic
    // =====================================================================

    @Nested
    @DisplayName("Arithmetic")
    class Arithmetic {

        @ParameterizedTest
        @CsvSource(value = {
                "1 + 2 * 3|7",
                "(1 + 2) * 3|9",
                "10 - 4 - 3|3",
                "10 / 4|2.5",
                "2 ** 3 ** 2|512",
                "2 ** -1|0.5",
                "-(2 + 3)|-5",
                "5 - -3|8"
        }, delimiter = '|')
        @DisplayName("Should compute numeric results")
        void shouldCompute(String expression, double expected) {
            assertEquals(Value.of(expected), eval(expression));
        }

        @ParameterizedTest
        @CsvSource(value = {
                "1 / 0",
                "0 / 0",
                "null + 1",
                "1 * null",
                "1 - \"a\"",
                "-\"a\"",
                "-null",
                "10 ** 400",
                "[1] * 2"
        }, delimiter = '|')
        @DisplayName("Should yield null for invalid operands")
        void shouldYieldNull(String expression) {
            assertEquals(Value.NULL, eval(expression));
        }

        @Test
        @DisplayName("Addition concatenates when either side is a string")
        void shouldConcatenate() {
            assertEquals(Value.of("a1"), eval("\"a\" + 1"));
            assertEquals(Value.of("n: 2.5"), eval("\"n: \" + 2.50"));
            assertEquals(Value.of("3x"), eval("3 + \"x\""));
            assertEquals(Value.of("anull"), eval("\"a\" + null"));
        }
    }

    // =====================================================================
    // Comparison
    // =====================================================================

    @Nested
    @DisplayName("Comparison")
    class Comparison {

        @ParameterizedTest
        @CsvSource(value = {
                "1 = 1.0|true",
                "1 == 1|true",
                "1 = \"1\"|false",
                "null = null|true",
                "1 != null|true",
                "[1, 2] = [1, 2]|true",
                "3 < 5|true",
                "5 <= 5|true",
                "4 >= 5|false",
                "\"apple\" < \"banana\"|true",
                "0 = -0|true"
        }, delimiter = '|')
        @DisplayName("Should compare values")
        void shouldCompare(String expression, boolean expected) {
            assertEquals(Value.of(expected), eval(expression));
        }

        @ParameterizedTest
        @CsvSource(value = {
                "1 < null",
                "null >= 1",
                "1 < \"a\"",
                "[1] > [0]"
        }, delimiter = '|')
        @DisplayName("Ordering with null or incomparable operands yields null")
        void orderingYieldsNull(String expression) {
            assertEquals(Value.NULL, eval(expression));
        }
    }

    // =====================================================================
    // Three-valued logic
    // =====================================================================

    @Nested
    @DisplayName("Three-valued logic")
    class Logic {

        @ParameterizedTest(name = "{0} and/or {1}")
        @CsvSource({
                "true, true, true, true",
                "true, false, false, true",
                "true, null, null, true",
                "false, true, false, true",
                "false, false, false, false",
                "false, null, false, null",
                "null, true, null, true",
                "null, false, false, null",
                "null, null, null, null"
        })
        @DisplayName("Should follow the three-valued truth tables")
        void truthTables(String left, String right, String and, String or) {
            assertEquals(literal(and), eval(left + " and " + right));
            assertEquals(literal(or), eval(left + " or " + right));
        }

        @Test
        @DisplayName("Short-circuit should skip the right operand")
        void shouldShortCircuit() {
            assertEquals(Value.FALSE, eval("false and undefinedName"));
            assertEquals(Value.TRUE, eval("true or undefinedName"));
        }

        @ParameterizedTest
        @CsvSource(value = {
                "0 and null",
                "null and 0",
                "\"\" and null",
                "1 and true",
                "1 or null",
                "null or 1",
                "\"x\" or null",
                "0 or false"
        }, delimiter = '|')
        @DisplayName("A non-boolean operand never decides the result")
        void nonBooleanOperandYieldsNull(String expression) {
            assertEquals(Value.NULL, eval(expression));
        }

        @Test
        @DisplayName("A real boolean still decides early next to a non-boolean")
        void booleanDecidesNextToNonBoolean() {
            assertEquals(Value.FALSE, eval("false and 1"));
            assertEquals(Value.FALSE, eval("\"a\" and false"));
            assertEquals(Value.TRUE, eval("true or 0"));
            assertEquals(Value.FALSE, eval("[1] and false"));
            assertEquals(Value.TRUE, eval("[] or true"));
        }
    }

    // =====================================================================
    // Conditionals
    // =====================================================================

    @Nested
    @DisplayName("Conditionals")
    class Conditionals {

        @Test
        @DisplayName("Should pick the branch matching the condition")
        void shouldPickBranch() {
            ObjectValue ctx = new ObjectValue(Map.of("x", Value.of(15)));
            assertEquals(Value.of("big"), eval("if x > 10 then \"big\" else \"small\"", ctx));
            assertEquals(Value.of(2), eval("if false then 1 else 2"));
        }

        @Test
        @DisplayName("A null condition takes the else branch")
        void nullConditionTakesElse() {
            assertEquals(Value.of(2), eval("if null then 1 else 2"));
            assertEquals(Value.of(2), eval("if 1 > null then 1 else 2"));
        }

        @Test
        @DisplayName("A non-boolean condition yields null")
        void nonBooleanConditionYieldsNull() {
            assertEquals(Value.NULL, eval("if 5 then 1 else 2"));
        }
    }

    // =====================================================================
    // Names
    // =====================================================================

    @Nested
    @DisplayName("Variables and properties")
    class Names {

        private final ObjectValue ctx = new ObjectValue(Map.of(
                "credit_score", Value.of(720),
                "Applicant", Value.object(Map.of("credit_score", Value.of(700), "age", Value.of(30))),
                "nothing", Value.NULL));

        @Test
        @DisplayName("Should resolve names with spaces through spelling variants")
        void shouldResolveSpacedName() {
            assertEquals(Value.of(720), eval("Credit Score", ctx));
            assertEquals(Value.TRUE, eval("Credit Score >= 700", ctx));
        }

        @Test
        @DisplayName("Should resolve camelCase properties against snake_case keys")
        void shouldResolveProperty() {
            assertEquals(Value.of(700), eval("Applicant.creditScore", ctx));
        }

        @Test
        @DisplayName("Property access on null yields null")
        void propertyOnNull() {
            assertEquals(Value.NULL, eval("nothing.age", ctx));
        }

        @Test
        @DisplayName("Should raise for undefined variables")
        void shouldRaiseUndefined() {
            EvaluationException e = assertThrows(EvaluationException.class, () -> eval("missing + 1", ctx));
            assertEquals("Undefined variable: 'missing'", e.getMessage());
        }

        @Test
        @DisplayName("Should raise for property access on a non-context")
        void shouldRaiseOnNonContext() {
            EvaluationException e = assertThrows(EvaluationException.class, () -> eval("Applicant.age.years", ctx));
            assertEquals("Cannot access property 'years' on a number", e.getMessage());
        }

        @Test
        @DisplayName("Should raise for missing properties")
        void shouldRaiseMissingProperty() {
            EvaluationException e = assertThrows(EvaluationException.class, () -> eval("Applicant.name", ctx));
            assertEquals("Property 'name' not found", e.getMessage());
        }
    }

    // =====================================================================
    // Calls
    // =====================================================================

    @Nested
    @DisplayName("Calls")
    class Calls {

        private final EvaluationContext withBkms = EvaluationContext.of(ObjectValue.EMPTY).withBkms(Map.of(
                "double it", BusinessKnowledgeModel.of("double it", List.of("x"), "x * 2"),
                "abs", BusinessKnowledgeModel.of("abs", List.of("n"), "\"shadowed\"")));

        private Value call(String expression) {
            return evaluator.evaluate(FeelExpressions.parse(expression), withBkms);
        }

        @Test
        @DisplayName("Should raise for unknown functions")
        void shouldRaiseUnknownFunction() {
            EvaluationException e = assertThrows(EvaluationException.class, () -> eval("frobnicate(1)"));
            assertEquals("Unknown function: 'frobnicate'", e.getMessage());
        }

        @Test
        @DisplayName("An argument that fails to evaluate makes the call null")
        void failingArgumentYieldsNull() {
            assertEquals(Value.NULL, eval("abs(missing)"));
        }

        @Test
        @DisplayName("Should call BKMs positionally and by name")
        void shouldCallBkm() {
            assertEquals(Value.of(42), call("double it(21)"));
            assertEquals(Value.of(8), call("double it(x: 4)"));
        }

        @Test
        @DisplayName("A BKM parameter without an argument reads the caller's variable")
        void missingBkmArgumentReadsCaller() {
            EvaluationContext withX = withBkms.withVariables(new ObjectValue(Map.of("x", Value.of(5))));

            assertEquals(Value.of(10), evaluator.evaluate(FeelExpressions.parse("double it()"), withX));
            EvaluationException e = assertThrows(EvaluationException.class, () -> call("double it()"));
            assertEquals("Undefined variable: 'x'", e.getMessage());
        }

        @Test
        @DisplayName("Unknown named BKM argument yields null")
        void unknownNamedBkmArgument() {
            assertEquals(Value.NULL, call("double it(y: 4)"));
        }

        @Test
        @DisplayName("Built-in functions take precedence over BKMs of the same name")
        void builtinsShadowBkms() {
            assertEquals(Value.of(3), call("abs(-3)"));
        }
    }

    // =====================================================================
    // Purity
    // =====================================================================

    @Test
    @DisplayName("Evaluating the same tree twice gives equal results")
    void evaluationIsRepeatable() {
        AstNode node = FeelExpressions.parse("substring(\"hello\", 2) + string(count([1, 2]))");
        Value first = evaluator.evaluate(node, EvaluationContext.empty());
        Value second = evaluator.evaluate(node, EvaluationContext.empty());

        assertEquals(Value.of("ello2"), first);
        assertEquals(first, second);
    }

    @Test
    @DisplayName("List literals evaluate their elements")
    void listLiteral() {
        assertEquals(Value.list(List.of(Value.of(1), Value.of("a"), Value.NULL)), eval("[1, \"a\", null]"));
    }
}
