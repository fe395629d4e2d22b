package com.dmn.bkm;

import com.dmn.exception.BkmInvocationException;
import com.dmn.exception.EvaluationException;
import com.dmn.exception.FeelSyntaxException;
import com.dmn.feel.evaluator.AstEvaluator;
import com.dmn.feel.evaluator.EvaluationContext;
import com.dmn.feel.expression.FeelExpressions;
import com.dmn.feel.function.FunctionSignature;
import com.dmn.feel.value.ObjectValue;
import com.dmn.feel.value.Value;
import com.dmn.model.BusinessKnowledgeModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BkmInvoker.
 */
class BkmInvokerTest {

    private static final BusinessKnowledgeModel FACTORIAL = BusinessKnowledgeModel.of("factorial",
            List.of("n"), "if n <= 1 then 1 else n * factorial(n - 1)");

    private static final BusinessKnowledgeModel LOOP = BusinessKnowledgeModel.of("loop",
            List.of("n"), "loop(n + 1)");

    private static final BusinessKnowledgeModel ADD = BusinessKnowledgeModel.of("add",
            List.of("a", "b"), "a + b");

    private final AstEvaluator evaluator = new AstEvaluator(50);
    private final BkmInvoker invoker = evaluator.bkmInvoker();

    private static Map<String, BusinessKnowledgeModel> all() {
        return Map.of("factorial", FACTORIAL, "loop", LOOP, "add", ADD);
    }

    // =====================================================================
    // Binding
    // =====================================================================

    @Nested
    @DisplayName("Argument binding")
    class Binding {

        @Test
        @DisplayName("Should bind arguments by position")
        void shouldBindPositionally() {
            Value result = invoker.invoke(ADD, List.of(Value.of(2), Value.of(3)), ObjectValue.EMPTY, all());
            assertEquals(Value.of(5), result);
        }

        @Test
        @DisplayName("A parameter without an argument stays unbound")
        void missingArgumentStaysUnbound() {
            EvaluationException e = assertThrows(EvaluationException.class,
                    () -> invoker.invoke(ADD, List.of(Value.of(2)), ObjectValue.EMPTY, all()));
            assertEquals("Undefined variable: 'b'", e.getMessage());
        }

        @Test
        @DisplayName("A parameter without an argument falls back to the caller's variable")
        void missingArgumentSeesCallerVariable() {
            BusinessKnowledgeModel identity = BusinessKnowledgeModel.of("identity", List.of("x"), "x");
            ObjectValue caller = new ObjectValue(Map.of("x", Value.of(5)));

            assertEquals(Value.of(5), invoker.invoke(identity, List.of(), caller, Map.of()));
            assertEquals(Value.of(7), invoker.invoke(identity, List.of(Value.of(7)), caller, Map.of()));
            assertEquals(Value.of(7), invoker.invoke(ADD, List.of(Value.of(4)),
                    new ObjectValue(Map.of("b", Value.of(3))), all()));
        }

        @Test
        @DisplayName("Extra arguments are ignored")
        void extraArgumentsIgnored() {
            Value result = invoker.invoke(ADD, List.of(Value.of(1), Value.of(2), Value.of(99)),
                    ObjectValue.EMPTY, all());
            assertEquals(Value.of(3), result);
        }

        @Test
        @DisplayName("Parameters shadow caller variables, others stay visible")
        void parametersShadowCaller() {
            BusinessKnowledgeModel scaled = BusinessKnowledgeModel.of("scaled", List.of("a"), "a * factor");
            ObjectValue caller = new ObjectValue(Map.of("a", Value.of(100), "factor", Value.of(3)));

            assertEquals(Value.of(6), invoker.invoke(scaled, List.of(Value.of(2)), caller, Map.of()));
        }
    }

    // =====================================================================
    // Recursion
    // =====================================================================

    @Nested
    @DisplayName("Recursion")
    class Recursion {

        @Test
        @DisplayName("A BKM may call itself")
        void shouldRecurse() {
            assertEquals(Value.of(120), invoker.invoke(FACTORIAL, List.of(Value.of(5)), ObjectValue.EMPTY, all()));
        }

        @Test
        @DisplayName("BKMs are callable from FEEL through the context")
        void shouldCallFromFeel() {
            EvaluationContext ctx = EvaluationContext.of(ObjectValue.EMPTY).withBkms(all());
            assertEquals(Value.of(24), evaluator.evaluate(FeelExpressions.parse("factorial(4)"), ctx));
            assertEquals(Value.of(7), evaluator.evaluate(FeelExpressions.parse("add(b: 4, a: 3)"), ctx));
        }

        @Test
        @DisplayName("Unbounded recursion hits the depth limit")
        void shouldStopAtDepthLimit() {
            BkmInvocationException e = assertThrows(BkmInvocationException.class,
                    () -> invoker.invoke(LOOP, List.of(Value.of(0)), ObjectValue.EMPTY, all()));
            assertEquals("BKM call depth limit of 50 exceeded while invoking 'loop'", e.getMessage());
        }

        @Test
        @DisplayName("Recursion within the limit succeeds")
        void withinLimit() {
            assertEquals(Value.of(1), invoker.invoke(FACTORIAL, List.of(Value.of(1)), ObjectValue.EMPTY, all()));
            assertEquals(50, invoker.maxDepth());
        }
    }

    // =====================================================================
    // Validation
    // =====================================================================

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("An empty name is rejected")
        void emptyName() {
            BusinessKnowledgeModel nameless = BusinessKnowledgeModel.of(" ", List.of(), "1");
            BkmInvocationException e = assertThrows(BkmInvocationException.class,
                    () -> invoker.invoke(nameless, List.of(), ObjectValue.EMPTY, Map.of()));
            assertEquals("BKM name must not be empty", e.getMessage());
        }

        @Test
        @DisplayName("A missing body is rejected")
        void missingBody() {
            BusinessKnowledgeModel empty = new BusinessKnowledgeModel("empty", List.of(), "", null);
            BkmInvocationException e = assertThrows(BkmInvocationException.class,
                    () -> invoker.invoke(empty, List.of(), ObjectValue.EMPTY, Map.of()));
            assertEquals("BKM 'empty' has no expression", e.getMessage());
        }

        @Test
        @DisplayName("A body that does not parse fails when invoked")
        void unparseableBody() {
            BusinessKnowledgeModel broken = BusinessKnowledgeModel.of("broken", List.of(), "1 +");
            assertThrows(FeelSyntaxException.class,
                    () -> invoker.invoke(broken, List.of(), ObjectValue.EMPTY, Map.of()));
        }

        @Test
        @DisplayName("The named-call signature makes every parameter optional")
        void signatureOf() {
            FunctionSignature signature = invoker.signatureOf(ADD);
            assertEquals("add", signature.name());
            assertEquals(2, signature.arity());
            assertTrue(signature.parameters().stream().allMatch(p -> p.optional()));
            assertFalse(signature.variadic());
        }

        @Test
        @DisplayName("Duplicate parameter names are a BKM error")
        void duplicateParameters() {
            BusinessKnowledgeModel twice = BusinessKnowledgeModel.of("twice", List.of("x", "x"), "x");
            assertThrows(BkmInvocationException.class, () -> invoker.signatureOf(twice));
        }

        @Test
        @DisplayName("The depth limit must be positive")
        void depthMustBePositive() {
            assertThrows(IllegalArgumentException.class, () -> new BkmInvoker(evaluator, 0));
        }
    }
}
