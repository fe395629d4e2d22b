package com.dmn.feel.evaluator;

import com.dmn.bkm.BkmInvoker;
import com.dmn.exception.EvaluationException;
import com.dmn.feel.ast.AstNode;
import com.dmn.feel.ast.AstVisitor;
import com.dmn.feel.ast.BinaryOp;
import com.dmn.feel.ast.Conditional;
import com.dmn.feel.ast.FunctionCall;
import com.dmn.feel.ast.FunctionParameter;
import com.dmn.feel.ast.LiteralBoolean;
import com.dmn.feel.ast.LiteralList;
import com.dmn.feel.ast.LiteralNull;
import com.dmn.feel.ast.LiteralNumber;
import com.dmn.feel.ast.LiteralString;
import com.dmn.feel.ast.PropertyAccess;
import com.dmn.feel.ast.UnaryOp;
import com.dmn.feel.ast.Variable;
import com.dmn.feel.function.FeelFunction;
import com.dmn.feel.function.FunctionLibrary;
import com.dmn.feel.function.ParameterBinder;
import com.dmn.feel.value.BooleanValue;
import com.dmn.feel.value.ObjectValue;
import com.dmn.feel.value.NumberValue;
import com.dmn.feel.value.Value;
import com.dmn.feel.value.Values;
import com.dmn.feel.variable.DefaultVariableResolver;
import com.dmn.feel.variable.VariableResolver;
import com.dmn.model.BusinessKnowledgeModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tree-walking FEEL evaluator.
 * <p>
 * Operators follow DMN three-valued logic: a null operand makes the result null, except that
 * {@code false and x} is false and {@code true or x} is true whatever {@code x} is. Type
 * mismatches, division by zero and invalid calls produce null. Structural problems such as an
 * undefined variable raise {@link EvaluationException}.
 * <p>
 * The evaluator holds no per-call state and can be shared between threads.
 */
public class AstEvaluator implements AstVisitor<Value, EvaluationContext> {

    private static final Logger log = LoggerFactory.getLogger(AstEvaluator.class);

    public static final int DEFAULT_MAX_BKM_DEPTH = 256;

    private final FunctionLibrary library;
    private final ParameterBinder binder;
    private final VariableResolver resolver;
    private final BkmInvoker bkmInvoker;

    public AstEvaluator() {
        this(FunctionLibrary.standard(), new DefaultVariableResolver(), DEFAULT_MAX_BKM_DEPTH);
    }

    public AstEvaluator(int maxBkmDepth) {
        this(FunctionLibrary.standard(), new DefaultVariableResolver(), maxBkmDepth);
    }

    public AstEvaluator(FunctionLibrary library, VariableResolver resolver, int maxBkmDepth) {
        this.library = library;
        this.binder = new ParameterBinder(library.registry());
        this.resolver = resolver;
        this.bkmInvoker = new BkmInvoker(this, maxBkmDepth);
    }

    /**
     * Evaluate an expression tree.
     *
     * @param node    Root of the tree
     * @param context Variables and callable BKMs
     * @return Result value, never Java null
     * @throws EvaluationException on an undefined variable, property access on a non-object
     *                             or an unknown function
     */
    public Value evaluate(AstNode node, EvaluationContext context) {
        return node.accept(this, context);
    }

    public BkmInvoker bkmInvoker() {
        return bkmInvoker;
    }

    public VariableResolver resolver() {
        return resolver;
    }

    // ==================== Literals ====================

    @Override
    public Value visitNumber(LiteralNumber node, EvaluationContext context) {
        return Value.of(node.value());
    }

    @Override
    public Value visitString(LiteralString node, EvaluationContext context) {
        return Value.of(node.value());
    }

    @Override
    public Value visitBoolean(LiteralBoolean node, EvaluationContext context) {
        return Value.of(node.value());
    }

    @Override
    public Value visitNull(LiteralNull node, EvaluationContext context) {
        return Value.NULL;
    }

    @Override
    public Value visitList(LiteralList node, EvaluationContext context) {
        List<Value> items = new ArrayList<>(node.elements().size());
        for (AstNode element : node.elements()) {
            items.add(evaluate(element, context));
        }
        return Value.list(items);
    }

    // ==================== Names ====================

    @Override
    public Value visitVariable(Variable node, EvaluationContext context) {
        return resolver.resolveVariable(node.name(), context.variables())
                .orElseThrow(() -> new EvaluationException("Undefined variable: '" + node.name() + "'"));
    }

    @Override
    public Value visitPropertyAccess(PropertyAccess node, EvaluationContext context) {
        Value target = evaluate(node.object(), context);
        if (target.isNull()) {
            return Value.NULL;
        }
        if (!(target instanceof ObjectValue object)) {
            throw new EvaluationException("Cannot access property '" + node.property()
                    + "' on a " + Values.typeName(target));
        }
        return resolver.resolveProperty(node.property(), object)
                .orElseThrow(() -> new EvaluationException("Property '" + node.property() + "' not found"));
    }

    // ==================== Operators ====================

    @Override
    public Value visitBinary(BinaryOp node, EvaluationContext context) {
        return switch (node.operator()) {
            case AND -> and(node, context);
            case OR -> or(node, context);
            default -> BinaryOperations.apply(node.operator(),
                    evaluate(node.left(), context), evaluate(node.right(), context));
        };
    }

    private Value and(BinaryOp node, EvaluationContext context) {
        Value left = evaluate(node.left(), context);
        if (isFalse(left)) {
            return Value.FALSE;
        }
        Value right = evaluate(node.right(), context);
        if (isFalse(right)) {
            return Value.FALSE;
        }
        if (left instanceof BooleanValue && right instanceof BooleanValue) {
            return Value.TRUE;
        }
        return Value.NULL;
    }

    private Value or(BinaryOp node, EvaluationContext context) {
        Value left = evaluate(node.left(), context);
        if (isTrue(left)) {
            return Value.TRUE;
        }
        Value right = evaluate(node.right(), context);
        if (isTrue(right)) {
            return Value.TRUE;
        }
        if (left instanceof BooleanValue && right instanceof BooleanValue) {
            return Value.FALSE;
        }
        return Value.NULL;
    }

    // only a real boolean decides early; any other operand leads to null
    private static boolean isTrue(Value value) {
        return value instanceof BooleanValue b && b.value();
    }

    private static boolean isFalse(Value value) {
        return value instanceof BooleanValue b && !b.value();
    }

    @Override
    public Value visitUnary(UnaryOp node, EvaluationContext context) {
        Value operand = evaluate(node.operand(), context);
        return switch (node.operator()) {
            case NEGATE -> operand instanceof NumberValue n ? Value.of(-n.value()) : Value.NULL;
        };
    }

    @Override
    public Value visitConditional(Conditional node, EvaluationContext context) {
        Value condition = evaluate(node.condition(), context);
        if (condition.isNull()) {
            return evaluate(node.elseBranch(), context);
        }
        if (!(condition instanceof BooleanValue b)) {
            log.debug("Non-boolean condition {} in if expression, result is null", condition);
            return Value.NULL;
        }
        return b.value()
                ? evaluate(node.thenBranch(), context)
                : evaluate(node.elseBranch(), context);
    }

    // ==================== Calls ====================

    @Override
    public Value visitFunctionCall(FunctionCall node, EvaluationContext context) {
        String name = node.name();
        Optional<FeelFunction> builtin = library.lookup(name);
        if (builtin.isPresent()) {
            return callBuiltin(name, builtin.get(), node.parameters(), context);
        }

        Optional<BusinessKnowledgeModel> bkm = context.bkm(name);
        if (bkm.isPresent()) {
            return callBkm(bkm.get(), node.parameters(), context);
        }

        throw new EvaluationException("Unknown function: '" + name + "'");
    }

    private Value callBuiltin(String name, FeelFunction function, List<FunctionParameter> parameters,
                              EvaluationContext context) {
        List<Value> args;
        try {
            args = binder.bind(name, parameters, node -> evaluate(node, context));
        } catch (EvaluationException e) {
            log.debug("Invalid call to '{}': {}", name, e.getMessage());
            return Value.NULL;
        }

        try {
            return function.apply(args);
        } catch (ArithmeticException | IllegalArgumentException e) {
            log.debug("Function '{}' rejected its arguments: {}", name, e.getMessage());
            return Value.NULL;
        }
    }

    private Value callBkm(BusinessKnowledgeModel bkm, List<FunctionParameter> parameters,
                          EvaluationContext context) {
        List<Value> args;
        try {
            if (parameters.stream().anyMatch(FunctionParameter::isNamed)) {
                args = binder.bind(bkmInvoker.signatureOf(bkm), parameters, node -> evaluate(node, context));
            } else {
                args = new ArrayList<>(parameters.size());
                for (FunctionParameter parameter : parameters) {
                    args.add(evaluate(parameter.value(), context));
                }
            }
        } catch (EvaluationException e) {
            log.debug("Invalid call to BKM '{}': {}", bkm.name(), e.getMessage());
            return Value.NULL;
        }
        return bkmInvoker.invoke(bkm, args, context);
    }
}
