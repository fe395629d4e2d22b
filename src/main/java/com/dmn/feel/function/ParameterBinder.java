package com.dmn.feel.function;

import com.dmn.exception.EvaluationException;
import com.dmn.feel.ast.AstNode;
import com.dmn.feel.ast.FunctionParameter;
import com.dmn.feel.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves the actual parameters of a call against a function signature.
 * <p>
 * The result holds one slot per formal parameter, in declaration order, followed by any
 * variadic extras. Omitted optional parameters bind to null. Calls of functions the registry
 * does not know are evaluated positionally as written.
 */
public final class ParameterBinder {

    private static final Logger log = LoggerFactory.getLogger(ParameterBinder.class);

    private final FunctionRegistry registry;

    public ParameterBinder(FunctionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Bind a call by function name.
     *
     * @param functionName Function being called
     * @param actuals      Actual parameters in source order
     * @param evaluator    Evaluates a parameter expression in the caller's context
     * @return Argument vector
     * @throws EvaluationException if the call does not fit the signature
     */
    public List<Value> bind(String functionName, List<FunctionParameter> actuals,
                            Function<AstNode, Value> evaluator) {
        Optional<FunctionSignature> signature = registry.lookup(functionName);
        if (signature.isEmpty()) {
            log.debug("No signature registered for '{}', binding positionally", functionName);
            return evaluateInOrder(actuals, evaluator);
        }
        return bind(signature.get(), actuals, evaluator);
    }

    /**
     * Bind a call against an explicit signature.
     */
    public List<Value> bind(FunctionSignature signature, List<FunctionParameter> actuals,
                            Function<AstNode, Value> evaluator) {
        boolean anyNamed = actuals.stream().anyMatch(FunctionParameter::isNamed);
        boolean anyPositional = actuals.stream().anyMatch(p -> !p.isNamed());
        if (anyNamed && anyPositional) {
            throw new EvaluationException("Cannot mix named and positional parameters in call to '"
                    + signature.name() + "'");
        }
        return anyNamed
                ? bindNamed(signature, actuals, evaluator)
                : bindPositional(signature, actuals, evaluator);
    }

    private List<Value> bindPositional(FunctionSignature signature, List<FunctionParameter> actuals,
                                       Function<AstNode, Value> evaluator) {
        List<FormalParameter> formals = signature.parameters();
        if (actuals.size() > formals.size() && !signature.variadic()) {
            throw new EvaluationException("Function '" + signature.name() + "' expects at most "
                    + formals.size() + " arguments, got " + actuals.size());
        }

        List<Value> args = new ArrayList<>(Math.max(formals.size(), actuals.size()));
        for (int i = 0; i < formals.size(); i++) {
            FormalParameter formal = formals.get(i);
            if (i < actuals.size()) {
                args.add(evaluator.apply(actuals.get(i).value()));
            } else if (formal.optional()) {
                args.add(Value.NULL);
            } else {
                throw new EvaluationException("Missing required parameter '" + formal.name()
                        + "' in call to '" + signature.name() + "'");
            }
        }

        // variadic extras
        for (int i = formals.size(); i < actuals.size(); i++) {
            args.add(evaluator.apply(actuals.get(i).value()));
        }
        return args;
    }

    private List<Value> bindNamed(FunctionSignature signature, List<FunctionParameter> actuals,
                                  Function<AstNode, Value> evaluator) {
        List<FormalParameter> formals = signature.parameters();
        Value[] slots = new Value[formals.size()];
        List<Value> extras = new ArrayList<>();

        for (FunctionParameter actual : actuals) {
            Optional<Integer> index = signature.indexOf(actual.name());
            if (index.isPresent()) {
                if (slots[index.get()] != null) {
                    throw new EvaluationException("Parameter '" + actual.name()
                            + "' supplied more than once in call to '" + signature.name() + "'");
                }
                slots[index.get()] = evaluator.apply(actual.value());
            } else if (signature.variadic()) {
                extras.add(evaluator.apply(actual.value()));
            } else {
                throw new EvaluationException("Unknown parameter '" + actual.name()
                        + "' in call to '" + signature.name() + "'");
            }
        }

        for (int i = 0; i < formals.size(); i++) {
            if (slots[i] == null) {
                FormalParameter formal = formals.get(i);
                if (!formal.optional()) {
                    throw new EvaluationException("Missing required parameter '" + formal.name()
                            + "' in call to '" + signature.name() + "'");
                }
                slots[i] = Value.NULL;
            }
        }

        List<Value> args = new ArrayList<>(Arrays.asList(slots));
        args.addAll(extras);
        return args;
    }

    private static List<Value> evaluateInOrder(List<FunctionParameter> actuals, Function<AstNode, Value> evaluator) {
        List<Value> args = new ArrayList<>(actuals.size());
        for (FunctionParameter actual : actuals) {
            args.add(evaluator.apply(actual.value()));
        }
        return args;
    }
}
