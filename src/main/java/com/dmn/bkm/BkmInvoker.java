package com.dmn.bkm;

import com.dmn.exception.BkmInvocationException;
import com.dmn.feel.ast.AstNode;
import com.dmn.feel.evaluator.AstEvaluator;
import com.dmn.feel.evaluator.EvaluationContext;
import com.dmn.feel.expression.FeelExpressions;
import com.dmn.feel.function.FormalParameter;
import com.dmn.feel.function.FunctionSignature;
import com.dmn.feel.value.ObjectValue;
import com.dmn.feel.value.Value;
import com.dmn.model.BusinessKnowledgeModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Invokes business knowledge models.
 * <p>
 * Arguments are bound by position onto a copy of the caller's variables. Too many or too few
 * arguments are tolerated with a warning; a parameter without an argument stays unbound, so a caller variable of the same name remains visible. The body runs with
 * every BKM of the caller's context callable, so BKMs can call each other and themselves.
 * Nesting deeper than the configured limit fails with {@link BkmInvocationException}.
 */
public class BkmInvoker {

    private static final Logger log = LoggerFactory.getLogger(BkmInvoker.class);

    private final AstEvaluator evaluator;
    private final int maxDepth;

    public BkmInvoker(AstEvaluator evaluator, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.evaluator = evaluator;
        this.maxDepth = maxDepth;
    }

    /**
     * Invoke a BKM.
     *
     * @param bkm     BKM to call
     * @param args    Positional arguments
     * @param context Caller's context; its variables stay visible unless shadowed by a parameter
     * @return Body result
     * @throws BkmInvocationException if the BKM has no name or body, or the depth limit is exceeded
     */
    public Value invoke(BusinessKnowledgeModel bkm, List<Value> args, EvaluationContext context) {
        validate(bkm);
        if (context.depth() >= maxDepth) {
            throw new BkmInvocationException("BKM call depth limit of " + maxDepth
                    + " exceeded while invoking '" + bkm.name() + "'");
        }

        List<String> parameters = bkm.parameters();
        if (args.size() != parameters.size()) {
            log.warn("BKM '{}' expects {} arguments but was called with {}",
                    bkm.name(), parameters.size(), args.size());
        }

        ObjectValue bound = context.variables();
        for (int i = 0; i < Math.min(parameters.size(), args.size()); i++) {
            bound = bound.with(parameters.get(i), args.get(i));
        }

        AstNode body = bkm.parsed().orElseGet(() -> FeelExpressions.parse(bkm.expression()));
        log.debug("Invoking BKM '{}' at depth {}", bkm.name(), context.depth() + 1);
        return evaluator.evaluate(body, context.nested(bound));
    }

    /**
     * Invoke a BKM with only the given BKMs callable from its body.
     */
    public Value invoke(BusinessKnowledgeModel bkm, List<Value> args, ObjectValue variables,
                        Map<String, BusinessKnowledgeModel> availableBkms) {
        return invoke(bkm, args, EvaluationContext.of(variables).withBkms(availableBkms));
    }

    /**
     * Signature used for named-argument calls: every parameter is optional, none variadic.
     */
    public FunctionSignature signatureOf(BusinessKnowledgeModel bkm) {
        validate(bkm);
        try {
            return new FunctionSignature(bkm.name(),
                    bkm.parameters().stream().map(FormalParameter::optional).toList(), false);
        } catch (IllegalArgumentException e) {
            throw new BkmInvocationException("Invalid parameters of BKM '" + bkm.name() + "'", e);
        }
    }

    public int maxDepth() {
        return maxDepth;
    }

    private static void validate(BusinessKnowledgeModel bkm) {
        if (bkm == null || bkm.name() == null || bkm.name().isBlank()) {
            throw new BkmInvocationException("BKM name must not be empty");
        }
        if (bkm.ast() == null && (bkm.expression() == null || bkm.expression().isBlank())) {
            throw new BkmInvocationException("BKM '" + bkm.name() + "' has no expression");
        }
    }
}
