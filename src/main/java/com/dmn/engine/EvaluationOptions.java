package com.dmn.engine;

import com.dmn.feel.evaluator.AstEvaluator;
import com.dmn.model.CollectAggregation;
import com.dmn.model.HitPolicy;

import java.util.Optional;

/**
 * Engine-level evaluation settings.
 *
 * @param strictMode          Rethrow literal decision errors instead of recording null
 * @param hitPolicyOverride   Hit policy applied to every table, or null to use each table's own
 * @param aggregationOverride Aggregation used with the override, or null for none
 * @param maxBkmDepth         Maximum nesting of BKM calls
 */
public record EvaluationOptions(boolean strictMode,
                                HitPolicy hitPolicyOverride,
                                CollectAggregation aggregationOverride,
                                int maxBkmDepth) {

    public EvaluationOptions {
        if (maxBkmDepth < 1) {
            throw new IllegalArgumentException("maxBkmDepth must be positive: " + maxBkmDepth);
        }
    }

    public static EvaluationOptions defaults() {
        return new EvaluationOptions(false, null, null, AstEvaluator.DEFAULT_MAX_BKM_DEPTH);
    }

    public EvaluationOptions withStrictMode(boolean strict) {
        return new EvaluationOptions(strict, hitPolicyOverride, aggregationOverride, maxBkmDepth);
    }

    public EvaluationOptions withHitPolicyOverride(HitPolicy policy, CollectAggregation aggregation) {
        return new EvaluationOptions(strictMode, policy, aggregation, maxBkmDepth);
    }

    public EvaluationOptions withMaxBkmDepth(int depth) {
        return new EvaluationOptions(strictMode, hitPolicyOverride, aggregationOverride, depth);
    }

    public Optional<HitPolicy> hitPolicy() {
        return Optional.ofNullable(hitPolicyOverride);
    }

    public CollectAggregation aggregation() {
        return aggregationOverride == null ? CollectAggregation.NONE : aggregationOverride;
    }
}
