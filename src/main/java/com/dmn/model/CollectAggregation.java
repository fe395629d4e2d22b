package com.dmn.model;

/**
 * Aggregation applied by the COLLECT hit policy.
 */
public enum CollectAggregation {
    NONE,
    SUM,
    COUNT,
    MIN,
    MAX
}
