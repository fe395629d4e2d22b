package com.dmn.model;

import com.dmn.exception.ModelException;

import java.util.Locale;

/**
 * Decision table hit policies.
 */
public enum HitPolicy {
    FIRST,
    UNIQUE,
    PRIORITY,
    ANY,
    RULE_ORDER,
    OUTPUT_ORDER,
    COLLECT;

    /**
     * True for policies that stop at the first matching rule.
     */
    public boolean isSingleHit() {
        return this == FIRST || this == UNIQUE || this == ANY;
    }

    /**
     * Parse the DMN long or short form ({@code RULE ORDER}, {@code R}, {@code C+} ...).
     * The aggregation carried by a {@code C?} short form is read with {@link #parseAggregation(String)}.
     *
     * @throws ModelException on an unknown policy
     */
    public static HitPolicy parse(String text) {
        if (text == null || text.isBlank()) {
            return FIRST;
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        return switch (normalized) {
            case "FIRST", "F" -> FIRST;
            case "UNIQUE", "U" -> UNIQUE;
            case "PRIORITY", "P" -> PRIORITY;
            case "ANY", "A" -> ANY;
            case "RULE_ORDER", "R" -> RULE_ORDER;
            case "OUTPUT_ORDER", "O" -> OUTPUT_ORDER;
            case "COLLECT", "C", "C+", "C#", "C<", "C>" -> COLLECT;
            default -> throw new ModelException("Unknown hit policy: " + text);
        };
    }

    /**
     * Aggregation implied by a hit policy short form, or named explicitly.
     *
     * @return NONE when the text names no aggregation
     * @throws ModelException on an unknown aggregation name
     */
    public static CollectAggregation parseAggregation(String text) {
        if (text == null || text.isBlank()) {
            return CollectAggregation.NONE;
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "C+", "SUM" -> CollectAggregation.SUM;
            case "C#", "COUNT" -> CollectAggregation.COUNT;
            case "C<", "MIN" -> CollectAggregation.MIN;
            case "C>", "MAX" -> CollectAggregation.MAX;
            case "C", "COLLECT", "NONE" -> CollectAggregation.NONE;
            default -> throw new ModelException("Unknown collect aggregation: " + text);
        };
    }
}
