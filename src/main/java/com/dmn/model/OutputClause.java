package com.dmn.model;

import java.util.List;
import java.util.Optional;

/**
 * Decision table output column.
 *
 * @param label         Output name; keys the result object of multi-output tables
 * @param typeRef       Declared type, informational
 * @param outputValues  Priority list as written, highest priority first
 * @param defaultOutput Result when no rule matches, or null
 */
public record OutputClause(String label, String typeRef, List<String> outputValues, String defaultOutput) {

    public OutputClause {
        outputValues = outputValues == null ? List.of() : List.copyOf(outputValues);
    }

    public static OutputClause of(String label) {
        return new OutputClause(label, null, List.of(), null);
    }

    public static OutputClause of(String label, List<String> outputValues) {
        return new OutputClause(label, null, outputValues, null);
    }

    public Optional<String> defaultOutputText() {
        return Optional.ofNullable(defaultOutput);
    }
}
