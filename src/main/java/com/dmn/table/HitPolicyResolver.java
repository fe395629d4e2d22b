package com.dmn.table;

import com.dmn.feel.value.NumberValue;
import com.dmn.feel.value.ObjectValue;
import com.dmn.feel.value.StringValue;
import com.dmn.feel.value.Value;
import com.dmn.feel.value.Values;
import com.dmn.model.CollectAggregation;
import com.dmn.model.DecisionTable;
import com.dmn.model.OutputClause;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reduces the matched rules of a decision table to its result according to the hit policy.
 */
public final class HitPolicyResolver {

    private HitPolicyResolver() {
    }

    /**
     * @param table   Table the matches come from
     * @param matches Fully matched rules in declaration order, never empty
     * @return Table result
     */
    public static Value resolve(DecisionTable table, List<RuleMatch> matches) {
        List<Value> outputs = matches.stream().map(RuleMatch::output).toList();
        return switch (table.hitPolicy()) {
            case FIRST, UNIQUE, ANY -> outputs.get(0);
            case RULE_ORDER -> Value.list(outputs);
            case OUTPUT_ORDER -> Value.list(sortByOutput(outputs));
            case PRIORITY -> highestPriority(table, outputs);
            case COLLECT -> aggregate(table.aggregation(), outputs);
        };
    }

    // ==================== PRIORITY ====================

    /**
     * Earlier values of an output's priority list win. Columns are compared left to right and
     * the first decisive column settles it; on a full tie the earlier rule wins.
     */
    static Value highestPriority(DecisionTable table, List<Value> outputs) {
        Value best = outputs.get(0);
        for (int i = 1; i < outputs.size(); i++) {
            Value current = outputs.get(i);
            if (comparePriority(table, current, best) < 0) {
                best = current;
            }
        }
        return best;
    }

    private static int comparePriority(DecisionTable table, Value a, Value b) {
        List<OutputClause> clauses = table.outputs();
        for (OutputClause clause : clauses) {
            if (clause.outputValues().isEmpty()) {
                continue;
            }
            Value columnA = column(table, clause, a);
            Value columnB = column(table, clause, b);
            int rankA = rank(clause, columnA);
            int rankB = rank(clause, columnB);
            if (rankA != rankB) {
                return Integer.compare(rankA, rankB);
            }
        }
        return 0;
    }

    private static Value column(DecisionTable table, OutputClause clause, Value output) {
        if (table.isSingleOutput()) {
            return output;
        }
        return output instanceof ObjectValue object
                ? object.get(clause.label()).orElse(Value.NULL)
                : Value.NULL;
    }

    private static int rank(OutputClause clause, Value value) {
        if (value.isNull()) {
            return Integer.MAX_VALUE;
        }
        String text = value.asText();
        List<String> priorities = clause.outputValues();
        for (int i = 0; i < priorities.size(); i++) {
            if (UnaryTestMatcher.unquote(priorities.get(i)).equals(text)) {
                return i;
            }
        }
        return Integer.MAX_VALUE;
    }

    // ==================== OUTPUT_ORDER ====================

    private static List<Value> sortByOutput(List<Value> outputs) {
        List<Value> sorted = new ArrayList<>(outputs);
        sorted.sort(OUTPUT_ORDER);
        return sorted;
    }

    /**
     * Strings and numbers order naturally; objects by their first key present in both.
     * Anything else keeps declaration order.
     */
    static final Comparator<Value> OUTPUT_ORDER = HitPolicyResolver::compareOutputs;

    private static int compareOutputs(Value a, Value b) {
        if (a instanceof StringValue x && b instanceof StringValue y) {
            return x.value().compareTo(y.value());
        }
        if (a instanceof NumberValue x && b instanceof NumberValue y) {
            return Double.compare(x.value(), y.value());
        }
        if (a instanceof ObjectValue x && b instanceof ObjectValue y) {
            for (Map.Entry<String, Value> entry : x.entries().entrySet()) {
                Optional<Value> other = y.get(entry.getKey());
                if (other.isPresent()) {
                    Value left = entry.getValue();
                    Value right = other.get();
                    if ((left instanceof StringValue && right instanceof StringValue)
                            || (left instanceof NumberValue && right instanceof NumberValue)) {
                        return compareOutputs(left, right);
                    }
                }
            }
        }
        return 0;
    }

    // ==================== COLLECT ====================

    static Value aggregate(CollectAggregation aggregation, List<Value> outputs) {
        return switch (aggregation) {
            case NONE -> Value.list(outputs);
            case COUNT -> Value.of(outputs.size());
            case SUM -> Value.of(numeric(outputs).stream().mapToDouble(Double::doubleValue).sum());
            case MIN -> numeric(outputs).stream().min(Double::compare).map(Value::of).orElse(Value.NULL);
            case MAX -> numeric(outputs).stream().max(Double::compare).map(Value::of).orElse(Value.NULL);
        };
    }

    /**
     * Numbers and numeric strings; everything else is skipped.
     */
    private static List<Double> numeric(List<Value> outputs) {
        List<Double> numbers = new ArrayList<>();
        for (Value output : outputs) {
            if (output instanceof NumberValue || output instanceof StringValue) {
                Values.toNumber(output).ifPresent(numbers::add);
            }
        }
        return numbers;
    }
}
