package com.dmn.table;

import com.dmn.feel.value.Value;

/**
 * Matched rule with its computed output.
 *
 * @param ruleIndex Zero-based position of the rule in the table
 * @param ruleId    Rule id, may be null
 * @param output    Bare value for single-output tables, otherwise an object keyed by output label
 */
public record RuleMatch(int ruleIndex, String ruleId, Value output) {
}
