package com.dmn.model;

import java.util.List;

/**
 * Decision table row.
 */
public record Rule(String id, String description, List<RuleEntry> inputEntries, List<RuleEntry> outputEntries) {

    public Rule {
        inputEntries = List.copyOf(inputEntries);
        outputEntries = List.copyOf(outputEntries);
    }

    /**
     * Rule from cell texts, pre-parsing each cell.
     */
    public static Rule of(String id, List<String> inputs, List<String> outputs) {
        return new Rule(id, null,
                inputs.stream().map(RuleEntry::input).toList(),
                outputs.stream().map(RuleEntry::output).toList());
    }
}
