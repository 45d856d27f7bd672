package com.fincept.workflow_nodes.model.node;

/** How a filter folds its condition results: all must match, or at least one. */
public enum CombineOperation implements ConfigOption {
    AND("and"),
    OR("or");

    private final String configName;

    CombineOperation(String configName) {
        this.configName = configName;
    }

    @Override
    public String configName() {
        return configName;
    }
}
