package com.fincept.workflow_nodes.model.node;

public enum FilterOperation implements ConfigOption {
    KEEP("keep"),
    REMOVE("remove");

    private final String configName;

    FilterOperation(String configName) {
        this.configName = configName;
    }

    @Override
    public String configName() {
        return configName;
    }
}
