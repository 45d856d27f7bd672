package com.fincept.workflow_nodes.model.node;

public enum BranchOutput implements ConfigOption {
    INPUT_1("input1"),
    INPUT_2("input2");

    private final String configName;

    BranchOutput(String configName) {
        this.configName = configName;
    }

    @Override
    public String configName() {
        return configName;
    }
}
