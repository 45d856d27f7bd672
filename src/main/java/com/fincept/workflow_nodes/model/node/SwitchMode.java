package com.fincept.workflow_nodes.model.node;

public enum SwitchMode implements ConfigOption {
    RULES("rules"),
    EXPRESSION("expression");

    private final String configName;

    SwitchMode(String configName) {
        this.configName = configName;
    }

    @Override
    public String configName() {
        return configName;
    }
}
