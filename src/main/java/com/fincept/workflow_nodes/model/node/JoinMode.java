package com.fincept.workflow_nodes.model.node;

/** Which unmatched records survive a merge by key. */
public enum JoinMode implements ConfigOption {
    INNER("inner"),
    LEFT("left"),
    OUTER("outer");

    private final String configName;

    JoinMode(String configName) {
        this.configName = configName;
    }

    @Override
    public String configName() {
        return configName;
    }
}
