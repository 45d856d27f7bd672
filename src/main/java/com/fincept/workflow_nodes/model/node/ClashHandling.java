package com.fincept.workflow_nodes.model.node;

/** Field-name collision policy for merge by position. */
public enum ClashHandling implements ConfigOption {
    PREFER_FIRST("preferFirst"),
    PREFER_SECOND("preferSecond"),
    ADD_SUFFIX("addSuffix");

    private final String configName;

    ClashHandling(String configName) {
        this.configName = configName;
    }

    @Override
    public String configName() {
        return configName;
    }
}
