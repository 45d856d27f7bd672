package com.fincept.workflow_nodes.model.node;

public enum MergeMode implements ConfigOption {
    APPEND("append"),
    MERGE_BY_POSITION("mergeByPosition"),
    MERGE_BY_KEY("mergeByKey"),
    CHOOSE_BRANCH("chooseBranch");

    private final String configName;

    MergeMode(String configName) {
        this.configName = configName;
    }

    @Override
    public String configName() {
        return configName;
    }
}
