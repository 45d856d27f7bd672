package com.fincept.workflow_nodes.model.node;

public enum NodeRunStatus {
    SUCCESS,
    FAILURE
}
