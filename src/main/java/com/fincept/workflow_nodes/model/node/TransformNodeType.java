package com.fincept.workflow_nodes.model.node;

public enum TransformNodeType {
    FILTER,   // 1 input, 1 output — keep/remove by conditions
    SWITCH,   // 1 input, 4 outputs — route each record to one output or discard
    MERGE     // 2 inputs, 1 output — append, by position, by key, or pick a branch
}
