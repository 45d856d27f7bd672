package com.fincept.workflow_nodes.model.node;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison applied by a condition. Names match the camelCase values stored in
 * node configs ("greaterThan", "notContains", ...).
 */
public enum ConditionOperator {
    EQUAL("equal"),
    NOT_EQUAL("notEqual"),
    GREATER_THAN("greaterThan"),
    GREATER_THAN_OR_EQUAL("greaterThanOrEqual"),
    LESS_THAN("lessThan"),
    LESS_THAN_OR_EQUAL("lessThanOrEqual"),
    CONTAINS("contains"),
    NOT_CONTAINS("notContains"),
    STARTS_WITH("startsWith"),
    ENDS_WITH("endsWith"),
    IS_EMPTY("isEmpty"),
    IS_NOT_EMPTY("isNotEmpty"),
    UNSUPPORTED("unsupported");   // anything we do not recognise — always evaluates to false

    private final String configName;

    ConditionOperator(String configName) {
        this.configName = configName;
    }

    @JsonValue
    public String configName() {
        return configName;
    }

    @JsonCreator
    public static ConditionOperator fromName(String name) {
        if (name == null) return UNSUPPORTED;
        for (ConditionOperator op : values()) {
            if (op != UNSUPPORTED && op.configName.equals(name)) return op;
        }
        return UNSUPPORTED;
    }
}
