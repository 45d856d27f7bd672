package com.fincept.workflow_nodes.model.node;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One (field, operator, value) triple.
 *
 * Config shape: { "field": "price.close", "operator": "greaterThan", "value": "100" }
 * value is optional — isEmpty / isNotEmpty ignore it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Condition(String field, ConditionOperator operator, String value) {

    public Condition {
        if (operator == null) operator = ConditionOperator.UNSUPPORTED;
    }

    public static Condition of(String field, ConditionOperator operator, String value) {
        return new Condition(field, operator, value);
    }
}
