package com.fincept.workflow_nodes.model.node;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A switch routing rule: a condition plus the output it sends matching records to.
 *
 * Config shape: { "field": "sector", "operator": "equal", "value": "tech", "output": 0 }
 * output is kept as a raw Integer so a missing value can be reported as a config error.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SwitchRule(String field, ConditionOperator operator, String value, Integer output) {

    public Condition condition() {
        return new Condition(field, operator, value);
    }
}
