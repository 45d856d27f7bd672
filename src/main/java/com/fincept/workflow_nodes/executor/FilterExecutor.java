package com.fincept.workflow_nodes.executor;

import com.fincept.workflow_nodes.executor.param.NodeParameterReader;
import com.fincept.workflow_nodes.executor.param.ParameterAccessor;
import com.fincept.workflow_nodes.model.node.CombineOperation;
import com.fincept.workflow_nodes.model.node.Condition;
import com.fincept.workflow_nodes.model.node.FilterOperation;
import com.fincept.workflow_nodes.model.node.TransformNodeType;
import com.fincept.workflow_nodes.model.record.DataRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Executes FILTER nodes.
 *
 * Config shape:
 * {
 *   "operation":        "keep" | "remove",     (default keep)
 *   "combineOperation": "and"  | "or",         (default and)
 *   "conditions": [
 *     { "field": "price.close", "operator": "greaterThan", "value": "100" }
 *   ]
 * }
 *
 * Conditions are read per record, so templated values can differ between records.
 * An empty condition list matches every record under AND and none under OR.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FilterExecutor implements TransformNodeExecutor {

    public static final String PARAM_OPERATION  = "operation";
    public static final String PARAM_COMBINE    = "combineOperation";
    public static final String PARAM_CONDITIONS = "conditions";

    private final ConditionEvaluator  evaluator;
    private final NodeParameterReader parameters;

    @Override
    public TransformNodeType supportedType() {
        return TransformNodeType.FILTER;
    }

    @Override
    public int outputCount() {
        return 1;
    }

    @Override
    public List<List<DataRecord>> execute(List<List<DataRecord>> inputs, ParameterAccessor params) {
        List<DataRecord> items = TransformNodeExecutor.input(inputs, 0);

        FilterOperation  operation = parameters.option(params, PARAM_OPERATION, FilterOperation.class, FilterOperation.KEEP);
        CombineOperation combine   = parameters.option(params, PARAM_COMBINE, CombineOperation.class, CombineOperation.AND);

        List<DataRecord> kept = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            DataRecord item = items.get(i);
            List<Condition> conditions = parameters.conditions(params, PARAM_CONDITIONS, i);

            boolean matches    = matches(item, conditions, combine);
            boolean shouldKeep = operation == FilterOperation.KEEP ? matches : !matches;
            if (shouldKeep) kept.add(item);
        }

        log.debug("Filter {} ({}): {} in, {} out", operation.configName(), combine.configName(), items.size(), kept.size());
        return List.of(kept);
    }

    private boolean matches(DataRecord item, List<Condition> conditions, CombineOperation combine) {
        return switch (combine) {
            case AND -> conditions.stream().allMatch(c -> evaluator.evaluate(item, c));
            case OR  -> conditions.stream().anyMatch(c -> evaluator.evaluate(item, c));
        };
    }
}
