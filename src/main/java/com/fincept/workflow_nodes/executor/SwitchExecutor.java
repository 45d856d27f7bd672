package com.fincept.workflow_nodes.executor;

import com.fincept.workflow_nodes.exception.NodeConfigurationException;
import com.fincept.workflow_nodes.executor.param.NodeParameterReader;
import com.fincept.workflow_nodes.executor.param.ParameterAccessor;
import com.fincept.workflow_nodes.model.node.OutputSlot;
import com.fincept.workflow_nodes.model.node.SwitchMode;
import com.fincept.workflow_nodes.model.node.SwitchRule;
import com.fincept.workflow_nodes.model.node.TransformNodeType;
import com.fincept.workflow_nodes.model.record.DataRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Executes SWITCH nodes: four outputs (Output 1..3 and Fallback), each record goes to at most one.
 *
 * Two modes — set by config.mode:
 *
 *   "rules" (default) — first matching rule wins, in declared order
 *   Config: { "rules": [ { "field": "sector", "operator": "equal", "value": "tech", "output": 0 } ],
 *             "fallbackOutput": 3 }
 *
 *   "expression" — the host evaluates config.output per record to an index
 *   Config: { "mode": "expression", "output": "{{$json.bucket}}", "fallbackOutput": -1 }
 *
 * A target of -1, or any index outside 0..3, discards the record.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SwitchExecutor implements TransformNodeExecutor {

    public static final String PARAM_MODE     = "mode";
    public static final String PARAM_RULES    = "rules";
    public static final String PARAM_OUTPUT   = "output";
    public static final String PARAM_FALLBACK = "fallbackOutput";

    private static final int DISCARD_INDEX = -1;

    private final ConditionEvaluator  evaluator;
    private final NodeParameterReader parameters;

    @Override
    public TransformNodeType supportedType() {
        return TransformNodeType.SWITCH;
    }

    @Override
    public int outputCount() {
        return OutputSlot.PORT_COUNT;
    }

    @Override
    public List<List<DataRecord>> execute(List<List<DataRecord>> inputs, ParameterAccessor params) {
        List<DataRecord> items = TransformNodeExecutor.input(inputs, 0);

        SwitchMode mode     = parameters.option(params, PARAM_MODE, SwitchMode.class, SwitchMode.RULES);
        int        fallback = parameters.integer(params, PARAM_FALLBACK, 0, DISCARD_INDEX);

        List<List<DataRecord>> outputs = new ArrayList<>(OutputSlot.PORT_COUNT);
        for (int i = 0; i < OutputSlot.PORT_COUNT; i++) outputs.add(new ArrayList<>());

        int discarded = 0;
        for (int i = 0; i < items.size(); i++) {
            DataRecord item = items.get(i);
            int target = switch (mode) {
                case RULES      -> routeByRules(item, params, i, fallback);
                case EXPRESSION -> routeByExpression(params, i, fallback);
            };

            OutputSlot slot = OutputSlot.forIndex(target);
            if (slot.isDiscard()) {
                if (target != DISCARD_INDEX) {
                    log.debug("Switch target {} for record {} is outside 0..3 — discarding", target, i);
                }
                discarded++;
                continue;
            }
            outputs.get(slot.port()).add(item);
        }

        if (log.isDebugEnabled()) {
            log.debug("Switch {}: {} in, outputs {}/{}/{} fallback {} discarded {}", mode.configName(), items.size(),
                    outputs.get(0).size(), outputs.get(1).size(), outputs.get(2).size(), outputs.get(3).size(), discarded);
        }
        return List.copyOf(outputs);
    }

    // Rules are re-read for every record index
    private int routeByRules(DataRecord item, ParameterAccessor params, int itemIndex, int fallback) {
        List<SwitchRule> rules = parameters.rules(params, PARAM_RULES, itemIndex);
        for (SwitchRule rule : rules) {
            if (evaluator.evaluate(item, rule.condition())) {
                return rule.output();
            }
        }
        return fallback;
    }

    private int routeByExpression(ParameterAccessor params, int itemIndex, int fallback) {
        Object raw = params.get(PARAM_OUTPUT, itemIndex);
        if (raw == null || raw.toString().isBlank()) return fallback;

        Integer target = NodeParameterReader.toInteger(raw);
        if (target == null) {
            throw new NodeConfigurationException(PARAM_OUTPUT,
                    "Router expression for record " + itemIndex + " returned '" + raw + "', expected an output index");
        }
        return target;
    }
}
