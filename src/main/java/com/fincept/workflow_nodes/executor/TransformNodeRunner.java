package com.fincept.workflow_nodes.executor;

import com.fincept.workflow_nodes.exception.NodeConfigurationException;
import com.fincept.workflow_nodes.executor.param.ConfigParameterAccessor;
import com.fincept.workflow_nodes.executor.param.ParameterAccessor;
import com.fincept.workflow_nodes.model.node.NodeRunResult;
import com.fincept.workflow_nodes.model.node.NodeRunStatus;
import com.fincept.workflow_nodes.model.node.TransformNodeType;
import com.fincept.workflow_nodes.model.record.DataRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Entry point the orchestrator calls for one node step. Looks up the executor, runs it,
 * and turns whatever it throws into a FAILURE result so a bad config never leaks
 * half-built outputs into the workflow.
 */
@Slf4j
@Service
public class TransformNodeRunner {

    private final TransformNodeRegistry registry;
    private final FieldResolver         fieldResolver;
    private final long                  slowNodeWarnMs;

    public TransformNodeRunner(TransformNodeRegistry registry,
                               FieldResolver fieldResolver,
                               @Value("${workflow.nodes.slow-node-warn-ms:500}") long slowNodeWarnMs) {
        this.registry = registry;
        this.fieldResolver = fieldResolver;
        this.slowNodeWarnMs = slowNodeWarnMs;
    }

    /** Runs a node whose parameters are a stored config map; {{$json.*}} references resolve against input 1. */
    public NodeRunResult run(TransformNodeType type, List<List<DataRecord>> inputs, Map<String, Object> config) {
        ParameterAccessor params = new ConfigParameterAccessor(config, TransformNodeExecutor.input(inputs, 0), fieldResolver);
        return run(type, inputs, params);
    }

    public NodeRunResult run(TransformNodeType type, List<List<DataRecord>> inputs, ParameterAccessor params) {
        List<Integer> inputCounts = inputs == null ? List.of() : inputs.stream().map(l -> l == null ? 0 : l.size()).toList();
        long started = System.nanoTime();

        try {
            TransformNodeExecutor executor = registry.get(type);
            List<List<DataRecord>> outputs = executor.execute(inputs, params);
            long elapsedMs = elapsedMs(started);

            if (elapsedMs > slowNodeWarnMs) {
                log.warn("{} node took {} ms for inputs {} (threshold {} ms)", type, elapsedMs, inputCounts, slowNodeWarnMs);
            }
            return NodeRunResult.builder()
                    .nodeType(type)
                    .status(NodeRunStatus.SUCCESS)
                    .outputs(outputs)
                    .inputCounts(inputCounts)
                    .outputCounts(outputs.stream().map(List::size).toList())
                    .executionTimeMs(elapsedMs)
                    .build();
        } catch (NodeConfigurationException ex) {
            log.error("{} node configuration error on '{}': {}", type, ex.getParameter(), ex.getMessage());
            return failure(type, inputCounts, started, ex.getMessage(), ex.getParameter());
        } catch (Exception ex) {
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("{} node threw: {}", type, msg, ex);
            return failure(type, inputCounts, started, msg, null);
        }
    }

    private NodeRunResult failure(TransformNodeType type, List<Integer> inputCounts, long started,
                                  String message, String parameter) {
        return NodeRunResult.builder()
                .nodeType(type)
                .status(NodeRunStatus.FAILURE)
                .inputCounts(inputCounts)
                .executionTimeMs(elapsedMs(started))
                .errorMessage(message)
                .errorParameter(parameter)
                .build();
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
