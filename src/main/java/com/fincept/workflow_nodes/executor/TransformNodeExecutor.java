package com.fincept.workflow_nodes.executor;

import com.fincept.workflow_nodes.executor.param.ParameterAccessor;
import com.fincept.workflow_nodes.model.node.TransformNodeType;
import com.fincept.workflow_nodes.model.record.DataRecord;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface TransformNodeExecutor {

    TransformNodeType supportedType();

    // Fixed number of output ports; execute always returns exactly this many lists
    int outputCount();

    /**
     * Runs the node over fully materialised input lists. Pure and synchronous:
     * inputs are never mutated and nothing is kept between calls.
     *
     * @throws com.fincept.workflow_nodes.exception.NodeConfigurationException when the parameters cannot be used
     */
    List<List<DataRecord>> execute(List<List<DataRecord>> inputs, ParameterAccessor params);

    /**
     * Same work as {@link #execute}, completed before returning. Lets the host compose
     * node invocations as futures without this library doing any threading itself.
     */
    default CompletableFuture<List<List<DataRecord>>> executeAsync(List<List<DataRecord>> inputs, ParameterAccessor params) {
        try {
            return CompletableFuture.completedFuture(execute(inputs, params));
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    /** Input port {@code port}, or an empty list when the host did not connect it. */
    static List<DataRecord> input(List<List<DataRecord>> inputs, int port) {
        if (inputs == null || port >= inputs.size() || inputs.get(port) == null) return List.of();
        return inputs.get(port);
    }
}
