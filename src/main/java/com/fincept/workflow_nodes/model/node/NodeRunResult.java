package com.fincept.workflow_nodes.model.node;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fincept.workflow_nodes.model.record.DataRecord;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of one node invocation as handed back to the orchestrator.
 * On FAILURE outputs is empty — there are no partial results.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeRunResult {
    private TransformNodeType nodeType;
    private NodeRunStatus status;

    // One list per output port, in port order
    @JsonIgnore
    @Builder.Default
    private List<List<DataRecord>> outputs = List.of();

    private List<Integer> inputCounts;
    private List<Integer> outputCounts;

    private long executionTimeMs;

    private String errorMessage;
    private String errorParameter;

    public boolean isSuccess() {
        return status == NodeRunStatus.SUCCESS;
    }

    public List<DataRecord> output(int port) {
        return port < outputs.size() ? outputs.get(port) : List.of();
    }
}
