package com.fincept.workflow_nodes.executor;

import com.fincept.workflow_nodes.model.node.TransformNodeType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class TransformNodeRegistry {

    private final List<TransformNodeExecutor> executors;
    private final Map<TransformNodeType, TransformNodeExecutor> registry = new EnumMap<>(TransformNodeType.class);

    @PostConstruct
    public void init() {
        executors.forEach(executor -> registry.put(executor.supportedType(), executor));
    }

    public TransformNodeExecutor get(TransformNodeType type) {
        TransformNodeExecutor executor = registry.get(type);
        if (executor == null) {
            throw new UnsupportedOperationException("No executor registered for node type: " + type);
        }
        return executor;
    }

    public boolean isSupported(TransformNodeType type) {
        return registry.containsKey(type);
    }
}
