package com.fincept.workflow_nodes.model.node;

import com.fincept.workflow_nodes.exception.NodeConfigurationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/** Node-scoped option whose value is stored in the node config under a camelCase name. */
public interface ConfigOption {

    String configName();

    static <E extends Enum<E> & ConfigOption> E parse(Class<E> type, Object raw, String parameter) {
        if (raw == null || raw.toString().isBlank()) {
            throw new NodeConfigurationException(parameter, "Parameter '" + parameter + "' is required");
        }
        String name = raw.toString().trim();
        for (E option : type.getEnumConstants()) {
            if (option.configName().equals(name)) return option;
        }
        String allowed = Arrays.stream(type.getEnumConstants())
                .map(ConfigOption::configName)
                .collect(Collectors.joining(", "));
        throw new NodeConfigurationException(parameter,
                "Unsupported value '" + name + "' for parameter '" + parameter + "'. Use one of: " + allowed);
    }
}
