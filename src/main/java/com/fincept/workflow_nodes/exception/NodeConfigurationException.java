package com.fincept.workflow_nodes.exception;

import lombok.Getter;

/**
 * Raised when a node's parameters cannot be used (unsupported mode, missing join key,
 * bad output index). Aborts the whole invocation — never thrown for per-record
 * condition problems, which simply evaluate to false.
 */
@Getter
public class NodeConfigurationException extends RuntimeException {

    private final String parameter;

    public NodeConfigurationException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public NodeConfigurationException(String parameter, String message, Throwable cause) {
        super(message, cause);
        this.parameter = parameter;
    }
}
