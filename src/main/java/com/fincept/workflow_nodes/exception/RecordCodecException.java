package com.fincept.workflow_nodes.exception;

public class RecordCodecException extends RuntimeException {

    public RecordCodecException(String message) {
        super(message);
    }

    public RecordCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
