package com.pitchcraft.core.workflow;

/**
 * Base type for failures raised by the workflow engine.
 */
public class WorkflowException extends RuntimeException {

    public WorkflowException(String message) {
        super(message);
    }

    public WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
