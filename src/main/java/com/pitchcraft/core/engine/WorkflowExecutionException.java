package com.pitchcraft.core.engine;

import com.pitchcraft.core.workflow.WorkflowException;

/**
 * Thrown when a workflow run fails unexpectedly. The session is left as it was
 * before the run.
 */
public class WorkflowExecutionException extends WorkflowException {

    public WorkflowExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
