package com.pitchcraft.core.workflow;

/**
 * Thrown when an operation is not valid for the session's current phase.
 * The session is left untouched.
 */
public class InvalidTransitionException extends WorkflowException {

    public InvalidTransitionException(String message) {
        super(message);
    }
}
