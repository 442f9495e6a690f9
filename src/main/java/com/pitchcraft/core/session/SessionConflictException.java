package com.pitchcraft.core.session;

import com.pitchcraft.core.workflow.WorkflowException;

/**
 * Thrown when a session is already executing a transition. Retrying later is safe.
 */
public class SessionConflictException extends WorkflowException {

    private final String sessionId;

    public SessionConflictException(String sessionId) {
        super("Session " + sessionId + " is busy with another operation; retry later");
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
