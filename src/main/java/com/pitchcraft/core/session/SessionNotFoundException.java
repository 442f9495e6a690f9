package com.pitchcraft.core.session;

import com.pitchcraft.core.workflow.InvalidTransitionException;

/**
 * Thrown when an operation names a session id the store does not know.
 */
public class SessionNotFoundException extends InvalidTransitionException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
