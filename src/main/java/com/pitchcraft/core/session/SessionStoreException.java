package com.pitchcraft.core.session;

/**
 * Thrown when the backing store of sessions cannot be read or written.
 */
public class SessionStoreException extends RuntimeException {

    public SessionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
