package com.pitchcraft.core.llm;

/**
 * Thrown when the text-generation backend could not produce a response in time.
 * Agent steps turn this into degraded content.
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
