package com.pitchcraft.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Pitchcraft-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String STEP = "step";

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put(SESSION_ID, sessionId);
    }

    public static void setStep(String step) {
        MDC.put(STEP, step);
    }

    public static void clearStep() {
        MDC.remove(STEP);
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(STEP);
    }
}
