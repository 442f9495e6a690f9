package com.pitchcraft.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setSession puts sessionId in MDC")
    void setSession() {
        MdcContext.setSession("5d1c");
        assertEquals("5d1c", MDC.get("sessionId"));
    }

    @Test
    @DisplayName("clearStep removes only the step")
    void clearStep() {
        MdcContext.setSession("5d1c");
        MdcContext.setStep("critic");
        assertEquals("critic", MDC.get("step"));

        MdcContext.clearStep();

        assertNull(MDC.get("step"));
        assertEquals("5d1c", MDC.get("sessionId"));
    }

    @Test
    @DisplayName("clear removes all pitchcraft MDC keys")
    void clear() {
        MdcContext.setSession("5d1c");
        MdcContext.setStep("refiner");
        MdcContext.clear();
        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("step"));
    }
}
