package com.pitchcraft.core.workflow;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowPropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new WorkflowProperties();
        assertEquals(3, props.getAutoRefineMax());
        assertEquals(10, props.getTotalIterationMax());
        assertEquals(7.5, props.getPassThreshold());
        assertEquals(Duration.ofHours(2), props.getSessionIdleTimeout());
        assertEquals(Duration.ofMinutes(5), props.getReaperInterval());
        assertEquals("elevator", props.getPitchTemplate());
    }

    @Test
    void settersOverrideDefaults() {
        var props = new WorkflowProperties();
        props.setAutoRefineMax(1);
        props.setTotalIterationMax(4);
        props.setPassThreshold(8.0);
        assertEquals(1, props.getAutoRefineMax());
        assertEquals(4, props.getTotalIterationMax());
        assertEquals(8.0, props.getPassThreshold());
    }
}
