package com.pitchcraft.core.tools;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PitchTemplateTest {

    @Test
    void resolvesNamesCaseInsensitively() {
        assertEquals(PitchTemplate.INVESTOR, PitchTemplate.fromName("Investor"));
        assertEquals(PitchTemplate.DEMO_DAY, PitchTemplate.fromName("demo-day"));
        assertEquals(PitchTemplate.DEMO_DAY, PitchTemplate.fromName("demo_day"));
    }

    @Test
    void unknownNamesFallBackToElevator() {
        assertEquals(PitchTemplate.ELEVATOR, PitchTemplate.fromName("keynote"));
        assertEquals(PitchTemplate.ELEVATOR, PitchTemplate.fromName(null));
    }

    @Test
    void everyTemplateHasAStructure() {
        for (PitchTemplate template : PitchTemplate.values()) {
            assertFalse(template.structure().isBlank());
        }
    }
}
