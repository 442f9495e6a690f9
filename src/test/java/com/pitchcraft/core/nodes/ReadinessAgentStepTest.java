package com.pitchcraft.core.nodes;

import com.pitchcraft.core.llm.BackendUnavailableException;
import com.pitchcraft.core.llm.LlmProperties;
import com.pitchcraft.core.llm.LlmService;
import com.pitchcraft.core.model.Decision;
import com.pitchcraft.core.model.FinalPackage;
import com.pitchcraft.core.model.Phase;
import com.pitchcraft.core.model.PitchState;
import com.pitchcraft.core.parsing.FinalPackageParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.pitchcraft.core.model.PitchFixtures.PITCH;
import static com.pitchcraft.core.model.PitchFixtures.critiqued;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ReadinessAgentStepTest {

    private final LlmService mockLlm = mock(LlmService.class);
    private final ReadinessAgentStep step =
            new ReadinessAgentStep(mockLlm, new LlmProperties(), new FinalPackageParser());

    @Test
    @DisplayName("builds the package from the reply")
    void buildsPackage() {
        when(mockLlm.call(anyString(), anyString(), anyDouble()))
                .thenReturn("{\"elevator_pitch\": \"Dinner from next door.\"}");

        PitchState result = step.execute(critiqued(8.0, Decision.PASS).withPhase(Phase.READY_FOR_FINAL));

        FinalPackage pkg = result.finalPackage();
        assertEquals("Dinner from next door.", pkg.elevatorPitch());
        assertEquals(FinalPackage.NOT_PROVIDED, pkg.teamHighlights());
        assertFalse(pkg.capped());
        verify(mockLlm).call(anyString(), anyString(), eq(0.5));
    }

    @Test
    @DisplayName("a capped session yields a capped package")
    void cappedPackage() {
        when(mockLlm.call(anyString(), anyString(), anyDouble())).thenReturn("{}");

        PitchState result = step.execute(critiqued(5.0, Decision.FAIL).withPhase(Phase.CAPPED));

        assertTrue(result.finalPackage().capped());
    }

    @Test
    @DisplayName("backend outage builds the package from the pitch")
    void backendOutage() {
        when(mockLlm.call(anyString(), anyString(), anyDouble()))
                .thenThrow(new BackendUnavailableException("down", null));

        PitchState result = step.execute(critiqued(8.0, Decision.PASS).withPhase(Phase.READY_FOR_FINAL));

        assertEquals(PITCH, result.finalPackage().executiveSummary());
    }
}
