package com.pitchcraft.core.nodes;

import com.pitchcraft.core.llm.BackendUnavailableException;
import com.pitchcraft.core.llm.LlmProperties;
import com.pitchcraft.core.llm.LlmService;
import com.pitchcraft.core.model.PitchState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GeneratorAgentStepTest {

    private final LlmService mockLlm = mock(LlmService.class);
    private final GeneratorAgentStep step = new GeneratorAgentStep(mockLlm, new LlmProperties());

    @Test
    @DisplayName("writes the draft from description and context")
    void writesDraft() {
        when(mockLlm.call(anyString(), anyString(), anyDouble())).thenReturn("The pitch.\n");

        PitchState result = step.execute(PitchState.initial("Dinner app").withContext("Crowded market"));

        assertEquals("The pitch.", result.pitch());
        ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
        verify(mockLlm).call(anyString(), user.capture(), eq(0.8));
        assertTrue(user.getValue().contains("Dinner app"));
        assertTrue(user.getValue().contains("Crowded market"));
    }

    @Test
    @DisplayName("backend outage yields a placeholder draft built from the description")
    void backendOutage() {
        when(mockLlm.call(anyString(), anyString(), anyDouble()))
                .thenThrow(new BackendUnavailableException("down", null));

        PitchState result = step.execute(PitchState.initial("Dinner app"));

        assertEquals(GeneratorAgentStep.degradedDraft("Dinner app"), result.pitch());
        assertTrue(result.pitch().endsWith("Dinner app"));
    }
}
