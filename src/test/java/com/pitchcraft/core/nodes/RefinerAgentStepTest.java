package com.pitchcraft.core.nodes;

import com.pitchcraft.core.llm.BackendUnavailableException;
import com.pitchcraft.core.llm.LlmProperties;
import com.pitchcraft.core.llm.LlmService;
import com.pitchcraft.core.model.Decision;
import com.pitchcraft.core.model.PitchState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static com.pitchcraft.core.model.PitchFixtures.critiqued;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RefinerAgentStepTest {

    private final LlmService mockLlm = mock(LlmService.class);
    private final RefinerAgentStep step = new RefinerAgentStep(mockLlm, new LlmProperties());

    @Test
    @DisplayName("replaces the draft with the refined version")
    void replacesDraft() {
        when(mockLlm.call(anyString(), anyString(), anyDouble())).thenReturn("Sharper pitch");

        PitchState result = step.execute(critiqued(5.0, Decision.FAIL));

        assertEquals("Sharper pitch", result.pitch());
    }

    @Test
    @DisplayName("prompt includes critique weaknesses and reviewer feedback")
    void promptIncludesFeedback() {
        when(mockLlm.call(anyString(), anyString(), anyDouble())).thenReturn("Sharper pitch");

        step.execute(critiqued(5.0, Decision.FAIL).withHumanFeedback("Mention the waitlist"));

        ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
        verify(mockLlm).call(anyString(), user.capture(), eq(0.7));
        assertTrue(user.getValue().contains("No traction"));
        assertTrue(user.getValue().contains("Tighten the opening"));
        assertTrue(user.getValue().contains("Reviewer Feedback (highest priority):\nMention the waitlist"));
    }

    @Test
    @DisplayName("prompt omits the reviewer section without feedback")
    void promptWithoutFeedback() {
        when(mockLlm.call(anyString(), anyString(), anyDouble())).thenReturn("Sharper pitch");

        step.execute(critiqued(5.0, Decision.FAIL));

        ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
        verify(mockLlm).call(anyString(), user.capture(), anyDouble());
        assertFalse(user.getValue().contains("Reviewer Feedback"));
    }

    @Test
    @DisplayName("backend outage keeps the previous draft")
    void backendOutage() {
        when(mockLlm.call(anyString(), anyString(), anyDouble()))
                .thenThrow(new BackendUnavailableException("down", null));
        PitchState input = critiqued(5.0, Decision.FAIL);

        assertSame(input, step.execute(input));
    }
}
