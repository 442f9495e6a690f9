package com.pitchcraft.core.nodes;

import com.pitchcraft.core.llm.BackendUnavailableException;
import com.pitchcraft.core.llm.LlmProperties;
import com.pitchcraft.core.llm.LlmService;
import com.pitchcraft.core.model.Critique;
import com.pitchcraft.core.model.PitchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rewrites the draft to address the latest critique and, when present, the
 * reviewer's feedback. The previous draft is replaced, never appended to.
 */
@Component
public class RefinerAgentStep implements AgentStep {

    private static final Logger log = LoggerFactory.getLogger(RefinerAgentStep.class);

    private static final String SYSTEM_PROMPT = """
            You are a pitch refinement expert.

            Take the pitch and its critique and write an improved version that:
            - addresses every weakness mentioned
            - keeps the strengths
            - incorporates the feedback precisely
            - stays concise and impactful

            Make substantial improvements, do not just tweak words.
            Reply with the improved pitch text only.
            """;

    private final LlmService llmService;
    private final LlmProperties llmProperties;

    public RefinerAgentStep(LlmService llmService, LlmProperties llmProperties) {
        this.llmService = llmService;
        this.llmProperties = llmProperties;
    }

    @Override
    public String name() {
        return "refiner";
    }

    @Override
    public PitchState execute(PitchState state) {
        String pitch = state.requirePitch();
        Critique critique = state.requireCritique();

        var userPrompt = new StringBuilder()
                .append("Original Pitch:\n").append(pitch).append("\n\n")
                .append("Critique Feedback:\n")
                .append(critique.feedback().isBlank() ? "No specific feedback" : critique.feedback()).append("\n\n")
                .append("Weaknesses to address:\n").append(String.join(", ", critique.weaknesses())).append("\n\n");
        if (state.hasHumanFeedback()) {
            userPrompt.append("Reviewer Feedback (highest priority):\n").append(state.humanFeedback()).append("\n\n");
        }
        userPrompt.append("Create an improved version.");

        try {
            String refined = llmService.call(SYSTEM_PROMPT, userPrompt.toString(),
                    llmProperties.getTemperatures().getRefiner());
            return state.withPitch(refined.trim());
        } catch (BackendUnavailableException e) {
            log.warn("Refinement degraded, keeping the previous draft: {}", e.getMessage());
            return state;
        }
    }
}
