package com.pitchcraft.core.nodes;

import com.pitchcraft.core.llm.BackendUnavailableException;
import com.pitchcraft.core.llm.LlmProperties;
import com.pitchcraft.core.llm.LlmService;
import com.pitchcraft.core.model.PitchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes the first pitch draft from the description and research context.
 */
@Component
public class GeneratorAgentStep implements AgentStep {

    private static final Logger log = LoggerFactory.getLogger(GeneratorAgentStep.class);

    private static final String SYSTEM_PROMPT = """
            You are an expert pitch writer. Create a compelling, concise pitch that:
            - clearly articulates the problem and the solution
            - highlights the unique value proposition
            - includes specific, measurable outcomes
            - is engaging and memorable
            - follows a proven pitch structure

            Keep it to 150-250 words. Be specific, avoid jargon, focus on impact.
            Reply with the pitch text only.
            """;

    private final LlmService llmService;
    private final LlmProperties llmProperties;

    public GeneratorAgentStep(LlmService llmService, LlmProperties llmProperties) {
        this.llmService = llmService;
        this.llmProperties = llmProperties;
    }

    @Override
    public String name() {
        return "generator";
    }

    @Override
    public PitchState execute(PitchState state) {
        String userPrompt = """
                MVP Description: %s

                Research Context:
                %s

                Generate a compelling pitch.
                """.formatted(state.description(), state.contextOrEmpty());
        try {
            String pitch = llmService.call(SYSTEM_PROMPT, userPrompt, llmProperties.getTemperatures().getGenerator());
            return state.withPitch(pitch.trim());
        } catch (BackendUnavailableException e) {
            log.warn("Pitch generation degraded: {}", e.getMessage());
            return state.withPitch(degradedDraft(state.description()));
        }
    }

    static String degradedDraft(String description) {
        return "Draft pitch (automatic generation unavailable): " + description.trim();
    }
}
