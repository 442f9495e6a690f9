package com.pitchcraft.core.nodes;

import com.pitchcraft.core.llm.BackendUnavailableException;
import com.pitchcraft.core.llm.LlmProperties;
import com.pitchcraft.core.llm.LlmService;
import com.pitchcraft.core.model.FinalPackage;
import com.pitchcraft.core.model.Phase;
import com.pitchcraft.core.model.PitchState;
import com.pitchcraft.core.parsing.FinalPackageParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns the final draft into the presentation-ready {@link FinalPackage}.
 * <p>
 * When the session was capped the package is built from the last draft and
 * flagged {@code capped}.
 */
@Component
public class ReadinessAgentStep implements AgentStep {

    private static final Logger log = LoggerFactory.getLogger(ReadinessAgentStep.class);

    private static final String SYSTEM_PROMPT = """
            You are a pitch coach preparing the final deliverable.

            Build a polished pitch package: a one-line elevator pitch, an executive summary,
            the problem, the solution, the unique value proposition, traction, market
            opportunity, business model, competitive advantages, team highlights, the funding
            ask, key talking points, anticipated investor questions with suggested answers,
            and delivery tips (tone, pacing, emphasis).

            Use only facts present in the pitch and context. Use "not provided" for anything
            that is unknown. Reply with JSON only.
            """;

    private final LlmService llmService;
    private final LlmProperties llmProperties;
    private final FinalPackageParser packageParser;

    public ReadinessAgentStep(LlmService llmService, LlmProperties llmProperties, FinalPackageParser packageParser) {
        this.llmService = llmService;
        this.llmProperties = llmProperties;
        this.packageParser = packageParser;
    }

    @Override
    public String name() {
        return "readiness";
    }

    @Override
    public PitchState execute(PitchState state) {
        String pitch = state.requirePitch();
        boolean capped = state.phase() == Phase.CAPPED;
        String userPrompt = """
                Approved Pitch:
                %s

                Research Context:
                %s

                Reviewer Notes:
                %s

                Prepare the final pitch package.

                %s
                """.formatted(pitch, state.contextOrEmpty(),
                state.hasHumanFeedback() ? state.humanFeedback() : "none",
                LlmService.formatInstructions(FinalPackage.class));

        FinalPackage pkg;
        try {
            String reply = llmService.call(SYSTEM_PROMPT, userPrompt, llmProperties.getTemperatures().getReadiness());
            pkg = packageParser.parse(reply, pitch, capped);
        } catch (BackendUnavailableException e) {
            log.warn("Final package degraded, building from the pitch: {}", e.getMessage());
            pkg = FinalPackageParser.fallback(pitch, capped);
        }
        return state.withFinalPackage(pkg);
    }
}
