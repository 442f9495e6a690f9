package com.pitchcraft.core.nodes;

import com.pitchcraft.core.llm.BackendUnavailableException;
import com.pitchcraft.core.llm.LlmProperties;
import com.pitchcraft.core.llm.LlmService;
import com.pitchcraft.core.metrics.PitchMetrics;
import com.pitchcraft.core.model.Critique;
import com.pitchcraft.core.model.PitchState;
import com.pitchcraft.core.parsing.CritiqueParser;
import com.pitchcraft.core.tools.PitchAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scores the current draft on six criteria and applies the pass/fail gate.
 * <p>
 * An unusable reply or an unreachable backend yields a degraded FAIL critique
 * rather than an error, so the iteration policy still gets a decision.
 */
@Component
public class CriticAgentStep implements AgentStep {

    private static final Logger log = LoggerFactory.getLogger(CriticAgentStep.class);

    private static final String SYSTEM_PROMPT = """
            You are a tough but fair pitch critic (think YC partner or top VC).

            Score the pitch from 0 to 10 on each criterion:
            1. clarity: is it immediately clear what they do?
            2. problem: is the problem compelling and relatable?
            3. solution: is the solution clearly explained?
            4. uniqueness: what makes this different or better?
            5. traction: is there any proof it works?
            6. engagement: is it memorable and compelling?

            Reply with JSON only, in exactly this shape:
            {
              "scores": {"clarity": 0, "problem": 0, "solution": 0, "uniqueness": 0, "traction": 0, "engagement": 0},
              "feedback": "specific feedback on what is weak",
              "strengths": ["..."],
              "weaknesses": ["..."]
            }
            """;

    private final LlmService llmService;
    private final LlmProperties llmProperties;
    private final CritiqueParser critiqueParser;
    private final PitchAnalyzer pitchAnalyzer;
    private final PitchMetrics metrics;

    public CriticAgentStep(LlmService llmService,
                           LlmProperties llmProperties,
                           CritiqueParser critiqueParser,
                           PitchAnalyzer pitchAnalyzer,
                           PitchMetrics metrics) {
        this.llmService = llmService;
        this.llmProperties = llmProperties;
        this.critiqueParser = critiqueParser;
        this.pitchAnalyzer = pitchAnalyzer;
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return "critic";
    }

    @Override
    public PitchState execute(PitchState state) {
        String pitch = state.requirePitch();
        String userPrompt = """
                Critique this pitch:

                %s

                Structural analysis:
                %s
                """.formatted(pitch, pitchAnalyzer.analyze(pitch).toPromptSummary());

        Critique critique;
        try {
            String reply = llmService.call(SYSTEM_PROMPT, userPrompt, llmProperties.getTemperatures().getCritic());
            critique = critiqueParser.parse(reply);
        } catch (BackendUnavailableException e) {
            log.warn("Critique degraded: {}", e.getMessage());
            critique = Critique.fallback("critic backend unavailable");
        }

        if (critique.degraded()) {
            metrics.recordDegradedCritique();
        }
        metrics.recordGateResult(critique.passed());
        log.info("Critique: overall {} -> {}", critique.overall(), critique.decision());
        return state.withCritique(critique);
    }
}
