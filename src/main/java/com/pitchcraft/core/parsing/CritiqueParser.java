package com.pitchcraft.core.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.pitchcraft.core.llm.LlmParseException;
import com.pitchcraft.core.model.Critique;
import com.pitchcraft.core.model.CritiqueScores;
import com.pitchcraft.core.qualitygate.ScoreGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a critic reply into a {@link Critique}.
 * <p>
 * The overall score and decision are always recomputed locally from the six
 * sub-scores; whatever the model claims for them is ignored. A reply missing
 * any sub-score is rejected as a whole.
 */
@Component
public class CritiqueParser {

    private static final Logger log = LoggerFactory.getLogger(CritiqueParser.class);

    static final List<String> CRITERIA =
            List.of("clarity", "problem", "solution", "uniqueness", "traction", "engagement");

    private final ScoreGate scoreGate;

    public CritiqueParser(ScoreGate scoreGate) {
        this.scoreGate = scoreGate;
    }

    /**
     * Parses the reply, substituting {@link Critique#fallback(String)} when it is unusable.
     */
    public Critique parse(String reply) {
        try {
            return parseStrict(reply);
        } catch (LlmParseException e) {
            log.warn("Critique reply rejected, using fallback critique: {}", e.getMessage());
            return Critique.fallback(e.getMessage());
        }
    }

    public Critique parseStrict(String reply) {
        JsonNode root = JsonReplyExtractor.readObject(reply);
        JsonNode scoresNode = root.has("scores") && root.get("scores").isObject() ? root.get("scores") : root;

        double[] values = new double[CRITERIA.size()];
        for (int i = 0; i < CRITERIA.size(); i++) {
            values[i] = clamp(readScore(scoresNode, CRITERIA.get(i)));
        }
        var scores = new CritiqueScores(values[0], values[1], values[2], values[3], values[4], values[5]);
        double overall = scores.overall();

        return new Critique(
                scores,
                overall,
                root.path("feedback").asText(""),
                readStrings(root.path("strengths")),
                readStrings(root.path("weaknesses")),
                scoreGate.decide(overall),
                false);
    }

    private static double readScore(JsonNode scores, String name) {
        JsonNode node = scores.get(name);
        if (node == null || node.isNull()) {
            throw new LlmParseException("Missing score: " + name);
        }
        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new LlmParseException("Non-numeric score for " + name + ": " + node.asText(), e);
            }
        } else {
            throw new LlmParseException("Non-numeric score for " + name);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new LlmParseException("Non-finite score for " + name);
        }
        return value;
    }

    private static double clamp(double value) {
        return Math.max(CritiqueScores.MIN_SCORE, Math.min(CritiqueScores.MAX_SCORE, value));
    }

    static List<String> readStrings(JsonNode node) {
        List<String> result = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                String text = item.asText("").trim();
                if (!text.isEmpty()) {
                    result.add(text);
                }
            }
        } else if (node.isTextual() && !node.asText().isBlank()) {
            result.add(node.asText().trim());
        }
        return result;
    }
}
