package com.pitchcraft.core.parsing;

import com.pitchcraft.core.llm.LlmParseException;
import com.pitchcraft.core.model.Critique;
import com.pitchcraft.core.model.CritiqueScores;
import com.pitchcraft.core.model.Decision;
import com.pitchcraft.core.qualitygate.ScoreGate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CritiqueParserTest {

    private final CritiqueParser parser = new CritiqueParser(new ScoreGate(7.5));

    private static final String FULL_REPLY = """
            ```json
            {
              "scores": {"clarity": 8, "problem": 7, "solution": 8, "uniqueness": 7, "traction": 6, "engagement": 9},
              "overall_score": 2.0,
              "decision": "FAIL",
              "feedback": "Add numbers to the traction claim.",
              "strengths": ["Clear problem", "Memorable close"],
              "weaknesses": ["Vague traction"]
            }
            ```
            """;

    @Nested
    @DisplayName("well-formed replies")
    class WellFormed {

        @Test
        @DisplayName("recomputes overall and decision, ignoring the model's own values")
        void recomputesOverall() {
            Critique critique = parser.parse(FULL_REPLY);

            assertEquals(7.5, critique.overall());
            assertEquals(Decision.PASS, critique.decision());
            assertFalse(critique.degraded());
            assertEquals(new CritiqueScores(8, 7, 8, 7, 6, 9), critique.scores());
        }

        @Test
        @DisplayName("carries feedback, strengths and weaknesses")
        void carriesText() {
            Critique critique = parser.parse(FULL_REPLY);

            assertEquals("Add numbers to the traction claim.", critique.feedback());
            assertEquals(List.of("Clear problem", "Memorable close"), critique.strengths());
            assertEquals(List.of("Vague traction"), critique.weaknesses());
        }

        @Test
        @DisplayName("accepts flat scores and numeric strings")
        void flatScoresAndStrings() {
            String reply = """
                    {"clarity": "6", "problem": 6, "solution": 6, "uniqueness": 6, "traction": 6, "engagement": 6}
                    """;
            Critique critique = parser.parseStrict(reply);

            assertEquals(6.0, critique.overall());
            assertEquals(Decision.FAIL, critique.decision());
        }

        @Test
        @DisplayName("clamps out-of-range scores to [0, 10]")
        void clampsScores() {
            String reply = """
                    {"scores": {"clarity": 14, "problem": -3, "solution": 10, "uniqueness": 10, "traction": 10, "engagement": 10}}
                    """;
            Critique critique = parser.parseStrict(reply);

            assertEquals(10.0, critique.scores().clarity());
            assertEquals(0.0, critique.scores().problem());
            assertEquals(8.3, critique.overall());
        }

        @Test
        @DisplayName("a single weakness string is accepted as a one-element list")
        void singleStringList() {
            String reply = """
                    {"scores": {"clarity": 5, "problem": 5, "solution": 5, "uniqueness": 5, "traction": 5, "engagement": 5},
                     "weaknesses": "Too long"}
                    """;
            assertEquals(List.of("Too long"), parser.parse(reply).weaknesses());
        }
    }

    @Nested
    @DisplayName("unusable replies")
    class Unusable {

        @Test
        @DisplayName("a missing sub-score yields a degraded FAIL critique")
        void missingScore() {
            String reply = """
                    {"scores": {"clarity": 9, "problem": 9, "solution": 9, "uniqueness": 9, "traction": 9}}
                    """;
            Critique critique = parser.parse(reply);

            assertTrue(critique.degraded());
            assertEquals(Decision.FAIL, critique.decision());
            assertEquals(CritiqueScores.lowest(), critique.scores());
            assertThrows(LlmParseException.class, () -> parser.parseStrict(reply));
        }

        @Test
        @DisplayName("a non-numeric score yields a degraded critique")
        void nonNumericScore() {
            String reply = """
                    {"scores": {"clarity": "great", "problem": 9, "solution": 9, "uniqueness": 9, "traction": 9, "engagement": 9}}
                    """;
            assertTrue(parser.parse(reply).degraded());
        }

        @Test
        @DisplayName("prose without JSON yields a degraded critique")
        void prose() {
            assertTrue(parser.parse("This pitch is pretty good overall.").degraded());
        }
    }
}
