package com.pitchcraft.core.tools;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keyword-based structural analysis of a pitch draft.
 */
@Component
public class PitchAnalyzer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");

    private static final List<String> PROBLEM_WORDS = List.of("problem", "challenge", "issue", "pain");
    private static final List<String> SOLUTION_WORDS = List.of("solution", "solve", "built", "created");
    private static final List<String> MARKET_WORDS = List.of("market", "customers", "users", "billion");
    private static final List<String> TRACTION_WORDS = List.of("users", "revenue", "growth", "customers");

    public PitchAnalysis analyze(String pitch) {
        String text = pitch == null ? "" : pitch.trim();
        if (text.isEmpty()) {
            return new PitchAnalysis(0, 0, 0.0, false, false, false, false);
        }
        int words = WHITESPACE.split(text).length;
        int sentences = 0;
        for (String part : SENTENCE_END.split(text)) {
            if (!part.isBlank()) {
                sentences++;
            }
        }
        sentences = Math.max(sentences, 1);
        String lower = text.toLowerCase(Locale.ROOT);
        return new PitchAnalysis(
                words,
                sentences,
                (double) words / sentences,
                mentionsAny(lower, PROBLEM_WORDS),
                mentionsAny(lower, SOLUTION_WORDS),
                mentionsAny(lower, MARKET_WORDS),
                mentionsAny(lower, TRACTION_WORDS));
    }

    private static boolean mentionsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }
}
