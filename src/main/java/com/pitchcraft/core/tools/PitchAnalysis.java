package com.pitchcraft.core.tools;

import java.io.Serializable;

/**
 * Structural metrics of a pitch draft, fed to the critic alongside the text.
 */
public record PitchAnalysis(
    int wordCount,
    int sentenceCount,
    double avgWordsPerSentence,
    boolean hasProblemStatement,
    boolean hasSolution,
    boolean hasMarket,
    boolean hasTraction
) implements Serializable {

    public String toPromptSummary() {
        return """
                Word count: %d
                Sentence count: %d
                Average words per sentence: %.1f
                Mentions a problem: %s
                Mentions a solution: %s
                Mentions a market: %s
                Mentions traction: %s
                """.formatted(wordCount, sentenceCount, avgWordsPerSentence,
                yesNo(hasProblemStatement), yesNo(hasSolution), yesNo(hasMarket), yesNo(hasTraction));
    }

    private static String yesNo(boolean flag) {
        return flag ? "yes" : "no";
    }
}
