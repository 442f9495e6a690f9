package com.pitchcraft.core.tools;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PitchAnalyzerTest {

    private final PitchAnalyzer analyzer = new PitchAnalyzer();

    @Test
    @DisplayName("counts words and sentences")
    void countsWordsAndSentences() {
        PitchAnalysis analysis = analyzer.analyze("Cooking is hard. We built HomePlate! Try it?");

        assertEquals(8, analysis.wordCount());
        assertEquals(3, analysis.sentenceCount());
        assertEquals(8.0 / 3, analysis.avgWordsPerSentence(), 1e-9);
    }

    @Test
    @DisplayName("text without terminal punctuation is one sentence")
    void noPunctuation() {
        assertEquals(1, analyzer.analyze("a pitch without an ending").sentenceCount());
    }

    @Test
    @DisplayName("detects structural elements by keyword")
    void detectsElements() {
        PitchAnalysis analysis = analyzer.analyze(
                "The problem is loneliness. Our solution connects neighbours. 2,000 users already.");

        assertTrue(analysis.hasProblemStatement());
        assertTrue(analysis.hasSolution());
        assertTrue(analysis.hasMarket());
        assertTrue(analysis.hasTraction());
    }

    @Test
    @DisplayName("empty text yields an empty analysis")
    void emptyText() {
        PitchAnalysis analysis = analyzer.analyze("  ");

        assertEquals(0, analysis.wordCount());
        assertEquals(0, analysis.sentenceCount());
        assertFalse(analysis.hasTraction());
    }

    @Test
    @DisplayName("prompt summary lists every metric")
    void promptSummary() {
        String summary = analyzer.analyze("We solve hunger.").toPromptSummary();

        assertTrue(summary.contains("Word count: 3"));
        assertTrue(summary.contains("Mentions a solution: yes"));
        assertTrue(summary.contains("Mentions traction: no"));
    }
}
