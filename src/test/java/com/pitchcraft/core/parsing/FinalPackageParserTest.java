package com.pitchcraft.core.parsing;

import com.pitchcraft.core.model.FinalPackage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.pitchcraft.core.model.FinalPackage.NOT_PROVIDED;
import static org.junit.jupiter.api.Assertions.*;

class FinalPackageParserTest {

    private final FinalPackageParser parser = new FinalPackageParser();

    @Test
    @DisplayName("empty object yields every field as a placeholder")
    void emptyObjectFillsPlaceholders() {
        FinalPackage pkg = parser.parse("{}", "Some pitch", false);

        assertEquals(NOT_PROVIDED, pkg.elevatorPitch());
        assertEquals(NOT_PROVIDED, pkg.executiveSummary());
        assertEquals(NOT_PROVIDED, pkg.tractionMetrics().users());
        assertEquals(List.of(NOT_PROVIDED), pkg.tractionMetrics().otherMetrics());
        assertEquals(NOT_PROVIDED, pkg.marketOpportunity().tam());
        assertEquals(List.of(NOT_PROVIDED), pkg.businessModel().revenueStreams());
        assertEquals(Map.of(NOT_PROVIDED, NOT_PROVIDED), pkg.fundingAsk().useOfFunds());
        assertEquals(1, pkg.anticipatedQuestions().size());
        assertEquals(NOT_PROVIDED, pkg.anticipatedQuestions().get(0).question());
        assertEquals(NOT_PROVIDED, pkg.deliveryTips().tone());
        assertFalse(pkg.capped());
    }

    @Test
    @DisplayName("populated reply is mapped field by field")
    void populatedReply() {
        String reply = """
                Here you go:
                {
                  "elevator_pitch": "Home-cooked dinners from your street.",
                  "executive_summary": "HomePlate matches cooks and diners.",
                  "traction_metrics": {"users": "1,200", "revenue": "", "growth": "30% MoM"},
                  "funding_ask": {"amount": "$500k", "use_of_funds": {"engineering": "60%", "marketing": "40%"}},
                  "key_talking_points": ["Local", "Fresh"],
                  "anticipated_questions": [{"question": "Food safety?", "answer": "Certified kitchens."}],
                  "delivery_tips": {"tone": "warm", "pacing": "steady", "emphasis_points": ["community"]}
                }
                """;
        FinalPackage pkg = parser.parse(reply, "Pitch", true);

        assertEquals("Home-cooked dinners from your street.", pkg.elevatorPitch());
        assertEquals("1,200", pkg.tractionMetrics().users());
        assertEquals(NOT_PROVIDED, pkg.tractionMetrics().revenue());
        assertEquals("60%", pkg.fundingAsk().useOfFunds().get("engineering"));
        assertEquals(List.of("Local", "Fresh"), pkg.keyTalkingPoints());
        assertEquals("Certified kitchens.", pkg.anticipatedQuestions().get(0).answer());
        assertEquals(List.of("community"), pkg.deliveryTips().emphasisPoints());
        assertTrue(pkg.capped());
    }

    @Test
    @DisplayName("non-JSON reply falls back to a package built from the pitch")
    void nonJsonFallsBack() {
        String pitch = "x".repeat(450);
        FinalPackage pkg = parser.parse("Sorry, I cannot help with that.", pitch, false);

        assertEquals(FinalPackageParser.ELEVATOR_FALLBACK_CHARS, pkg.elevatorPitch().length());
        assertEquals(pitch, pkg.executiveSummary());
        assertEquals(NOT_PROVIDED, pkg.solution());
        assertEquals(List.of(NOT_PROVIDED), pkg.competitiveAdvantage());
    }

    @Test
    @DisplayName("short pitches are used whole as the fallback elevator pitch")
    void shortPitchFallback() {
        FinalPackage pkg = FinalPackageParser.fallback("  Short pitch.  ", true);

        assertEquals("Short pitch.", pkg.elevatorPitch());
        assertTrue(pkg.capped());
    }
}
