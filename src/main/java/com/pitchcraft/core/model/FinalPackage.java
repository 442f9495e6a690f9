package com.pitchcraft.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * The presentation-ready pitch package produced at the end of a session.
 * <p>
 * Every field is mandatory. Values the backend did not produce carry the
 * {@link #NOT_PROVIDED} placeholder so that consumers can rely on the shape.
 * {@code capped} is true when the package was built from the last draft after
 * the iteration budget ran out rather than from a human-approved pitch.
 */
public record FinalPackage(
    @JsonProperty("elevator_pitch") String elevatorPitch,
    @JsonProperty("executive_summary") String executiveSummary,
    @JsonProperty("problem_statement") String problemStatement,
    String solution,
    @JsonProperty("unique_value_proposition") String uniqueValueProposition,
    @JsonProperty("traction_metrics") TractionMetrics tractionMetrics,
    @JsonProperty("market_opportunity") MarketOpportunity marketOpportunity,
    @JsonProperty("business_model") BusinessModel businessModel,
    @JsonProperty("competitive_advantage") List<String> competitiveAdvantage,
    @JsonProperty("team_highlights") String teamHighlights,
    @JsonProperty("funding_ask") FundingAsk fundingAsk,
    @JsonProperty("key_talking_points") List<String> keyTalkingPoints,
    @JsonProperty("anticipated_questions") List<QuestionAnswer> anticipatedQuestions,
    @JsonProperty("delivery_tips") DeliveryTips deliveryTips,
    boolean capped
) implements Serializable {

    public static final String NOT_PROVIDED = "not provided";

    public record TractionMetrics(
        String users,
        String revenue,
        String growth,
        @JsonProperty("other_metrics") List<String> otherMetrics
    ) implements Serializable {}

    public record MarketOpportunity(
        String tam,
        String sam,
        @JsonProperty("target_segment") String targetSegment
    ) implements Serializable {}

    public record BusinessModel(
        @JsonProperty("revenue_streams") List<String> revenueStreams,
        String pricing,
        @JsonProperty("unit_economics") String unitEconomics
    ) implements Serializable {}

    public record FundingAsk(
        String amount,
        @JsonProperty("use_of_funds") Map<String, String> useOfFunds,
        List<String> milestones
    ) implements Serializable {}

    public record QuestionAnswer(
        String question,
        String answer
    ) implements Serializable {}

    public record DeliveryTips(
        String tone,
        String pacing,
        @JsonProperty("emphasis_points") List<String> emphasisPoints
    ) implements Serializable {}

    public FinalPackage withCapped(boolean cappedFlag) {
        return new FinalPackage(elevatorPitch, executiveSummary, problemStatement, solution,
                uniqueValueProposition, tractionMetrics, marketOpportunity, businessModel,
                competitiveAdvantage, teamHighlights, fundingAsk, keyTalkingPoints,
                anticipatedQuestions, deliveryTips, cappedFlag);
    }
}
