package com.pitchcraft.core.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.pitchcraft.core.llm.LlmParseException;
import com.pitchcraft.core.model.FinalPackage;
import com.pitchcraft.core.model.FinalPackage.BusinessModel;
import com.pitchcraft.core.model.FinalPackage.DeliveryTips;
import com.pitchcraft.core.model.FinalPackage.FundingAsk;
import com.pitchcraft.core.model.FinalPackage.MarketOpportunity;
import com.pitchcraft.core.model.FinalPackage.QuestionAnswer;
import com.pitchcraft.core.model.FinalPackage.TractionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.pitchcraft.core.model.FinalPackage.NOT_PROVIDED;

/**
 * Turns a readiness reply into a complete {@link FinalPackage}.
 * <p>
 * Every schema field is always present: absent or empty values become the
 * {@code "not provided"} placeholder, and a reply that is not JSON at all
 * yields a package built from the pitch itself.
 */
@Component
public class FinalPackageParser {

    private static final Logger log = LoggerFactory.getLogger(FinalPackageParser.class);

    static final int ELEVATOR_FALLBACK_CHARS = 200;

    public FinalPackage parse(String reply, String pitch, boolean capped) {
        JsonNode root;
        try {
            root = JsonReplyExtractor.readObject(reply);
        } catch (LlmParseException e) {
            log.warn("Readiness reply rejected, building package from the pitch: {}", e.getMessage());
            return fallback(pitch, capped);
        }

        JsonNode traction = root.path("traction_metrics");
        JsonNode market = root.path("market_opportunity");
        JsonNode model = root.path("business_model");
        JsonNode funding = root.path("funding_ask");
        JsonNode tips = root.path("delivery_tips");

        return new FinalPackage(
                text(root, "elevator_pitch"),
                text(root, "executive_summary"),
                text(root, "problem_statement"),
                text(root, "solution"),
                text(root, "unique_value_proposition"),
                new TractionMetrics(
                        text(traction, "users"),
                        text(traction, "revenue"),
                        text(traction, "growth"),
                        strings(traction.path("other_metrics"))),
                new MarketOpportunity(
                        text(market, "tam"),
                        text(market, "sam"),
                        text(market, "target_segment")),
                new BusinessModel(
                        strings(model.path("revenue_streams")),
                        text(model, "pricing"),
                        text(model, "unit_economics")),
                strings(root.path("competitive_advantage")),
                text(root, "team_highlights"),
                new FundingAsk(
                        text(funding, "amount"),
                        allocations(funding.path("use_of_funds")),
                        strings(funding.path("milestones"))),
                strings(root.path("key_talking_points")),
                questions(root.path("anticipated_questions")),
                new DeliveryTips(
                        text(tips, "tone"),
                        text(tips, "pacing"),
                        strings(tips.path("emphasis_points"))),
                capped);
    }

    /**
     * Package derived from the pitch alone, used when the backend produced nothing usable.
     */
    public static FinalPackage fallback(String pitch, boolean capped) {
        String text = pitch == null ? "" : pitch.trim();
        String elevator = text.length() > ELEVATOR_FALLBACK_CHARS ? text.substring(0, ELEVATOR_FALLBACK_CHARS) : text;
        return new FinalPackage(
                elevator.isEmpty() ? NOT_PROVIDED : elevator,
                text.isEmpty() ? NOT_PROVIDED : text,
                NOT_PROVIDED,
                NOT_PROVIDED,
                NOT_PROVIDED,
                new TractionMetrics(NOT_PROVIDED, NOT_PROVIDED, NOT_PROVIDED, List.of(NOT_PROVIDED)),
                new MarketOpportunity(NOT_PROVIDED, NOT_PROVIDED, NOT_PROVIDED),
                new BusinessModel(List.of(NOT_PROVIDED), NOT_PROVIDED, NOT_PROVIDED),
                List.of(NOT_PROVIDED),
                NOT_PROVIDED,
                new FundingAsk(NOT_PROVIDED, Map.of(NOT_PROVIDED, NOT_PROVIDED), List.of(NOT_PROVIDED)),
                List.of(NOT_PROVIDED),
                List.of(new QuestionAnswer(NOT_PROVIDED, NOT_PROVIDED)),
                new DeliveryTips(NOT_PROVIDED, NOT_PROVIDED, List.of(NOT_PROVIDED)),
                capped);
    }

    private static String text(JsonNode parent, String field) {
        JsonNode node = parent.path(field);
        if (node.isValueNode()) {
            String value = node.asText("").trim();
            if (!value.isEmpty() && !node.isNull()) {
                return value;
            }
        }
        return NOT_PROVIDED;
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = CritiqueParser.readStrings(node);
        return values.isEmpty() ? List.of(NOT_PROVIDED) : List.copyOf(values);
    }

    private static Map<String, String> allocations(JsonNode node) {
        Map<String, String> result = new LinkedHashMap<>();
        if (node.isObject()) {
            node.fields().forEachRemaining(entry -> {
                String value = entry.getValue().asText("").trim();
                result.put(entry.getKey(), value.isEmpty() ? NOT_PROVIDED : value);
            });
        }
        return result.isEmpty() ? Map.of(NOT_PROVIDED, NOT_PROVIDED) : result;
    }

    private static List<QuestionAnswer> questions(JsonNode node) {
        List<QuestionAnswer> result = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isObject()) {
                    result.add(new QuestionAnswer(text(item, "question"), text(item, "answer")));
                } else if (item.isTextual() && !item.asText().isBlank()) {
                    result.add(new QuestionAnswer(item.asText().trim(), NOT_PROVIDED));
                }
            }
        }
        return result.isEmpty() ? List.of(new QuestionAnswer(NOT_PROVIDED, NOT_PROVIDED)) : result;
    }
}
