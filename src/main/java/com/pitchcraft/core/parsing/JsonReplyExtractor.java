package com.pitchcraft.core.parsing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pitchcraft.core.llm.LlmParseException;

/**
 * Pulls the JSON object out of a free-form model reply.
 * <p>
 * Models wrap JSON in markdown fences or surround it with prose; everything
 * outside the outermost braces is discarded before parsing.
 */
public final class JsonReplyExtractor {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonReplyExtractor() {}

    public static String extractObject(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new LlmParseException("Reply is empty");
        }
        String cleaned = stripFences(reply.trim());
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new LlmParseException("Reply contains no JSON object");
        }
        return cleaned.substring(start, end + 1);
    }

    public static JsonNode readObject(String reply) {
        String json = extractObject(reply);
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || !node.isObject()) {
                throw new LlmParseException("Reply is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new LlmParseException("Malformed JSON in reply: " + e.getOriginalMessage(), e);
        }
    }

    static String stripFences(String text) {
        String cleaned = text;
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
