package com.jreinhal.formulator.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lenient parsing of model output that is supposed to be a JSON object.
 */
public final class JsonResponses {

    private static final Logger log = LoggerFactory.getLogger(JsonResponses.class);

    private JsonResponses() {
    }

    /**
     * Parse {@code raw} as a JSON object. Markdown fences are tolerated; anything
     * that is not a JSON object yields an empty object.
     */
    public static ObjectNode parseObject(ObjectMapper mapper, String raw) {
        String body = stripFence(raw);
        if (body.isEmpty()) {
            return mapper.createObjectNode();
        }
        try {
            JsonNode node = mapper.readTree(body);
            if (node instanceof ObjectNode object) {
                return object;
            }
            log.warn("Structured response was {} rather than an object", node == null ? "empty" : node.getNodeType());
        } catch (JsonProcessingException e) {
            log.warn("Structured response was not valid JSON: {}", e.getOriginalMessage());
        }
        return mapper.createObjectNode();
    }

    /**
     * Collect every numeric {@code logprob} in an Ollama chat response. Entries are
     * read from the top-level {@code logprobs} array, or from {@code message.logprobs}.
     */
    public static List<Double> tokenLogprobs(JsonNode response) {
        List<Double> values = new ArrayList<>();
        if (response == null) {
            return values;
        }
        JsonNode entries = response.path("logprobs");
        if (!entries.isArray()) {
            entries = response.path("message").path("logprobs");
        }
        if (!entries.isArray()) {
            return values;
        }
        for (JsonNode entry : entries) {
            JsonNode logprob = entry.path("logprob");
            if (logprob.isNumber()) {
                values.add(logprob.asDouble());
            }
        }
        return values;
    }

    static String stripFence(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.strip();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline < 0 ? text.substring(3) : text.substring(firstNewline + 1);
            if (text.endsWith("```")) {
                text = text.substring(0, text.length() - 3);
            }
        }
        return text.strip();
    }
}
