package com.jreinhal.formulator.llm;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Language model calls whose answer is parsed as a JSON object.
 *
 * A response that cannot be parsed, or that is not an object, degrades to an
 * empty object. Parsing problems are never raised to the caller.
 */
public interface StructuredGenerator {

    JsonNode generateStructured(String prompt, double temperature);

    /**
     * Structured completion with per-token log-probabilities. The log-probabilities
     * are returned even when the body fails to parse.
     */
    StructuredResponse generateStructuredWithLogprobs(String prompt, double temperature);
}
