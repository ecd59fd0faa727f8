package com.jreinhal.formulator.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.List;

public record StructuredResponse(JsonNode value, List<Double> logprobs) {

    public StructuredResponse {
        value = value == null ? JsonNodeFactory.instance.objectNode() : value;
        logprobs = logprobs == null ? List.of() : List.copyOf(logprobs);
    }
}
