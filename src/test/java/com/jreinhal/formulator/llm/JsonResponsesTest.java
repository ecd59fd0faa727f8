package com.jreinhal.formulator.llm;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JsonResponsesTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Nested
    @DisplayName("parseObject()")
    class ParseObjectTest {

        @Test
        @DisplayName("Should parse a plain JSON object")
        void shouldParseObject() {
            ObjectNode node = JsonResponses.parseObject(mapper, "{\"score\": 85}");

            assertThat(node.path("score").asInt()).isEqualTo(85);
        }

        @Test
        @DisplayName("Should tolerate a markdown fence")
        void shouldStripFence() {
            ObjectNode node = JsonResponses.parseObject(mapper, "```json\n{\"score\": 70}\n```");

            assertThat(node.path("score").asInt()).isEqualTo(70);
        }

        @Test
        @DisplayName("Should degrade malformed, empty and non-object output to an empty object")
        void shouldDegradeToEmptyObject() {
            assertThat(JsonResponses.parseObject(mapper, "score: high")).isEmpty();
            assertThat(JsonResponses.parseObject(mapper, "{\"score\": ")).isEmpty();
            assertThat(JsonResponses.parseObject(mapper, "[1, 2]")).isEmpty();
            assertThat(JsonResponses.parseObject(mapper, "")).isEmpty();
            assertThat(JsonResponses.parseObject(mapper, null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("tokenLogprobs()")
    class TokenLogprobsTest {

        @Test
        @DisplayName("Should read top-level logprobs")
        void shouldReadTopLevel() throws Exception {
            var response = mapper.readTree(
                    "{\"message\":{\"content\":\"{}\"},\"logprobs\":[{\"token\":\"{\",\"logprob\":-0.5},"
                            + "{\"token\":\"}\",\"logprob\":-1.5}]}");

            assertThat(JsonResponses.tokenLogprobs(response)).containsExactly(-0.5, -1.5);
        }

        @Test
        @DisplayName("Should read logprobs nested under message and skip non-numeric entries")
        void shouldReadNested() throws Exception {
            var response = mapper.readTree(
                    "{\"message\":{\"content\":\"x\",\"logprobs\":[{\"logprob\":-2.0},{\"logprob\":\"n/a\"}]}}");

            assertThat(JsonResponses.tokenLogprobs(response)).containsExactly(-2.0);
        }

        @Test
        @DisplayName("Should return an empty list when none are reported")
        void shouldHandleMissing() throws Exception {
            assertThat(JsonResponses.tokenLogprobs(mapper.readTree("{\"message\":{\"content\":\"x\"}}"))).isEmpty();
            assertThat(JsonResponses.tokenLogprobs(null)).isEmpty();
        }
    }
}
