package com.jreinhal.formulator.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.ollama.api.OllamaOptions;

/**
 * Text and structured generation backed by a local Ollama server.
 *
 * Plain completions go through the Spring AI {@link ChatClient}. Completions that
 * need token log-probabilities call Ollama's {@code /api/chat} endpoint directly,
 * since the chat abstraction does not surface them. Every call runs inside the
 * shared {@link RetryExecutor}.
 */
public class OllamaLanguageModel implements TextGenerator, StructuredGenerator {

    private static final Logger log = LoggerFactory.getLogger(OllamaLanguageModel.class);

    private static final String JSON_FORMAT = "json";

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final RetryExecutor retryExecutor;
    private final String baseUrl;
    private final String model;
    private final Duration requestTimeout;

    public OllamaLanguageModel(ChatClient.Builder chatClientBuilder, ObjectMapper objectMapper, HttpClient httpClient,
                               RetryExecutor retryExecutor, String baseUrl, String model, Duration requestTimeout) {
        this.chatClient = chatClientBuilder.build();
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.retryExecutor = retryExecutor;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.model = model;
        this.requestTimeout = requestTimeout;
        log.info("Ollama language model ready (model={}, baseUrl={}, maxAttempts={})",
                model, this.baseUrl, retryExecutor.getMaxAttempts());
    }

    @Override
    public String generate(String prompt, double temperature) {
        OllamaOptions options = OllamaOptions.builder().temperature(temperature).build();
        return this.retryExecutor.execute("Text generation", () -> chat(prompt, options));
    }

    @Override
    public GeneratedText generateWithLogprobs(String prompt, double temperature) {
        return this.retryExecutor.execute("Text generation with logprobs",
                () -> chatWithLogprobs(prompt, temperature, false));
    }

    @Override
    public JsonNode generateStructured(String prompt, double temperature) {
        OllamaOptions options = OllamaOptions.builder().temperature(temperature).format(JSON_FORMAT).build();
        String raw = this.retryExecutor.execute("Structured generation", () -> chat(prompt, options));
        return JsonResponses.parseObject(this.objectMapper, raw);
    }

    @Override
    public StructuredResponse generateStructuredWithLogprobs(String prompt, double temperature) {
        GeneratedText generated = this.retryExecutor.execute("Structured generation with logprobs",
                () -> chatWithLogprobs(prompt, temperature, true));
        return new StructuredResponse(JsonResponses.parseObject(this.objectMapper, generated.text()),
                generated.logprobs());
    }

    private String chat(String prompt, OllamaOptions options) {
        String content = this.chatClient.prompt()
                .user(prompt)
                .options(options)
                .call()
                .content();
        return content == null ? "" : content.strip();
    }

    private GeneratedText chatWithLogprobs(String prompt, double temperature, boolean jsonMode)
            throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", this.model);
        body.put("stream", Boolean.FALSE);
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        body.put("logprobs", Boolean.TRUE);
        body.put("options", Map.of("temperature", temperature));
        if (jsonMode) {
            body.put("format", JSON_FORMAT);
        }

        HttpRequest request = HttpRequest.newBuilder(URI.create(this.baseUrl + "/api/chat"))
                .timeout(this.requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(this.objectMapper.writeValueAsString(body)))
                .build();
        HttpResponse<String> response = this.httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            boolean retryable = status == 429 || status >= 500;
            throw new LlmInvocationException("Ollama /api/chat returned HTTP " + status, retryable);
        }

        JsonNode payload = this.objectMapper.readTree(response.body());
        String content = payload.path("message").path("content").asText("").strip();
        List<Double> logprobs = JsonResponses.tokenLogprobs(payload);
        log.debug("Ollama chat returned {} chars with {} token logprobs", content.length(), logprobs.size());
        return new GeneratedText(content, logprobs);
    }
}
