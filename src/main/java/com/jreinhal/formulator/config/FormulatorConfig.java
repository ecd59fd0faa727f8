package com.jreinhal.formulator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.formulator.evaluation.AnswerEvaluator;
import com.jreinhal.formulator.evaluation.NumericAnswerEvaluator;
import com.jreinhal.formulator.execution.CodeExecutor;
import com.jreinhal.formulator.execution.PythonCodeExecutor;
import com.jreinhal.formulator.llm.OllamaLanguageModel;
import com.jreinhal.formulator.llm.RetryExecutor;
import java.net.http.HttpClient;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the collaborators the search core talks to: the Ollama-backed language
 * model, the Python executor and the numeric answer checker.
 */
@Configuration
public class FormulatorConfig {

    private static final Logger log = LoggerFactory.getLogger(FormulatorConfig.class);

    @Bean
    public RetryExecutor llmRetryExecutor(FormulatorProperties properties) {
        FormulatorProperties.Llm llm = properties.getLlm();
        return new RetryExecutor(llm.getMaxAttempts(),
                Duration.ofMillis(llm.getInitialBackoffMs()),
                Duration.ofMillis(llm.getMaxBackoffMs()));
    }

    @Bean
    public HttpClient ollamaHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Bean
    public OllamaLanguageModel ollamaLanguageModel(
            ChatClient.Builder chatClientBuilder,
            ObjectMapper objectMapper,
            HttpClient ollamaHttpClient,
            RetryExecutor llmRetryExecutor,
            FormulatorProperties properties,
            @Value("${spring.ai.ollama.base-url:http://localhost:11434}") String baseUrl,
            @Value("${spring.ai.ollama.chat.options.model:mistral}") String model) {
        return new OllamaLanguageModel(chatClientBuilder, objectMapper, ollamaHttpClient, llmRetryExecutor,
                baseUrl, model, Duration.ofSeconds(properties.getLlm().getRequestTimeoutSeconds()));
    }

    @Bean
    public CodeExecutor codeExecutor(FormulatorProperties properties) {
        FormulatorProperties.Execution execution = properties.getExecution();
        log.info("Code executor: command={}, timeout={}s", execution.getCommand(), execution.getTimeoutSeconds());
        return new PythonCodeExecutor(execution.getCommand(), Duration.ofSeconds(execution.getTimeoutSeconds()));
    }

    @Bean
    public AnswerEvaluator answerEvaluator() {
        return new NumericAnswerEvaluator();
    }
}
