package com.jreinhal.formulator.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.jreinhal.formulator.config.FormulatorProperties;
import com.jreinhal.formulator.evaluation.NumericAnswerEvaluator;
import com.jreinhal.formulator.execution.CodeExecutor;
import com.jreinhal.formulator.execution.ExecutionResult;
import com.jreinhal.formulator.llm.StructuredGenerator;
import com.jreinhal.formulator.llm.StructuredResponse;
import com.jreinhal.formulator.llm.TextGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FormulationSearchServiceTest {

    private TextGenerator textGenerator;
    private StructuredGenerator structuredGenerator;
    private CodeExecutor executor;
    private FormulatorProperties properties;
    private FormulationSearchService service;

    @BeforeEach
    void setUp() {
        textGenerator = mock(TextGenerator.class);
        structuredGenerator = mock(StructuredGenerator.class);
        executor = mock(CodeExecutor.class);
        properties = new FormulatorProperties();
        properties.getMcts().setIterations(3);
        properties.getMcts().setSeed(17L);
        properties.getApi().setMaxProblemLength(200);

        when(textGenerator.generate(anyString(), anyDouble())).thenReturn("linear program");
        when(structuredGenerator.generateStructured(anyString(), anyDouble()))
                .thenReturn(JsonNodeFactory.instance.objectNode().put("score", 60));
        when(structuredGenerator.generateStructuredWithLogprobs(anyString(), anyDouble()))
                .thenReturn(new StructuredResponse(null, null));
        when(executor.execute(anyString())).thenReturn(new ExecutionResult(true, "Objective: 42\n", ""));

        service = new FormulationSearchService(textGenerator, structuredGenerator, executor,
                new NumericAnswerEvaluator(), properties);
    }

    @Nested
    @DisplayName("validation")
    class ValidationTest {

        @Test
        @DisplayName("Should reject a blank problem")
        void shouldRejectBlank() {
            assertThatThrownBy(() -> service.search("   ", null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Problem statement is required");
            verifyNoInteractions(textGenerator, executor);
        }

        @Test
        @DisplayName("Should reject a problem over the configured length")
        void shouldRejectTooLong() {
            assertThatThrownBy(() -> service.search("x".repeat(201), null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("maximum length");
        }

        @Test
        @DisplayName("Should reject a non-finite expected answer")
        void shouldRejectNaN() {
            assertThatThrownBy(() -> service.search("Maximize x", Double.NaN))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("Should check the answer when one is expected")
    void shouldReportCorrectAnswer() {
        SearchOutcome outcome = service.search("Maximize 6x subject to x <= 7", 42.0);

        assertThat(outcome.correct()).isTrue();
        assertThat(outcome.predictedAnswer()).isEqualTo(42.0);
        assertThat(outcome.report().foundCorrect()).isTrue();
        assertThat(outcome.report().iterations()).hasSize(1);
    }

    @Test
    @DisplayName("Should leave correctness unset without an expected answer")
    void shouldLeaveCorrectNull() {
        SearchOutcome outcome = service.search("Maximize 6x subject to x <= 7", null);

        assertThat(outcome.correct()).isNull();
        assertThat(outcome.predictedAnswer()).isEqualTo(42.0);
        assertThat(outcome.report().result().success()).isTrue();
        assertThat(outcome.report().iterations()).hasSize(3);
    }

    @Test
    @DisplayName("Should report a wrong answer as incorrect")
    void shouldReportWrongAnswer() {
        SearchOutcome outcome = service.search("Maximize 6x subject to x <= 7", 7.0);

        assertThat(outcome.correct()).isFalse();
        assertThat(outcome.report().foundCorrect()).isFalse();
    }

    @Test
    @DisplayName("Should build the same search for the same seed")
    void shouldBeReproducibleWithSeed() {
        SearchOutcome first = service.search("Maximize 6x subject to x <= 7", null);
        SearchOutcome second = service.search("Maximize 6x subject to x <= 7", null);

        assertThat(second.report()).isEqualTo(first.report());
    }
}
