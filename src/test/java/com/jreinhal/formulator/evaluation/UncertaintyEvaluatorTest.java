package com.jreinhal.formulator.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jreinhal.formulator.execution.ExecutionResult;
import com.jreinhal.formulator.llm.StructuredGenerator;
import com.jreinhal.formulator.llm.StructuredResponse;
import com.jreinhal.formulator.mcts.FormulationElement;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class UncertaintyEvaluatorTest {

    private static final ExecutionResult OK = new ExecutionResult(true, "42", "");

    private final ObjectMapper mapper = new ObjectMapper();
    private StructuredGenerator generator;
    private UncertaintyEvaluator evaluator;

    @BeforeEach
    void setUp() {
        generator = mock(StructuredGenerator.class);
        evaluator = new UncertaintyEvaluator(generator, 3, 0.5, 0.2);
    }

    private ObjectNode score(Object value) throws Exception {
        return (ObjectNode) mapper.readTree("{\"score\": " + value + "}");
    }

    @Nested
    @DisplayName("scoreObjective()")
    class ScoreObjectiveTest {

        @Test
        @DisplayName("Should average K samples and report zero spread for equal scores")
        void shouldAverageSamples() throws Exception {
            when(generator.generateStructured(anyString(), anyDouble())).thenReturn(score(80));

            ObjectiveScores scores = evaluator.scoreObjective("p", "f", OK);

            assertThat(scores.scores()).containsExactly(80, 80, 80);
            assertThat(scores.meanScore()).isCloseTo(0.8, within(1e-12));
            assertThat(scores.globalUncertainty()).isZero();
            verify(generator, times(3)).generateStructured(anyString(), eq(0.5));
        }

        @Test
        @DisplayName("Should clamp, truncate and default malformed scores")
        void shouldSanitiseScores() throws Exception {
            when(generator.generateStructured(anyString(), anyDouble()))
                    .thenReturn(score(150), score(-5), score("\"high\""));

            assertThat(evaluator.scoreObjective("p", "f", OK).scores()).containsExactly(100, 0, 0);

            when(generator.generateStructured(anyString(), anyDouble()))
                    .thenReturn(score(72.9), score("\"64\""), mapper.createObjectNode());

            assertThat(evaluator.scoreObjective("p", "f", OK).scores()).containsExactly(72, 64, 0);
        }

        @Test
        @DisplayName("Should pass at most 300 characters of output to the judge")
        void shouldTruncateOutput() throws Exception {
            when(generator.generateStructured(anyString(), anyDouble())).thenReturn(score(50));
            String longOutput = "1".repeat(299) + "XY";

            evaluator.scoreObjective("p", "f", new ExecutionResult(true, longOutput, ""));

            verify(generator, times(3)).generateStructured(contains("1".repeat(299) + "X\n"), anyDouble());
        }
    }

    @Nested
    @DisplayName("reasoningSignals()")
    class ReasoningSignalsTest {

        @Test
        @DisplayName("Should read every element and share one local uncertainty")
        void shouldParseSignals() throws Exception {
            ObjectNode body = (ObjectNode) mapper.readTree("""
                    {"type": {"trigger": true, "explanation": "too loose", "guidance": "use integers"},
                     "objective": {"trigger": false, "explanation": "fine", "guidance": ""}}
                    """);
            when(generator.generateStructuredWithLogprobs(anyString(), anyDouble()))
                    .thenReturn(new StructuredResponse(body, List.of(-1.0, -2.0, -3.0)));

            Map<FormulationElement, LayerSignal> signals = evaluator.reasoningSignals("p", "f", OK);

            assertThat(signals).hasSize(6);
            LayerSignal type = signals.get(FormulationElement.TYPE);
            assertThat(type.trigger()).isTrue();
            assertThat(type.guidance()).isEqualTo("use integers");
            assertThat(type.localUncertainty()).isCloseTo(0.4, within(1e-12));
            assertThat(signals.get(FormulationElement.OBJECTIVE).hasGuidance()).isFalse();
            assertThat(signals.get(FormulationElement.SETS)).isEqualTo(LayerSignal.neutral(0.4));
            verify(generator).generateStructuredWithLogprobs(contains("success=true, output=42, error="), eq(0.2));
        }

        @Test
        @DisplayName("Should fall back to neutral signals for malformed layers")
        void shouldDefaultMalformedLayers() throws Exception {
            ObjectNode body = (ObjectNode) mapper.readTree("{\"type\": \"bad\", \"sets\": [1]}");
            when(generator.generateStructuredWithLogprobs(anyString(), anyDouble()))
                    .thenReturn(new StructuredResponse(body, List.of()));

            Map<FormulationElement, LayerSignal> signals = evaluator.reasoningSignals("p", "f", OK);

            assertThat(signals.values()).allMatch(s -> s.equals(LayerSignal.neutral(0.0)));
        }
    }

    @Nested
    @DisplayName("uncertainty measures")
    class UncertaintyTest {

        @Test
        @DisplayName("Global uncertainty should be 1.0 for scores 0 and 100")
        void shouldMaxOutForOpposedScores() {
            assertThat(UncertaintyEvaluator.globalUncertainty(List.of(0, 100))).isCloseTo(1.0, within(1e-12));
        }

        @Test
        @DisplayName("Global uncertainty should be zero below two samples")
        void shouldBeZeroForSingleSample() {
            assertThat(UncertaintyEvaluator.globalUncertainty(List.of(37))).isZero();
            assertThat(UncertaintyEvaluator.globalUncertainty(List.of())).isZero();
        }

        @Test
        @DisplayName("Global uncertainty should use the population standard deviation")
        void shouldUsePopulationStd() {
            // std of {40, 60} is 10
            assertThat(UncertaintyEvaluator.globalUncertainty(List.of(40, 60))).isCloseTo(0.2, within(1e-12));
        }

        @Test
        @DisplayName("Local uncertainty should scale mean negative logprob by 5 and cap at 1")
        void shouldComputeLocalUncertainty() {
            assertThat(UncertaintyEvaluator.localUncertainty(List.of(-0.5, -1.5))).isCloseTo(0.2, within(1e-12));
            assertThat(UncertaintyEvaluator.localUncertainty(List.of(-9.0, -12.0))).isEqualTo(1.0);
            assertThat(UncertaintyEvaluator.localUncertainty(List.of())).isZero();
        }
    }
}
