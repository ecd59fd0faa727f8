package com.jreinhal.formulator.evaluation;

import com.fasterxml.jackson.databind.JsonNode;
import com.jreinhal.formulator.execution.ExecutionResult;
import com.jreinhal.formulator.llm.StructuredGenerator;
import com.jreinhal.formulator.llm.StructuredResponse;
import com.jreinhal.formulator.mcts.FormulationElement;
import com.jreinhal.formulator.util.LogSanitizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * LLM-as-judge for simulated formulations.
 *
 * <ul>
 *   <li>Objective scoring samples {@code K} scores in [0, 100]; their spread is the
 *       global uncertainty.</li>
 *   <li>Reasoning signals judge all six elements in one call; the mean negative token
 *       log-probability of that call is the local uncertainty, shared by every element.</li>
 * </ul>
 */
public class UncertaintyEvaluator {

    private static final Logger log = LoggerFactory.getLogger(UncertaintyEvaluator.class);

    static final int SCORE_OUTPUT_LIMIT = 300;
    static final int SIGNAL_OUTPUT_LIMIT = 200;
    static final int MAX_SCORE = 100;
    static final double SCORE_SPREAD_NORMALIZER = 50.0;
    static final double LOGPROB_NORMALIZER = 5.0;

    private static final String SCORE_PROMPT = """
            You are evaluating an optimization problem solution.

            Problem:
            {problem}

            Mathematical formulation:
            {formulation}

            Execution output:
            {output}

            Score the overall solution quality from 0 to 100:
            - 0-25:   Poor  (crashes, infeasible, or completely wrong answer)
            - 26-50:  Fair  (runs but answer is significantly wrong)
            - 51-75:  Good  (reasonable formulation, answer is close)
            - 76-100: Excellent (correct formulation, correct answer)

            Return JSON: {"score": <integer 0-100>}""";

    private static final String SIGNALS_PROMPT = """
            You are reviewing a mathematical optimization formulation.

            Problem:
            {problem}

            Complete formulation:
            {formulation}

            Execution result: success={success}, output={output}, error={error}

            For EACH of the 6 formulation elements, evaluate its quality.
            Return a JSON object with keys: "type", "sets", "parameters", "variables", "objective", "constraints".
            Each value must have:
              "trigger":     true if this element has issues needing revision, else false
              "explanation": one sentence on quality
              "guidance":    specific improvement advice if trigger=true, else ""

            JSON:""";

    private final StructuredGenerator generator;
    private final int samples;
    private final double scoringTemperature;
    private final double signalsTemperature;

    public UncertaintyEvaluator(StructuredGenerator generator, int samples, double scoringTemperature,
                                double signalsTemperature) {
        if (samples < 1) {
            throw new IllegalArgumentException("At least one score sample is required");
        }
        this.generator = generator;
        this.samples = samples;
        this.scoringTemperature = scoringTemperature;
        this.signalsTemperature = signalsTemperature;
    }

    public ObjectiveScores scoreObjective(String problem, String formulation, ExecutionResult result) {
        String prompt = SCORE_PROMPT
                .replace("{problem}", problem)
                .replace("{formulation}", formulation)
                .replace("{output}", LogSanitizer.truncate(result.stdout(), SCORE_OUTPUT_LIMIT));
        List<Integer> scores = new ArrayList<>(samples);
        for (int i = 0; i < samples; i++) {
            scores.add(parseScore(generator.generateStructured(prompt, scoringTemperature)));
        }
        double mean = scores.stream().mapToInt(Integer::intValue).average().orElse(0.0) / MAX_SCORE;
        return new ObjectiveScores(scores, mean, globalUncertainty(scores));
    }

    public Map<FormulationElement, LayerSignal> reasoningSignals(String problem, String formulation,
                                                                 ExecutionResult result) {
        String prompt = SIGNALS_PROMPT
                .replace("{problem}", problem)
                .replace("{formulation}", formulation)
                .replace("{success}", String.valueOf(result.success()))
                .replace("{output}", LogSanitizer.truncate(result.stdout(), SIGNAL_OUTPUT_LIMIT))
                .replace("{error}", LogSanitizer.truncate(result.stderr(), SIGNAL_OUTPUT_LIMIT));
        StructuredResponse response = generator.generateStructuredWithLogprobs(prompt, signalsTemperature);
        double local = localUncertainty(response.logprobs());

        Map<FormulationElement, LayerSignal> signals = new EnumMap<>(FormulationElement.class);
        JsonNode body = response.value();
        for (FormulationElement element : FormulationElement.values()) {
            JsonNode layer = body.path(element.key());
            if (!layer.isObject()) {
                signals.put(element, LayerSignal.neutral(local));
                continue;
            }
            signals.put(element, new LayerSignal(
                    layer.path("trigger").asBoolean(false),
                    text(layer.get("explanation")),
                    text(layer.get("guidance")),
                    local));
        }
        if (log.isDebugEnabled()) {
            long flagged = signals.values().stream().filter(LayerSignal::trigger).count();
            log.debug("Reasoning signals: {} of {} elements flagged, U_local={}", flagged, signals.size(), local);
        }
        return Collections.unmodifiableMap(signals);
    }

    static int parseScore(JsonNode response) {
        JsonNode score = response == null ? null : response.get("score");
        if (score == null || score.isNull()) {
            return 0;
        }
        int value;
        if (score.isNumber()) {
            double raw = score.doubleValue();
            value = (int) Math.max(0.0, Math.min(MAX_SCORE, raw));
        } else if (score.isTextual()) {
            try {
                value = Integer.parseInt(score.asText().strip());
            } catch (NumberFormatException e) {
                log.warn("Evaluator returned a non-numeric score: {}", LogSanitizer.sanitize(score.asText()));
                return 0;
            }
        } else {
            return 0;
        }
        return Math.max(0, Math.min(MAX_SCORE, value));
    }

    /**
     * Population standard deviation of the samples over 50, capped at 1. Zero for fewer than two samples.
     */
    public static double globalUncertainty(List<Integer> scores) {
        if (scores.size() < 2) {
            return 0.0;
        }
        double mean = scores.stream().mapToInt(Integer::intValue).average().orElse(0.0);
        double variance = 0.0;
        for (int score : scores) {
            variance += (score - mean) * (score - mean);
        }
        variance /= scores.size();
        return Math.min(Math.sqrt(variance) / SCORE_SPREAD_NORMALIZER, 1.0);
    }

    /**
     * Mean negative log-probability over 5 nats, capped at 1. Zero when no tokens were reported.
     */
    public static double localUncertainty(List<Double> logprobs) {
        if (logprobs == null || logprobs.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double logprob : logprobs) {
            sum += logprob;
        }
        return Math.min(-sum / logprobs.size() / LOGPROB_NORMALIZER, 1.0);
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
