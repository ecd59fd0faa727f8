package com.jreinhal.formulator.service;

import com.jreinhal.formulator.config.FormulatorProperties;
import com.jreinhal.formulator.evaluation.AnswerEvaluator;
import com.jreinhal.formulator.execution.CodeExecutor;
import com.jreinhal.formulator.execution.ExecutionResult;
import com.jreinhal.formulator.llm.StructuredGenerator;
import com.jreinhal.formulator.llm.TextGenerator;
import com.jreinhal.formulator.mcts.FormulationMcts;
import com.jreinhal.formulator.mcts.MctsSettings;
import com.jreinhal.formulator.mcts.SearchReport;
import com.jreinhal.formulator.util.LogSanitizer;
import java.util.OptionalDouble;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one formulation search per request.
 *
 * Every call gets its own {@link FormulationMcts}, so concurrent requests share
 * no tree, knowledge base or random source.
 */
@Service
public class FormulationSearchService {

    private static final Logger log = LoggerFactory.getLogger(FormulationSearchService.class);

    private final TextGenerator textGenerator;
    private final StructuredGenerator structuredGenerator;
    private final CodeExecutor codeExecutor;
    private final AnswerEvaluator answerEvaluator;
    private final FormulatorProperties properties;

    public FormulationSearchService(TextGenerator textGenerator, StructuredGenerator structuredGenerator,
                                    CodeExecutor codeExecutor, AnswerEvaluator answerEvaluator,
                                    FormulatorProperties properties) {
        this.textGenerator = textGenerator;
        this.structuredGenerator = structuredGenerator;
        this.codeExecutor = codeExecutor;
        this.answerEvaluator = answerEvaluator;
        this.properties = properties;
    }

    public SearchOutcome search(String problem, Double expectedAnswer) {
        if (problem == null || problem.isBlank()) {
            throw new IllegalArgumentException("Problem statement is required");
        }
        int maxLength = properties.getApi().getMaxProblemLength();
        if (problem.length() > maxLength) {
            throw new IllegalArgumentException("Problem statement exceeds maximum length of " + maxLength);
        }
        if (expectedAnswer != null && !Double.isFinite(expectedAnswer)) {
            throw new IllegalArgumentException("Expected answer must be a finite number");
        }

        MctsSettings settings = properties.toSettings();
        log.info("Formulation search started: problem={}, iterations={}, expected={}",
                LogSanitizer.problemSummary(problem), settings.iterations(), expectedAnswer != null);
        long start = System.currentTimeMillis();

        FormulationMcts mcts = new FormulationMcts(settings, textGenerator, structuredGenerator, codeExecutor,
                answerEvaluator, newRandom());
        SearchReport report = mcts.searchWithReport(problem, expectedAnswer);

        ExecutionResult result = report.result();
        OptionalDouble predicted = answerEvaluator.isValid(result)
                ? answerEvaluator.extractAnswer(result.stdout())
                : OptionalDouble.empty();
        Boolean correct = expectedAnswer == null ? null : answerEvaluator.matches(predicted, expectedAnswer);

        log.info("Formulation search finished: problem={}, success={}, foundCorrect={}, iterations={}, nodes={}, {}ms",
                LogSanitizer.problemSummary(problem), result.success(), report.foundCorrect(),
                report.iterations().size(), report.treeSize(), System.currentTimeMillis() - start);
        return new SearchOutcome(report, predicted.isPresent() ? predicted.getAsDouble() : null, correct);
    }

    private Random newRandom() {
        Long seed = properties.getMcts().getSeed();
        return seed == null ? new Random() : new Random(seed);
    }
}
