package com.jreinhal.formulator.mcts;

import com.jreinhal.formulator.codegen.CodeRepairLoop;
import com.jreinhal.formulator.evaluation.AnswerEvaluator;
import com.jreinhal.formulator.evaluation.LayerSignal;
import com.jreinhal.formulator.evaluation.ObjectiveScores;
import com.jreinhal.formulator.evaluation.UncertaintyEvaluator;
import com.jreinhal.formulator.execution.CodeExecutor;
import com.jreinhal.formulator.execution.ExecutionResult;
import com.jreinhal.formulator.llm.StructuredGenerator;
import com.jreinhal.formulator.llm.TextGenerator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Monte Carlo tree search over optimization formulations.
 *
 * Each iteration selects a node by UCB1, expands it with new candidate elements,
 * simulates a full formulation from the new child (complete the remaining layers,
 * generate and repair code, score it), and backpropagates the reward.
 *
 * <p>Beyond plain MCTS:
 * <ul>
 *   <li>Selection stops early at a node whose last evaluation flagged it for revision
 *       with local uncertainty above the threshold, so it grows more children.</li>
 *   <li>Evaluator guidance is collected per element in a {@link KnowledgeBase} and
 *       injected into later generation prompts.</li>
 *   <li>Value updates are weighted by {@code exp(-globalUncertainty)}.</li>
 * </ul>
 *
 * <p>An instance is single-threaded. The knowledge base is reset at the start of
 * every {@link #search}; independent searches should use independent instances.
 */
public class FormulationMcts {

    private static final Logger log = LoggerFactory.getLogger(FormulationMcts.class);

    static final String NO_SOLUTION = "No solution found";

    private final MctsSettings settings;
    private final KnowledgeBase knowledgeBase;
    private final CandidateGenerator candidateGenerator;
    private final CodeRepairLoop codeRepairLoop;
    private final UncertaintyEvaluator uncertaintyEvaluator;
    private final AnswerEvaluator answerEvaluator;
    private final Random random;

    private FormulationNode lastTree;

    public FormulationMcts(MctsSettings settings, TextGenerator textGenerator, StructuredGenerator structuredGenerator,
                           CodeExecutor codeExecutor, AnswerEvaluator answerEvaluator, Random random) {
        this.settings = settings;
        this.random = random;
        this.answerEvaluator = answerEvaluator;
        this.knowledgeBase = new KnowledgeBase();
        this.candidateGenerator = new CandidateGenerator(textGenerator, knowledgeBase,
                new SimilarityPruner(settings.similarityThreshold()), settings, random);
        this.codeRepairLoop = new CodeRepairLoop(textGenerator, codeExecutor, answerEvaluator,
                settings.maxRepairAttempts(), settings.codeTemperature());
        this.uncertaintyEvaluator = new UncertaintyEvaluator(structuredGenerator, settings.scoreSamples(),
                settings.scoringTemperature(), settings.signalsTemperature());
    }

    /**
     * Best execution result for {@code problem}. With an expected answer the search stops
     * at the first result that matches it.
     */
    public ExecutionResult search(String problem, Double expectedAnswer) {
        return searchWithReport(problem, expectedAnswer).result();
    }

    public SearchReport searchWithReport(String problem, Double expectedAnswer) {
        knowledgeBase.clear();
        FormulationNode root = FormulationNode.root(problem);
        lastTree = root;

        ExecutionResult best = ExecutionResult.failure(NO_SOLUTION);
        boolean foundCorrect = false;
        List<SearchReport.IterationRecord> records = new ArrayList<>();

        for (int i = 1; i <= settings.iterations(); i++) {
            FormulationNode selected = select(root);

            Optional<FormulationNode> expanded = candidateGenerator.expand(selected);
            if (expanded.isEmpty()) {
                log.debug("iter={} nothing to expand at {}", i, selected.elementName());
                records.add(SearchReport.IterationRecord.skipped(i, root.subtreeSize()));
                continue;
            }
            FormulationNode child = expanded.get();

            SimulationOutcome outcome = simulate(child, expectedAnswer);
            child.setLastResult(outcome.result());

            backpropagate(child, outcome.reward(), outcome.globalUncertainty(), outcome.signals());

            int nodes = root.subtreeSize();
            records.add(new SearchReport.IterationRecord(i, false, outcome.reward(), outcome.globalUncertainty(),
                    outcome.result().success(), nodes));

            if (outcome.reward() >= 1.0 && !foundCorrect) {
                best = outcome.result();
                foundCorrect = true;
                log.info("iter={} correct answer found, stopping early (nodes={})", i, nodes);
                break;
            }
            // first success is kept; later successes only win by being proven correct
            if (outcome.result().success() && !foundCorrect && !best.success()) {
                best = outcome.result();
            }
            log.info("iter={} reward={} U_global={} nodes={}", i,
                    String.format("%.3f", outcome.reward()),
                    String.format("%.3f", outcome.globalUncertainty()), nodes);
        }

        return new SearchReport(best, foundCorrect, root.subtreeSize(), records);
    }

    /**
     * Walk down from the root. Stops at a leaf, at a randomly chosen unvisited child,
     * or at an incomplete inner node flagged for revision with high local uncertainty.
     */
    FormulationNode select(FormulationNode root) {
        FormulationNode node = root;
        while (true) {
            if (!node.isRoot() && !node.isLeaf() && !node.isComplete()
                    && node.isTrigger() && node.getLocalUncertainty() > settings.uncertaintyThreshold()) {
                return node;
            }
            if (node.isLeaf()) {
                // a visited complete leaf comes back as-is; expand() then skips the iteration
                return node;
            }
            List<FormulationNode> unvisited = new ArrayList<>();
            for (FormulationNode child : node.getChildren()) {
                if (child.getVisits() == 0) {
                    unvisited.add(child);
                }
            }
            if (!unvisited.isEmpty()) {
                return unvisited.get(random.nextInt(unvisited.size()));
            }
            FormulationNode best = null;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (FormulationNode child : node.getChildren()) {
                double score = child.ucb1(settings.explorationConstant());
                if (best == null || score > bestScore) {
                    best = child;
                    bestScore = score;
                }
            }
            node = best;
        }
    }

    SimulationOutcome simulate(FormulationNode node, Double expectedAnswer) {
        Map<FormulationElement, String> formulation = candidateGenerator.completeFormulation(node);
        String formulationText = FormulationNode.format(formulation);

        ExecutionResult result = codeRepairLoop.generateAndExecute(node.getProblem(), formulationText);

        ObjectiveScores scores = uncertaintyEvaluator.scoreObjective(node.getProblem(), formulationText, result);
        double reward = baseReward(result.success(), scores.meanScore());

        if (expectedAnswer != null && answerEvaluator.isValid(result)
                && answerEvaluator.matches(answerEvaluator.extractAnswer(result.stdout()), expectedAnswer)) {
            reward = 1.0;
        }

        Map<FormulationElement, LayerSignal> signals =
                uncertaintyEvaluator.reasoningSignals(node.getProblem(), formulationText, result);
        return new SimulationOutcome(reward, result, scores.globalUncertainty(), signals);
    }

    /**
     * Record guidance once in the knowledge base, then update every node from
     * {@code node} to the root with the confidence-weighted reward and its own
     * element's signal.
     */
    void backpropagate(FormulationNode node, double reward, double globalUncertainty,
                       Map<FormulationElement, LayerSignal> signals) {
        for (Map.Entry<FormulationElement, LayerSignal> entry : signals.entrySet()) {
            if (entry.getValue().hasGuidance()) {
                knowledgeBase.add(entry.getKey(), entry.getValue().guidance());
            }
        }

        double confidence = Math.exp(-globalUncertainty);
        for (FormulationNode current = node; current != null; current = current.getParent()) {
            current.recordVisit(reward, confidence);
            Optional<FormulationElement> element = current.element();
            if (element.isPresent() && signals.containsKey(element.get())) {
                LayerSignal signal = signals.get(element.get());
                current.applySignal(signal.trigger(), signal.localUncertainty());
            }
        }
    }

    /**
     * {@code 0.1 * feasible + 0.8 * meanScore - 0.1 * error}, clamped to [0, 1].
     */
    static double baseReward(boolean executionSucceeded, double meanScore) {
        double feasible = executionSucceeded ? 1.0 : 0.0;
        double error = executionSucceeded ? 0.0 : 1.0;
        return Math.max(0.0, Math.min(1.0, 0.1 * feasible + 0.8 * meanScore - 0.1 * error));
    }

    /**
     * Root of the tree built by the most recent search, or null before the first search.
     */
    public FormulationNode lastTree() {
        return lastTree;
    }

    KnowledgeBase knowledgeBase() {
        return knowledgeBase;
    }

    public MctsSettings getSettings() {
        return settings;
    }
}
