package com.jreinhal.formulator.mcts;

/**
 * Tuning knobs for one formulation search.
 *
 * @param iterations              maximum select/expand/simulate/backpropagate rounds
 * @param explorationConstant     C in UCB1
 * @param uncertaintyThreshold    eta: local uncertainty above which a flagged node is re-expanded
 * @param scoreSamples            K: objective score samples per simulation
 * @param maxChildren             children allowed per node
 * @param candidatesPerExpansion  candidate texts requested per expansion
 * @param similarityThreshold     candidates more similar than this are duplicates
 * @param maxRepairAttempts       code repair rounds after the first generation
 * @param elementTemperature      sampling temperature for formulation elements
 * @param codeTemperature         sampling temperature for code generation and repair
 * @param scoringTemperature      sampling temperature for objective scoring
 * @param signalsTemperature      sampling temperature for reasoning signals
 */
public record MctsSettings(
        int iterations,
        double explorationConstant,
        double uncertaintyThreshold,
        int scoreSamples,
        int maxChildren,
        int candidatesPerExpansion,
        double similarityThreshold,
        int maxRepairAttempts,
        double elementTemperature,
        double codeTemperature,
        double scoringTemperature,
        double signalsTemperature) {

    public MctsSettings {
        if (iterations < 0) {
            throw new IllegalArgumentException("iterations must be >= 0");
        }
        if (scoreSamples < 1) {
            throw new IllegalArgumentException("scoreSamples must be >= 1");
        }
        if (maxChildren < 1) {
            throw new IllegalArgumentException("maxChildren must be >= 1");
        }
        if (candidatesPerExpansion < 1) {
            throw new IllegalArgumentException("candidatesPerExpansion must be >= 1");
        }
        if (maxRepairAttempts < 0) {
            throw new IllegalArgumentException("maxRepairAttempts must be >= 0");
        }
    }

    public static MctsSettings defaults() {
        return new MctsSettings(20, 2.0, 0.3, 3, 5, 3, 0.8, 12, 0.7, 0.0, 0.5, 0.2);
    }

    public MctsSettings withIterations(int value) {
        return new MctsSettings(value, explorationConstant, uncertaintyThreshold, scoreSamples, maxChildren,
                candidatesPerExpansion, similarityThreshold, maxRepairAttempts, elementTemperature,
                codeTemperature, scoringTemperature, signalsTemperature);
    }

    public MctsSettings withScoreSamples(int value) {
        return new MctsSettings(iterations, explorationConstant, uncertaintyThreshold, value, maxChildren,
                candidatesPerExpansion, similarityThreshold, maxRepairAttempts, elementTemperature,
                codeTemperature, scoringTemperature, signalsTemperature);
    }
}
