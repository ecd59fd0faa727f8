package com.jreinhal.formulator.evaluation;

import java.util.List;

/**
 * Sampled quality scores for one simulated formulation.
 *
 * @param scores            raw samples, each in [0, 100]
 * @param meanScore         mean of the samples scaled to [0, 1]
 * @param globalUncertainty disagreement between samples, in [0, 1]
 */
public record ObjectiveScores(List<Integer> scores, double meanScore, double globalUncertainty) {

    public ObjectiveScores {
        scores = List.copyOf(scores);
    }
}
