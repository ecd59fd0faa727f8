package com.jreinhal.formulator.service;

import com.jreinhal.formulator.mcts.SearchReport;

/**
 * A finished search with its answer checked against the caller's expectation.
 *
 * @param report          the search report
 * @param predictedAnswer last number printed by the best program, null when it printed none
 * @param correct         whether the prediction matches the expected answer, null when none was given
 */
public record SearchOutcome(SearchReport report, Double predictedAnswer, Boolean correct) {
}
