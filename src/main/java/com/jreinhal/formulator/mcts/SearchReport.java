package com.jreinhal.formulator.mcts;

import com.jreinhal.formulator.execution.ExecutionResult;
import java.util.List;

/**
 * Result of one search together with how it got there.
 *
 * @param result      best execution result (or the "No solution found" failure)
 * @param foundCorrect whether the result was proven against the expected answer
 * @param treeSize    nodes in the final tree, root included
 * @param iterations  one record per iteration that ran
 */
public record SearchReport(ExecutionResult result, boolean foundCorrect, int treeSize,
                           List<IterationRecord> iterations) {

    public SearchReport {
        iterations = List.copyOf(iterations);
    }

    /**
     * @param iteration          1-based index
     * @param skipped            true when there was nothing to expand
     * @param reward             reward of the simulation, 0 when skipped
     * @param globalUncertainty  score disagreement of the simulation, 0 when skipped
     * @param executionSucceeded whether the generated program ran successfully
     * @param treeSize           nodes in the tree after the iteration
     */
    public record IterationRecord(int iteration, boolean skipped, double reward, double globalUncertainty,
                                  boolean executionSucceeded, int treeSize) {

        static IterationRecord skipped(int iteration, int treeSize) {
            return new IterationRecord(iteration, true, 0.0, 0.0, false, treeSize);
        }
    }
}
