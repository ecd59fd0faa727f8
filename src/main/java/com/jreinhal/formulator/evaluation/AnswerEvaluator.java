package com.jreinhal.formulator.evaluation;

import com.jreinhal.formulator.execution.ExecutionResult;
import java.util.OptionalDouble;

/**
 * Extracts a numeric answer from program output and compares it to ground truth.
 */
public interface AnswerEvaluator {

    /**
     * A result is usable when the program succeeded and printed at least one number.
     */
    boolean isValid(ExecutionResult result);

    /**
     * The last number printed, if any.
     */
    OptionalDouble extractAnswer(String stdout);

    /**
     * Whether {@code predicted} is close enough to {@code actual}. An empty prediction never matches.
     */
    boolean matches(OptionalDouble predicted, double actual);
}
