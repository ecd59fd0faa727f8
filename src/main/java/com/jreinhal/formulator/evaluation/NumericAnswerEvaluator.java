package com.jreinhal.formulator.evaluation;

import com.jreinhal.formulator.execution.ExecutionResult;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks printed numeric answers against an expected value.
 *
 * <p>The answer is the last number in the program output. Integers keep their sign
 * just like decimals do, so a program printing {@code -17} answers {@code -17}
 * rather than {@code 17}; negative optima only match a negative expected value.
 */
public class NumericAnswerEvaluator implements AnswerEvaluator {

    private static final Pattern ANY_NUMBER = Pattern.compile("-?\\d*\\.?\\d+");
    private static final Pattern ANSWER_NUMBER = Pattern.compile("[-+]?\\d*\\.\\d+|[-+]?\\d+");

    static final double RELATIVE_TOLERANCE = 0.10;
    static final double ABSOLUTE_TOLERANCE = 1e-4;
    static final double ZERO_THRESHOLD = 1e-8;

    @Override
    public boolean isValid(ExecutionResult result) {
        if (result == null || !result.success()) {
            return false;
        }
        return ANY_NUMBER.matcher(result.stdout()).find();
    }

    @Override
    public OptionalDouble extractAnswer(String stdout) {
        if (stdout == null || stdout.isEmpty()) {
            return OptionalDouble.empty();
        }
        Matcher matcher = ANSWER_NUMBER.matcher(stdout);
        String last = null;
        while (matcher.find()) {
            last = matcher.group();
        }
        if (last == null) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(last));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    @Override
    public boolean matches(OptionalDouble predicted, double actual) {
        if (predicted == null || predicted.isEmpty()) {
            return false;
        }
        double value = predicted.getAsDouble();
        if (Math.abs(actual) > ZERO_THRESHOLD) {
            return Math.abs(value - actual) / Math.abs(actual) < RELATIVE_TOLERANCE;
        }
        return Math.abs(value - actual) < ABSOLUTE_TOLERANCE;
    }
}
