package com.jreinhal.formulator.codegen;

import com.jreinhal.formulator.evaluation.AnswerEvaluator;
import com.jreinhal.formulator.execution.CodeExecutor;
import com.jreinhal.formulator.execution.ExecutionResult;
import com.jreinhal.formulator.llm.TextGenerator;
import com.jreinhal.formulator.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a formulation into a solver program and repairs it until it prints an answer.
 *
 * The program is generated once, then fed back with its error for at most
 * {@code maxRepairAttempts} fixes. The last execution result is returned whether
 * or not it is valid.
 */
public class CodeRepairLoop {

    private static final Logger log = LoggerFactory.getLogger(CodeRepairLoop.class);

    static final int ERROR_LIMIT = 500;
    static final int CODE_LIMIT = 1500;

    private static final String CODE_PROMPT = """
            Based on the problem and mathematical formulation below, write Python code to solve it.

            Original problem:
            {problem}

            Mathematical formulation:
            {formulation}

            Requirements:
            - Use scipy.optimize or PuLP (for integer programs)
            - Output ONLY executable Python code, no markdown, no explanation
            - Print the optimal objective value as the LAST line of output
            - If infeasible or unbounded, print 0""";

    private static final String FIX_CODE_PROMPT = """
            The following Python code failed. Please fix it.

            Error:
            {error}

            Original code:
            {code}

            Requirements:
            - Output ONLY executable Python code, no markdown, no explanation
            - Print the optimal objective value as the LAST line of output
            - If infeasible or unbounded, print 0""";

    private final TextGenerator textGenerator;
    private final CodeExecutor executor;
    private final AnswerEvaluator answerEvaluator;
    private final int maxRepairAttempts;
    private final double temperature;

    public CodeRepairLoop(TextGenerator textGenerator, CodeExecutor executor, AnswerEvaluator answerEvaluator,
                          int maxRepairAttempts, double temperature) {
        if (maxRepairAttempts < 0) {
            throw new IllegalArgumentException("maxRepairAttempts must be >= 0");
        }
        this.textGenerator = textGenerator;
        this.executor = executor;
        this.answerEvaluator = answerEvaluator;
        this.maxRepairAttempts = maxRepairAttempts;
        this.temperature = temperature;
    }

    public ExecutionResult generateAndExecute(String problem, String formulation) {
        String code = textGenerator.generate(CODE_PROMPT
                .replace("{problem}", problem)
                .replace("{formulation}", formulation), temperature);
        ExecutionResult result = executor.execute(code);

        int repairs = 0;
        while (repairs < maxRepairAttempts && !answerEvaluator.isValid(result)) {
            repairs++;
            log.debug("Repair attempt {}/{}: {}", repairs, maxRepairAttempts,
                    LogSanitizer.sanitize(LogSanitizer.truncate(result.stderr(), 120)));
            code = textGenerator.generate(FIX_CODE_PROMPT
                    .replace("{error}", LogSanitizer.truncate(result.stderr(), ERROR_LIMIT))
                    .replace("{code}", LogSanitizer.truncate(code, CODE_LIMIT)), temperature);
            result = executor.execute(code);
        }
        if (repairs > 0) {
            log.debug("Code repair finished after {} attempt(s), valid={}", repairs, answerEvaluator.isValid(result));
        }
        return result;
    }

    public int getMaxRepairAttempts() {
        return maxRepairAttempts;
    }
}
