package com.jreinhal.formulator.execution;

/**
 * Outcome of running one generated program.
 *
 * A failed run is data, not an exception: timeouts and launch errors are
 * reported with {@code success=false} and a message in {@code stderr}.
 */
public record ExecutionResult(boolean success, String stdout, String stderr) {

    public ExecutionResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public static ExecutionResult failure(String error) {
        return new ExecutionResult(false, "", error);
    }
}
