package com.jreinhal.formulator.execution;

/**
 * Runs a generated program in isolation.
 *
 * Implementations must enforce a wall-clock timeout, kill the program when it
 * expires and report a failed result instead of throwing.
 */
public interface CodeExecutor {

    ExecutionResult execute(String source);
}
