package com.jreinhal.formulator.llm;

/**
 * A language model call failed.
 *
 * {@code retryable} marks failures worth another attempt (rate limiting,
 * server errors). Once the retry budget is spent the exception escapes the
 * search and aborts it.
 */
public class LlmInvocationException extends RuntimeException {

    private final boolean retryable;

    public LlmInvocationException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public LlmInvocationException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
