package com.jreinhal.formulator.llm;

import java.io.IOException;
import java.time.Duration;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Bounded exponential backoff for language model calls.
 *
 * Transient failures are retried with a delay that starts at {@code initialDelay}
 * and doubles up to {@code maxDelay}. Anything else fails fast. When the last
 * attempt fails the error is rethrown as {@link LlmInvocationException}.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private static final int MAX_CAUSE_DEPTH = 8;
    private static final int TOO_MANY_REQUESTS = 429;
    // Spring AI's default error handler reports every 4xx as "<status> - <body>"
    private static final Pattern RATE_LIMITED_MESSAGE = Pattern.compile("^\\s*429\\b");

    @FunctionalInterface
    public interface RetryableCall<T> {
        T call() throws Exception;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final Sleeper sleeper;

    public RetryExecutor(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        this(maxAttempts, initialDelay, maxDelay, Thread::sleep);
    }

    public RetryExecutor(int maxAttempts, Duration initialDelay, Duration maxDelay, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialDelay = initialDelay == null ? Duration.ofMillis(500) : initialDelay;
        this.maxDelay = maxDelay == null ? Duration.ofSeconds(30) : maxDelay;
        this.sleeper = sleeper;
    }

    public <T> T execute(String operation, RetryableCall<T> call) {
        long delayMs = this.initialDelay.toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                return call.call();
            } catch (Exception e) {
                if (!isTransient(e)) {
                    throw asRuntime(operation, e);
                }
                if (attempt >= this.maxAttempts) {
                    log.error("{} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    throw new LlmInvocationException(operation + " failed after " + attempt + " attempts", e, true);
                }
                log.warn("{} attempt {}/{} failed ({}), retrying in {}ms",
                        operation, attempt, this.maxAttempts, e.getMessage(), delayMs);
                pause(operation, delayMs, e);
                delayMs = Math.min(delayMs * 2, this.maxDelay.toMillis());
            }
        }
    }

    public int getMaxAttempts() {
        return this.maxAttempts;
    }

    /**
     * Rate limits, timeouts and connection problems, looked up along the cause chain.
     * A 429 counts as a rate limit even when the chat client reports it as non-transient.
     */
    static boolean isTransient(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof LlmInvocationException llmError) {
                return llmError.isRetryable();
            }
            if (current instanceof TransientAiException
                    || current instanceof ResourceAccessException
                    || current instanceof IOException) {
                return true;
            }
            if (current instanceof NonTransientAiException && isRateLimitMessage(current.getMessage())) {
                return true;
            }
            if (current instanceof RestClientResponseException response
                    && response.getStatusCode().value() == TOO_MANY_REQUESTS) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean isRateLimitMessage(String message) {
        return message != null && RATE_LIMITED_MESSAGE.matcher(message).find();
    }

    private void pause(String operation, long delayMs, Exception lastError) {
        try {
            this.sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LlmInvocationException interrupted =
                    new LlmInvocationException(operation + " interrupted while backing off", e, false);
            interrupted.addSuppressed(lastError);
            throw interrupted;
        }
    }

    private static RuntimeException asRuntime(String operation, Exception e) {
        if (e instanceof RuntimeException runtime) {
            return runtime;
        }
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        return new LlmInvocationException(operation + " failed: " + e.getMessage(), e, false);
    }
}
