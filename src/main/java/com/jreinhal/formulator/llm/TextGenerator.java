package com.jreinhal.formulator.llm;

/**
 * Free-form completion from a language model.
 *
 * Calls block until the model answers. Transient failures are retried by the
 * implementation; an exhausted retry budget surfaces as {@link LlmInvocationException}.
 */
public interface TextGenerator {

    String generate(String prompt, double temperature);

    /**
     * Completion together with the per-token log-probabilities of the response.
     * The list is empty when the backend does not report them.
     */
    GeneratedText generateWithLogprobs(String prompt, double temperature);
}
