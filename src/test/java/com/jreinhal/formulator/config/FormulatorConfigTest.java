package com.jreinhal.formulator.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.formulator.evaluation.NumericAnswerEvaluator;
import com.jreinhal.formulator.execution.CodeExecutor;
import com.jreinhal.formulator.execution.PythonCodeExecutor;
import com.jreinhal.formulator.llm.RetryExecutor;
import org.junit.jupiter.api.Test;

class FormulatorConfigTest {

    private final FormulatorConfig config = new FormulatorConfig();

    @Test
    void shouldBuildRetryExecutorFromProperties() {
        FormulatorProperties properties = new FormulatorProperties();
        properties.getLlm().setMaxAttempts(5);

        RetryExecutor retry = config.llmRetryExecutor(properties);

        assertThat(retry.getMaxAttempts()).isEqualTo(5);
    }

    @Test
    void shouldBuildProcessExecutor() {
        CodeExecutor executor = config.codeExecutor(new FormulatorProperties());

        assertThat(executor).isInstanceOf(PythonCodeExecutor.class);
    }

    @Test
    void shouldUseNumericAnswerEvaluator() {
        assertThat(config.answerEvaluator()).isInstanceOf(NumericAnswerEvaluator.class);
    }
}
