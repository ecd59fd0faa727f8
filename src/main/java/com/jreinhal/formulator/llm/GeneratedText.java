package com.jreinhal.formulator.llm;

import java.util.List;

public record GeneratedText(String text, List<Double> logprobs) {

    public GeneratedText {
        text = text == null ? "" : text;
        logprobs = logprobs == null ? List.of() : List.copyOf(logprobs);
    }
}
