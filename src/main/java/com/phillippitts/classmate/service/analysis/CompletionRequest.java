package com.phillippitts.classmate.service.analysis;

import java.util.Objects;

/**
 * One prompt for the language model.
 *
 * @param kind         analyzer issuing the request
 * @param systemPrompt system message (may be empty)
 * @param prompt       user message carrying the transcript context
 * @param temperature  sampling temperature
 * @param maxTokens    output token cap
 */
public record CompletionRequest(
        AnalyzerKind kind,
        String systemPrompt,
        String prompt,
        double temperature,
        int maxTokens
) {

    public CompletionRequest {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(prompt, "prompt must not be null");
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
    }

    public static CompletionRequest of(AnalyzerKind kind, String systemPrompt, String prompt) {
        return new CompletionRequest(kind, systemPrompt, prompt, kind.temperature(), kind.maxTokens());
    }
}
