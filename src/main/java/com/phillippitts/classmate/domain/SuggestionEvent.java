package com.phillippitts.classmate.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A question the listener could raise in class, with the reasoning behind it.
 */
public record SuggestionEvent(
        String question,
        String rationale,
        String timing,
        String expectedImpact,
        Instant generatedAt
) {

    public SuggestionEvent {
        Objects.requireNonNull(question, "question must not be null");
        rationale = rationale == null ? "" : rationale;
        timing = timing == null ? "" : timing;
        expectedImpact = expectedImpact == null ? "" : expectedImpact;
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
    }
}
