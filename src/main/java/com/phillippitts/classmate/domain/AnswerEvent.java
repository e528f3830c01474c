package com.phillippitts.classmate.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Candidate answer for a {@link QuestionEvent}, matched by {@code questionEventId}.
 *
 * <p>A later answer with a higher {@code revision} supersedes the earlier one for the same
 * question; it never appends to it.
 *
 * @param questionEventId id of the answered question
 * @param answerText      answer text, or a placeholder when {@code fallback} is set
 * @param generatedAt     generation timestamp
 * @param modelLatencyMs  wall time spent in model calls, including retries
 * @param revision        1 for the first answer, incremented on each regeneration
 * @param fallback        true when the model could not produce an answer
 */
public record AnswerEvent(
        String questionEventId,
        String answerText,
        Instant generatedAt,
        long modelLatencyMs,
        int revision,
        boolean fallback
) {

    /** Placeholder text used when no answer could be generated. */
    public static final String UNAVAILABLE = "Answer unavailable";

    public AnswerEvent {
        Objects.requireNonNull(questionEventId, "questionEventId must not be null");
        Objects.requireNonNull(answerText, "answerText must not be null");
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        if (revision < 1) {
            throw new IllegalArgumentException("revision must be >= 1, got: " + revision);
        }
    }

    public static AnswerEvent unavailable(String questionEventId, long latencyMs, int revision) {
        return new AnswerEvent(questionEventId, UNAVAILABLE, Instant.now(), latencyMs, revision, true);
    }
}
