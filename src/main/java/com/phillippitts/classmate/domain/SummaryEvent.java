package com.phillippitts.classmate.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Self-contained summary of the transcript window {@code [windowStartMs, windowEndMs)}.
 * Consecutive summaries of a session stitch exactly: each window starts where the
 * previous one ended.
 *
 * @param windowStartMs inclusive window start on the transcript timeline
 * @param windowEndMs   exclusive window end on the transcript timeline
 * @param title         short topic line (may be empty)
 * @param text          summary paragraph; empty for windows without speech
 * @param keyPoints     key points of the window
 * @param concepts      important concepts mentioned
 * @param segmentCount  number of final segments summarized in this window
 * @param generatedAt   generation timestamp
 * @param fallback      true when the model could not produce a summary
 */
public record SummaryEvent(
        long windowStartMs,
        long windowEndMs,
        String title,
        String text,
        List<String> keyPoints,
        List<String> concepts,
        int segmentCount,
        Instant generatedAt,
        boolean fallback
) {

    /** Placeholder text used when the window could not be summarized. */
    public static final String UNAVAILABLE = "Summary unavailable";

    public SummaryEvent {
        if (windowEndMs < windowStartMs) {
            throw new IllegalArgumentException(
                    "windowEndMs " + windowEndMs + " is before windowStartMs " + windowStartMs);
        }
        title = title == null ? "" : title;
        Objects.requireNonNull(text, "text must not be null");
        keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
        concepts = concepts == null ? List.of() : List.copyOf(concepts);
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
    }

    public long durationMs() {
        return windowEndMs - windowStartMs;
    }
}
