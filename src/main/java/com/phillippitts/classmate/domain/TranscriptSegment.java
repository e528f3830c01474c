package com.phillippitts.classmate.domain;

import java.util.Objects;

/**
 * One unit of transcribed speech with a time range on the session's transcript timeline.
 *
 * <p>Partial segments ({@code isFinal == false}) may be superseded by a later segment that
 * carries the same {@code id}; consumers replace, never merge. Final segments are immutable
 * once emitted.
 *
 * @param id        backend-assigned segment identifier, stable across partial updates
 * @param startMs   start offset in milliseconds from the beginning of the transcription stream
 * @param endMs     end offset in milliseconds (never before {@code startMs})
 * @param text      transcribed text (may be empty)
 * @param isFinal   whether this is the final version of the segment
 * @param language  language tag reported by the backend (may be empty)
 * @param speakerId speaker label from diarization (may be empty)
 */
public record TranscriptSegment(
        String id,
        long startMs,
        long endMs,
        String text,
        boolean isFinal,
        String language,
        String speakerId
) {

    public TranscriptSegment {
        Objects.requireNonNull(id, "Segment id must not be null");
        Objects.requireNonNull(text, "Segment text must not be null");
        if (startMs < 0) {
            throw new IllegalArgumentException("startMs must be >= 0, got: " + startMs);
        }
        if (endMs < startMs) {
            throw new IllegalArgumentException("endMs " + endMs + " is before startMs " + startMs);
        }
        language = language == null ? "" : language;
        speakerId = speakerId == null ? "" : speakerId;
    }

    public static TranscriptSegment finalSegment(String id, long startMs, long endMs, String text) {
        return new TranscriptSegment(id, startMs, endMs, text, true, "", "");
    }

    public static TranscriptSegment partialSegment(String id, long startMs, long endMs, String text) {
        return new TranscriptSegment(id, startMs, endMs, text, false, "", "");
    }
}
