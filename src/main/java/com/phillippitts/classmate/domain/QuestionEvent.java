package com.phillippitts.classmate.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A question detected in the lecture transcript. Never mutated after creation.
 *
 * @param id                unique identifier used to match answers
 * @param segmentId         the final segment the question is attributed to
 * @param questionText      the question as phrased by the lecturer
 * @param detectedAt        detection timestamp
 * @param confidence        detector confidence between 0.0 and 1.0
 * @param kind              question classification
 * @param coveredSegmentIds ids of the segments that formed the detection window
 */
public record QuestionEvent(
        String id,
        String segmentId,
        String questionText,
        Instant detectedAt,
        double confidence,
        QuestionKind kind,
        List<String> coveredSegmentIds
) {

    public QuestionEvent {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(segmentId, "segmentId must not be null");
        Objects.requireNonNull(questionText, "questionText must not be null");
        Objects.requireNonNull(detectedAt, "detectedAt must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        coveredSegmentIds = coveredSegmentIds == null ? List.of() : List.copyOf(coveredSegmentIds);
    }
}
