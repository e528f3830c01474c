package com.phillippitts.classmate.domain;

import java.time.Instant;

/**
 * Published on {@code analysis.failed} when an analyzer gives up on a trigger.
 *
 * @param analyzer  analyzer name (question, answer, summary, suggestion, idea)
 * @param relatedId id of the artifact the failure relates to (question id, window), may be empty
 * @param message   short technical reason
 * @param at        failure timestamp
 */
public record AnalysisFailureEvent(String analyzer, String relatedId, String message, Instant at) {

    public AnalysisFailureEvent {
        relatedId = relatedId == null ? "" : relatedId;
        message = message == null ? "" : message;
        if (at == null) {
            at = Instant.now();
        }
    }
}
