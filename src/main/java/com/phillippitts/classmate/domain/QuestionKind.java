package com.phillippitts.classmate.domain;

import java.util.Locale;

/**
 * Classification of a detected lecturer question.
 */
public enum QuestionKind {
    /** The lecturer expects an answer from the audience. */
    DIRECT,
    /** Asked for effect; no answer expected. */
    RHETORICAL,
    /** Guiding or exercise-style prompt that invites thinking rather than a reply. */
    IMPLICIT;

    /**
     * Maps a model label to a kind. Guiding and exercise questions are implicit; unknown
     * labels fall back to {@link #DIRECT} so the listener still gets an answer.
     */
    public static QuestionKind fromLabel(String label) {
        if (label == null) {
            return DIRECT;
        }
        switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "rhetorical":
                return RHETORICAL;
            case "implicit":
            case "guiding":
            case "exercise":
                return IMPLICIT;
            default:
                return DIRECT;
        }
    }
}
