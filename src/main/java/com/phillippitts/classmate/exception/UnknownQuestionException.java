package com.phillippitts.classmate.exception;

/**
 * Thrown when an answer is requested for a question id the running session never detected.
 */
public class UnknownQuestionException extends ClassmateException {

    private final String questionId;

    public UnknownQuestionException(String questionId) {
        super("No detected question with id " + questionId);
        this.questionId = questionId;
    }

    public String getQuestionId() {
        return questionId;
    }
}
