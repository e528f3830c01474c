package com.phillippitts.classmate.exception;

/**
 * Thrown when an on-demand analysis has no input, e.g. a summary request with no new
 * transcript since the previous window.
 */
public class NothingToAnalyzeException extends ClassmateException {

    private final String analyzer;

    public NothingToAnalyzeException(String message, String analyzer) {
        super(message);
        this.analyzer = analyzer;
    }

    public String getAnalyzer() {
        return analyzer;
    }
}
