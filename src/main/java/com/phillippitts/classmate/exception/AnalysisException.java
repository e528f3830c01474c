package com.phillippitts.classmate.exception;

/**
 * Thrown when a language-model call fails, times out, or returns an unusable response.
 */
public class AnalysisException extends ClassmateException {

    private final String analyzer;

    public AnalysisException(String message, String analyzer) {
        super(message + " (analyzer: " + analyzer + ")");
        this.analyzer = analyzer;
    }

    public AnalysisException(String message, String analyzer, Throwable cause) {
        super(message + " (analyzer: " + analyzer + ")", cause);
        this.analyzer = analyzer;
    }

    public String getAnalyzer() {
        return analyzer;
    }
}
