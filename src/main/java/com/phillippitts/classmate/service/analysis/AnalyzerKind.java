package com.phillippitts.classmate.service.analysis;

import java.util.Locale;

/**
 * The analyzers of a session, with the sampling defaults used for their model calls.
 */
public enum AnalyzerKind {
    QUESTION(0.3, 1024),
    ANSWER(0.5, 1024),
    SUMMARY(0.5, 2048),
    SUGGESTION(0.8, 1024),
    IDEA(0.9, 2048);

    private final double temperature;
    private final int maxTokens;

    AnalyzerKind(double temperature, int maxTokens) {
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    public double temperature() {
        return temperature;
    }

    public int maxTokens() {
        return maxTokens;
    }

    /** Lower-case name used in logs, metrics and failure events. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
