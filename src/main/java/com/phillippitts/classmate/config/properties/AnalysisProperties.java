package com.phillippitts.classmate.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the analyzers and the model calls they share.
 */
@Validated
@ConfigurationProperties(prefix = "classmate.analysis")
public class AnalysisProperties {

    /** Language the model is asked to answer in. */
    @NotBlank
    private String outputLanguage = "English";

    /** Per model call timeout. */
    @Positive
    private long callTimeoutMs = 30_000;

    @Min(0)
    private long retryBaseMs = 500;

    @Positive
    private long retryMaxMs = 4_000;

    /** Characters of imported materials included in prompts. */
    @Min(0)
    private int materialsContextChars = 2000;

    /** Longest {@code stop} waits for in-flight analyzer work. */
    @Positive
    private long stopTimeoutMs = 15_000;

    @Valid
    private Question question = new Question();
    @Valid
    private Answer answer = new Answer();
    @Valid
    private Summary summary = new Summary();
    @Valid
    private Suggestion suggestion = new Suggestion();
    @Valid
    private Ideas ideas = new Ideas();

    public String getOutputLanguage() {
        return outputLanguage;
    }

    public void setOutputLanguage(String outputLanguage) {
        this.outputLanguage = outputLanguage;
    }

    public long getCallTimeoutMs() {
        return callTimeoutMs;
    }

    public void setCallTimeoutMs(long callTimeoutMs) {
        this.callTimeoutMs = callTimeoutMs;
    }

    public long getRetryBaseMs() {
        return retryBaseMs;
    }

    public void setRetryBaseMs(long retryBaseMs) {
        this.retryBaseMs = retryBaseMs;
    }

    public long getRetryMaxMs() {
        return retryMaxMs;
    }

    public void setRetryMaxMs(long retryMaxMs) {
        this.retryMaxMs = retryMaxMs;
    }

    public int getMaterialsContextChars() {
        return materialsContextChars;
    }

    public void setMaterialsContextChars(int materialsContextChars) {
        this.materialsContextChars = materialsContextChars;
    }

    public long getStopTimeoutMs() {
        return stopTimeoutMs;
    }

    public void setStopTimeoutMs(long stopTimeoutMs) {
        this.stopTimeoutMs = stopTimeoutMs;
    }

    public Question getQuestion() {
        return question;
    }

    public void setQuestion(Question question) {
        this.question = question;
    }

    public Answer getAnswer() {
        return answer;
    }

    public void setAnswer(Answer answer) {
        this.answer = answer;
    }

    public Summary getSummary() {
        return summary;
    }

    public void setSummary(Summary summary) {
        this.summary = summary;
    }

    public Suggestion getSuggestion() {
        return suggestion;
    }

    public void setSuggestion(Suggestion suggestion) {
        this.suggestion = suggestion;
    }

    public Ideas getIdeas() {
        return ideas;
    }

    public void setIdeas(Ideas ideas) {
        this.ideas = ideas;
    }

    /**
     * Queue bounds shared by every analyzer lane.
     */
    public static class Lane {
        @Positive
        private int queueCapacity = 8;
        @Positive
        private int maxConcurrent = 1;

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getMaxConcurrent() {
            return maxConcurrent;
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
        }
    }

    public static class Question extends Lane {
        private boolean enabled = true;
        @Positive
        private int windowSize = 5;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double confidenceThreshold = 0.7;
        /** Jaccard similarity at or above which a question counts as a repeat. */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double similarityThreshold = 0.8;
        @Positive
        private int recentQuestions = 20;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }

        public double getConfidenceThreshold() {
            return confidenceThreshold;
        }

        public void setConfidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
        }

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }

        public int getRecentQuestions() {
            return recentQuestions;
        }

        public void setRecentQuestions(int recentQuestions) {
            this.recentQuestions = recentQuestions;
        }
    }

    public static class Answer extends Lane {
        @Positive
        private int maxAttempts = 3;
        /** Recent final segments included as answer context. */
        @Positive
        private int contextSegments = 10;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public int getContextSegments() {
            return contextSegments;
        }

        public void setContextSegments(int contextSegments) {
            this.contextSegments = contextSegments;
        }
    }

    public static class Summary extends Lane {
        private boolean enabled = true;
        /** Window length on the transcript timeline. */
        @Positive
        private long intervalMs = 600_000;
        /** How often the stalled-speech check runs; 0 disables it. */
        @Min(0)
        private long stallCheckMs = 60_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public long getStallCheckMs() {
            return stallCheckMs;
        }

        public void setStallCheckMs(long stallCheckMs) {
            this.stallCheckMs = stallCheckMs;
        }
    }

    public static class Suggestion extends Lane {
        private boolean autoEnabled = true;
        @Positive
        private long intervalMs = 300_000;
        /** Final segments required before a periodic suggestion is attempted. */
        @Min(0)
        private int minSegments = 10;

        public boolean isAutoEnabled() {
            return autoEnabled;
        }

        public void setAutoEnabled(boolean autoEnabled) {
            this.autoEnabled = autoEnabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getMinSegments() {
            return minSegments;
        }

        public void setMinSegments(int minSegments) {
            this.minSegments = minSegments;
        }
    }

    public static class Ideas extends Lane {
        /** Generate one round of ideas from the whole lecture when the session ends. */
        private boolean onEnd = true;

        public boolean isOnEnd() {
            return onEnd;
        }

        public void setOnEnd(boolean onEnd) {
            this.onEnd = onEnd;
        }
    }
}
