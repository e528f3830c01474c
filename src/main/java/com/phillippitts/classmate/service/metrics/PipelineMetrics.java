package com.phillippitts.classmate.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the transcription-and-analysis pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Segments received from the transcription backend, and those rejected</li>
 *   <li>Event bus drops and subscriber failures per topic</li>
 *   <li>Model call latency and outcome per analyzer</li>
 *   <li>Persistence write failures</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "classmate";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts a segment published by the transcription channel.
     *
     * @param isFinal whether the segment was final or partial
     */
    public void incrementSegment(boolean isFinal) {
        Counter.builder(METRIC_PREFIX + ".transcript.segments")
                .description("Transcript segments published")
                .tag("kind", isFinal ? "final" : "partial")
                .register(registry)
                .increment();
    }

    /**
     * Counts a segment dropped by the channel.
     *
     * @param reason out_of_order, duplicate or stale_partial
     */
    public void incrementSegmentDropped(String reason) {
        Counter.builder(METRIC_PREFIX + ".transcript.dropped")
                .description("Transcript segments dropped by the channel")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Counts a reconnect attempt outcome.
     *
     * @param outcome success, failure or exhausted
     */
    public void incrementReconnect(String outcome) {
        Counter.builder(METRIC_PREFIX + ".transcript.reconnect")
                .description("Transcription backend reconnect attempts")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementBusDrop(String topic) {
        Counter.builder(METRIC_PREFIX + ".bus.dropped")
                .description("Events dropped because a subscriber mailbox stayed full")
                .tag("topic", topic)
                .register(registry)
                .increment();
    }

    public void incrementSubscriberFailure(String topic) {
        Counter.builder(METRIC_PREFIX + ".bus.subscriber.failure")
                .description("Subscriber invocations that threw")
                .tag("topic", topic)
                .register(registry)
                .increment();
    }

    /**
     * Records model call latency for an analyzer.
     *
     * @param analyzer analyzer name (question, answer, summary, suggestion, idea)
     * @param durationNanos duration in nanoseconds
     */
    public void recordModelLatency(String analyzer, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".analysis.latency")
                .description("Time taken by a language model call")
                .tag("analyzer", analyzer)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementAnalysisSuccess(String analyzer) {
        Counter.builder(METRIC_PREFIX + ".analysis.success")
                .description("Analyzer runs that produced an artifact")
                .tag("analyzer", analyzer)
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter for an analyzer.
     *
     * @param analyzer analyzer name
     * @param reason timeout, error, parse or rejected
     */
    public void incrementAnalysisFailure(String analyzer, String reason) {
        Counter.builder(METRIC_PREFIX + ".analysis.failure")
                .description("Analyzer runs that failed or fell back")
                .tag("analyzer", analyzer)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementPersistenceFailure(String record) {
        Counter.builder(METRIC_PREFIX + ".store.failure")
                .description("Session records that could not be written")
                .tag("record", record)
                .register(registry)
                .increment();
    }
}
