package com.phillippitts.classmate.service.analysis;

import com.phillippitts.classmate.domain.SummaryEvent;
import com.phillippitts.classmate.domain.TranscriptSegment;
import com.phillippitts.classmate.exception.AnalysisException;
import com.phillippitts.classmate.service.bus.EventBus;
import com.phillippitts.classmate.service.bus.Topic;
import com.phillippitts.classmate.service.metrics.PipelineMetrics;
import com.phillippitts.classmate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Summarizes the transcript in consecutive, non-overlapping windows on the transcript
 * timeline.
 *
 * <p>Window boundaries sit on a grid anchored at the first final's start with the configured
 * interval. A window closes when a final starts at or past its boundary. An explicit request,
 * a stalled-speech tick or {@link #flush()} cuts the current window at the end of the latest
 * final instead. Runs of windows without speech are coalesced into one empty summary that
 * needs no model call. Each final is summarized in exactly one window.
 */
final class Summarizer {

    private static final Logger LOG = LogManager.getLogger(Summarizer.class);
    private static final int MAX_ATTEMPTS = 2;

    private final long intervalMs;
    private final AnalysisLane lane;
    private final ModelInvoker invoker;
    private final EventBus bus;
    private final FailureReporter failures;
    private final PipelineMetrics metrics;
    private final String systemPrompt;
    private final String materials;

    private Long originMs;
    private long windowStartMs;
    private long lastSegmentEndMs;
    private List<TranscriptSegment> current = new ArrayList<>();
    private boolean newSinceTick;

    Summarizer(long intervalMs,
               AnalysisLane lane,
               ModelInvoker invoker,
               EventBus bus,
               FailureReporter failures,
               PipelineMetrics metrics,
               String systemPrompt,
               String materials) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be > 0, got: " + intervalMs);
        }
        this.intervalMs = intervalMs;
        this.lane = lane;
        this.invoker = invoker;
        this.bus = bus;
        this.failures = failures;
        this.metrics = metrics;
        this.systemPrompt = systemPrompt;
        this.materials = materials;
    }

    synchronized void onFinal(TranscriptSegment segment) {
        if (!segment.isFinal()) {
            return;
        }
        if (originMs == null) {
            originMs = segment.startMs();
            windowStartMs = originMs;
        }
        long boundary = nextBoundary(windowStartMs);
        if (segment.startMs() >= boundary) {
            if (!current.isEmpty()) {
                emit(windowStartMs, boundary, current);
                current = new ArrayList<>();
                windowStartMs = boundary;
            }
            long segmentWindowStart = gridFloor(segment.startMs());
            if (segmentWindowStart > windowStartMs) {
                emit(windowStartMs, segmentWindowStart, List.of());
                windowStartMs = segmentWindowStart;
            }
        }
        current.add(segment);
        lastSegmentEndMs = Math.max(lastSegmentEndMs, segment.endMs());
        newSinceTick = true;
    }

    /**
     * Cuts the current window at the end of the latest final.
     *
     * @return false if there was nothing to summarize
     */
    synchronized boolean requestSummary() {
        if (current.isEmpty()) {
            LOG.info("No new transcript since the last summary");
            return false;
        }
        long end = Math.max(lastSegmentEndMs, windowStartMs);
        emit(windowStartMs, end, current);
        current = new ArrayList<>();
        windowStartMs = end;
        return true;
    }

    /** Cuts the window if no final arrived since the previous tick. */
    synchronized void onStallTick() {
        if (!newSinceTick && !current.isEmpty()) {
            LOG.debug("Speech stalled; closing summary window early");
            requestSummary();
        }
        newSinceTick = false;
    }

    /** Cuts the remaining window at session end. */
    synchronized void flush() {
        requestSummary();
    }

    private long nextBoundary(long fromMs) {
        return gridFloor(fromMs) + intervalMs;
    }

    private long gridFloor(long atMs) {
        return originMs + ((atMs - originMs) / intervalMs) * intervalMs;
    }

    private void emit(long startMs, long endMs, List<TranscriptSegment> segments) {
        List<TranscriptSegment> snapshot = List.copyOf(segments);
        if (snapshot.isEmpty()) {
            SummaryEvent empty = new SummaryEvent(startMs, endMs, "", "", List.of(), List.of(), 0, Instant.now(),
                    false);
            lane.submit(() -> bus.publish(Topic.SUMMARY_GENERATED, empty),
                    () -> bus.publish(Topic.SUMMARY_GENERATED, empty));
            return;
        }
        lane.submit(() -> summarize(startMs, endMs, snapshot), () -> {
            failures.report(AnalyzerKind.SUMMARY, span(startMs, endMs), "rejected", "summary queue full or cancelled");
            bus.publish(Topic.SUMMARY_GENERATED, fallback(startMs, endMs, snapshot.size()));
        });
    }

    void summarize(long startMs, long endMs, List<TranscriptSegment> segments) {
        String span = span(startMs, endMs);
        try {
            String reply = invoker.invoke(CompletionRequest.of(AnalyzerKind.SUMMARY, systemPrompt,
                    Prompts.summary(TranscriptContext.text(segments), materials, span)), MAX_ATTEMPTS);
            Optional<JSONObject> parsed = ModelResponseParser.parseObject(reply);
            SummaryEvent event = parsed
                    .map(json -> new SummaryEvent(startMs, endMs,
                            json.optString("title", ""),
                            json.optString("summary", "").trim(),
                            ModelResponseParser.stringList(json, "key_points"),
                            ModelResponseParser.stringList(json, "important_concepts"),
                            segments.size(), Instant.now(), false))
                    .orElseGet(() -> new SummaryEvent(startMs, endMs, "", reply.trim(), List.of(), List.of(),
                            segments.size(), Instant.now(), false));
            metrics.incrementAnalysisSuccess(AnalyzerKind.SUMMARY.label());
            LOG.info("Summary for {} ({} segments)", span, segments.size());
            bus.publish(Topic.SUMMARY_GENERATED, event);
        } catch (AnalysisException e) {
            failures.report(AnalyzerKind.SUMMARY, span, "exhausted", e.getMessage());
            bus.publish(Topic.SUMMARY_GENERATED, fallback(startMs, endMs, segments.size()));
        }
    }

    private static SummaryEvent fallback(long startMs, long endMs, int segmentCount) {
        return new SummaryEvent(startMs, endMs, "", SummaryEvent.UNAVAILABLE, List.of(), List.of(), segmentCount,
                Instant.now(), true);
    }

    private static String span(long startMs, long endMs) {
        return TimeUtils.formatOffset(startMs) + "-" + TimeUtils.formatOffset(endMs);
    }
}
