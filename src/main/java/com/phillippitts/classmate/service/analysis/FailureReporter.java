package com.phillippitts.classmate.service.analysis;

import com.phillippitts.classmate.domain.AnalysisFailureEvent;
import com.phillippitts.classmate.service.bus.EventBus;
import com.phillippitts.classmate.service.bus.Topic;
import com.phillippitts.classmate.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;

/**
 * Publishes analyzer failures on {@link Topic#ANALYSIS_FAILED} and logs them.
 */
final class FailureReporter {

    private static final Logger LOG = LogManager.getLogger(FailureReporter.class);

    private final EventBus bus;
    private final PipelineMetrics metrics;

    FailureReporter(EventBus bus, PipelineMetrics metrics) {
        this.bus = bus;
        this.metrics = metrics;
    }

    void report(AnalyzerKind kind, String relatedId, String reason, String message) {
        metrics.incrementAnalysisFailure(kind.label(), reason);
        LOG.warn("{} analyzer gave up on {}: {}", kind.label(), relatedId, message);
        bus.publish(Topic.ANALYSIS_FAILED, new AnalysisFailureEvent(kind.label(), relatedId, message, Instant.now()));
    }
}
