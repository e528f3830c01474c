package com.phillippitts.classmate.service.analysis;

import com.phillippitts.classmate.config.properties.AnalysisProperties;
import com.phillippitts.classmate.domain.SuggestionEvent;
import com.phillippitts.classmate.domain.TranscriptSegment;
import com.phillippitts.classmate.exception.AnalysisException;
import com.phillippitts.classmate.service.bus.EventBus;
import com.phillippitts.classmate.service.bus.Topic;
import com.phillippitts.classmate.service.metrics.PipelineMetrics;
import com.phillippitts.classmate.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.time.Instant;
import java.util.List;

/**
 * Suggests a question the listener could raise, on request or periodically once enough new
 * transcript has accumulated.
 */
final class SuggestionGenerator {

    private static final Logger LOG = LogManager.getLogger(SuggestionGenerator.class);
    private static final int CONTEXT_SEGMENTS = 30;

    private final AnalysisProperties.Suggestion props;
    private final AnalysisLane lane;
    private final ModelInvoker invoker;
    private final EventBus bus;
    private final FailureReporter failures;
    private final PipelineMetrics metrics;
    private final TranscriptContext context;
    private final String systemPrompt;
    private final String materials;
    private int segmentsAtLastSuggestion = 0;

    SuggestionGenerator(AnalysisProperties.Suggestion props,
                        AnalysisLane lane,
                        ModelInvoker invoker,
                        EventBus bus,
                        FailureReporter failures,
                        PipelineMetrics metrics,
                        TranscriptContext context,
                        String systemPrompt,
                        String materials) {
        this.props = props;
        this.lane = lane;
        this.invoker = invoker;
        this.bus = bus;
        this.failures = failures;
        this.metrics = metrics;
        this.context = context;
        this.systemPrompt = systemPrompt;
        this.materials = materials;
    }

    boolean request() {
        return lane.submit(this::generate, () -> LOG.info("Suggestion request dropped"));
    }

    /** Periodic trigger; fires only with enough transcript and something new since last time. */
    void onTick() {
        if (!props.isAutoEnabled()) {
            return;
        }
        int size = context.size();
        synchronized (this) {
            if (size <= props.getMinSegments() || size == segmentsAtLastSuggestion) {
                return;
            }
        }
        request();
    }

    void generate() {
        List<TranscriptSegment> recent = context.recent(CONTEXT_SEGMENTS);
        if (recent.isEmpty()) {
            LOG.info("No transcript yet; skipping suggestion");
            return;
        }
        synchronized (this) {
            segmentsAtLastSuggestion = context.size();
        }
        try {
            String reply = invoker.invoke(CompletionRequest.of(AnalyzerKind.SUGGESTION, systemPrompt,
                    Prompts.suggestion(TranscriptContext.text(recent), materials)), 1);
            JSONObject json = ModelResponseParser.parseObject(reply)
                    .orElseThrow(() -> new AnalysisException("Unparseable suggestion", AnalyzerKind.SUGGESTION.label()));
            String question = json.optString("question", "").trim();
            if (question.isEmpty()) {
                throw new AnalysisException("Suggestion without question", AnalyzerKind.SUGGESTION.label());
            }
            metrics.incrementAnalysisSuccess(AnalyzerKind.SUGGESTION.label());
            LOG.info("Suggested question: {}", LogSanitizer.preview(question));
            bus.publish(Topic.SUGGESTION_GENERATED, new SuggestionEvent(question,
                    json.optString("rationale", ""), json.optString("timing", ""),
                    json.optString("expected_impact", ""), Instant.now()));
        } catch (AnalysisException e) {
            failures.report(AnalyzerKind.SUGGESTION, "", "error", e.getMessage());
        }
    }
}
