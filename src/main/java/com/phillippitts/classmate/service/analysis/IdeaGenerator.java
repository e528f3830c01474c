package com.phillippitts.classmate.service.analysis;

import com.phillippitts.classmate.domain.IdeaEvent;
import com.phillippitts.classmate.domain.TranscriptSegment;
import com.phillippitts.classmate.exception.AnalysisException;
import com.phillippitts.classmate.service.bus.EventBus;
import com.phillippitts.classmate.service.bus.Topic;
import com.phillippitts.classmate.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.time.Instant;
import java.util.List;

/**
 * Generates creative ideas and further-study directions on request.
 */
final class IdeaGenerator {

    private static final Logger LOG = LogManager.getLogger(IdeaGenerator.class);
    private static final int CONTEXT_SEGMENTS = 60;

    private final AnalysisLane lane;
    private final ModelInvoker invoker;
    private final EventBus bus;
    private final FailureReporter failures;
    private final PipelineMetrics metrics;
    private final TranscriptContext context;
    private final String systemPrompt;
    private final String materials;

    IdeaGenerator(AnalysisLane lane,
                  ModelInvoker invoker,
                  EventBus bus,
                  FailureReporter failures,
                  PipelineMetrics metrics,
                  TranscriptContext context,
                  String systemPrompt,
                  String materials) {
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
        return lane.submit(this::generate, () -> LOG.info("Idea request dropped"));
    }

    void generate() {
        List<TranscriptSegment> recent = context.recent(CONTEXT_SEGMENTS);
        if (recent.isEmpty()) {
            LOG.info("No transcript yet; skipping ideas");
            return;
        }
        try {
            String reply = invoker.invoke(CompletionRequest.of(AnalyzerKind.IDEA, systemPrompt,
                    Prompts.ideas(TranscriptContext.text(recent), materials)), 1);
            JSONObject json = ModelResponseParser.parseObject(reply)
                    .orElseThrow(() -> new AnalysisException("Unparseable ideas", AnalyzerKind.IDEA.label()));
            IdeaEvent event = new IdeaEvent(
                    ModelResponseParser.stringList(json, "creative_ideas", "idea", "connection"),
                    ModelResponseParser.stringList(json, "deep_learning", "topic", "reason"),
                    ModelResponseParser.stringList(json, "cross_discipline", "field", "connection"),
                    Instant.now());
            metrics.incrementAnalysisSuccess(AnalyzerKind.IDEA.label());
            bus.publish(Topic.IDEA_GENERATED, event);
        } catch (AnalysisException e) {
            failures.report(AnalyzerKind.IDEA, "", "error", e.getMessage());
        }
    }
}
