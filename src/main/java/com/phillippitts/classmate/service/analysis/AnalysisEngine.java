package com.phillippitts.classmate.service.analysis;

import com.phillippitts.classmate.config.properties.AnalysisProperties;
import com.phillippitts.classmate.service.bus.EventBus;
import com.phillippitts.classmate.service.metrics.PipelineMetrics;
import com.phillippitts.classmate.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Builds the analyzers for a session.
 *
 * <p>Queue policies per analyzer:
 * <ul>
 *   <li>question detection: newest wins, older windows are stale</li>
 *   <li>answers: oldest wins, a refused question gets a placeholder answer at once</li>
 *   <li>summaries: oldest wins, a refused window gets a placeholder summary; one at a time
 *       so summaries publish in window order</li>
 *   <li>suggestions and ideas: oldest wins</li>
 * </ul>
 */
@Component
public class AnalysisEngine {

    private static final Logger LOG = LogManager.getLogger(AnalysisEngine.class);

    private final AnalysisProperties properties;
    private final ModelInvoker invoker;
    private final EventBus bus;
    private final PipelineMetrics metrics;
    private final Executor executor;

    public AnalysisEngine(AnalysisProperties properties,
                          ModelInvoker invoker,
                          EventBus bus,
                          PipelineMetrics metrics,
                          @Qualifier("analysisExecutor") Executor executor) {
        this.properties = properties;
        this.invoker = invoker;
        this.bus = bus;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Creates and attaches the analyzers for a session.
     *
     * @param sessionId owning session
     * @param materialsContext text of imported materials, truncated to the configured size
     */
    public AnalysisSession open(UUID sessionId, String materialsContext) {
        String materials = LogSanitizer.truncate(materialsContext == null ? "" : materialsContext,
                properties.getMaterialsContextChars());
        String system = Prompts.system(properties.getOutputLanguage());
        FailureReporter failures = new FailureReporter(bus, metrics);
        TranscriptContext context = new TranscriptContext();

        AnalysisProperties.Question q = properties.getQuestion();
        AnalysisLane questionLane = lane("question", q, AnalysisLane.OverflowPolicy.DROP_OLDEST);
        AnalysisLane answerLane = lane("answer", properties.getAnswer(), AnalysisLane.OverflowPolicy.REJECT_NEWEST);
        AnalysisLane summaryLane = new AnalysisLane("summary", executor,
                properties.getSummary().getQueueCapacity(), 1, AnalysisLane.OverflowPolicy.REJECT_NEWEST);
        AnalysisLane suggestionLane = lane("suggestion", properties.getSuggestion(),
                AnalysisLane.OverflowPolicy.REJECT_NEWEST);
        AnalysisLane ideaLane = lane("idea", properties.getIdeas(), AnalysisLane.OverflowPolicy.REJECT_NEWEST);

        AnalysisSession session = new AnalysisSession(sessionId, bus, context,
                new QuestionDetector(q, questionLane, invoker, bus, failures, metrics, system),
                new AnswerGenerator(properties.getAnswer(), answerLane, invoker, bus, failures, metrics, context,
                        system, materials),
                new Summarizer(properties.getSummary().getIntervalMs(), summaryLane, invoker, bus, failures,
                        metrics, system, materials),
                new SuggestionGenerator(properties.getSuggestion(), suggestionLane, invoker, bus, failures, metrics,
                        context, system, materials),
                new IdeaGenerator(ideaLane, invoker, bus, failures, metrics, context, system, materials),
                List.of(questionLane, answerLane, summaryLane, suggestionLane, ideaLane),
                properties.getSummary().isEnabled(),
                properties.getIdeas().isOnEnd());
        session.attach();
        LOG.info("Analysis started (model backend={}, materials={} chars)", invoker.backendName(),
                materials.length());
        return session;
    }

    public AnalysisProperties properties() {
        return properties;
    }

    private AnalysisLane lane(String name, AnalysisProperties.Lane lane, AnalysisLane.OverflowPolicy policy) {
        return new AnalysisLane(name, executor, lane.getQueueCapacity(), lane.getMaxConcurrent(), policy);
    }
}
