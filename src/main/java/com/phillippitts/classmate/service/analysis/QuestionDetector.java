package com.phillippitts.classmate.service.analysis;

import com.phillippitts.classmate.config.properties.AnalysisProperties;
import com.phillippitts.classmate.domain.QuestionEvent;
import com.phillippitts.classmate.domain.QuestionKind;
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
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Detects lecturer questions over a rolling window of recent final segments.
 *
 * <p>Each new final id triggers one detection over the window; a redelivered id is ignored.
 * A detected question is attributed to the window segment sharing most words with it, and
 * every segment yields at most one question. Questions whose wording is close to a recent
 * question are treated as repeats.
 */
final class QuestionDetector {

    private static final Logger LOG = LogManager.getLogger(QuestionDetector.class);

    private final AnalysisProperties.Question props;
    private final AnalysisLane lane;
    private final ModelInvoker invoker;
    private final EventBus bus;
    private final FailureReporter failures;
    private final PipelineMetrics metrics;
    private final String systemPrompt;

    private final Set<String> seenSegmentIds = new HashSet<>();
    private final Deque<TranscriptSegment> window = new ArrayDeque<>();
    private final Set<String> attributedSegmentIds = new HashSet<>();
    private final Deque<String> recentQuestions = new ArrayDeque<>();
    private String lastAnalyzedText = "";

    QuestionDetector(AnalysisProperties.Question props,
                     AnalysisLane lane,
                     ModelInvoker invoker,
                     EventBus bus,
                     FailureReporter failures,
                     PipelineMetrics metrics,
                     String systemPrompt) {
        this.props = props;
        this.lane = lane;
        this.invoker = invoker;
        this.bus = bus;
        this.failures = failures;
        this.metrics = metrics;
        this.systemPrompt = systemPrompt;
    }

    void onFinal(TranscriptSegment segment) {
        if (!props.isEnabled() || !segment.isFinal() || segment.text().isBlank()) {
            return;
        }
        List<TranscriptSegment> snapshot;
        synchronized (this) {
            if (!seenSegmentIds.add(segment.id())) {
                LOG.debug("Ignoring redelivered segment {}", segment.id());
                return;
            }
            window.addLast(segment);
            while (window.size() > props.getWindowSize()) {
                window.pollFirst();
            }
            snapshot = List.copyOf(window);
        }
        lane.submit(() -> detect(snapshot));
    }

    void detect(List<TranscriptSegment> snapshot) {
        String transcript = TranscriptContext.text(snapshot);
        String lastId = snapshot.get(snapshot.size() - 1).id();
        synchronized (this) {
            if (transcript.equals(lastAnalyzedText)) {
                return;
            }
            lastAnalyzedText = transcript;
        }
        String reply;
        try {
            reply = invoker.invoke(CompletionRequest.of(AnalyzerKind.QUESTION, systemPrompt,
                    Prompts.questionDetection(transcript)), 1);
        } catch (AnalysisException e) {
            failures.report(AnalyzerKind.QUESTION, lastId, "error", e.getMessage());
            return;
        }
        Optional<JSONObject> parsed = ModelResponseParser.parseObject(reply);
        if (parsed.isEmpty()) {
            failures.report(AnalyzerKind.QUESTION, lastId, "parse", "unparseable detection reply");
            return;
        }
        JSONObject json = parsed.get();
        double confidence = ModelResponseParser.unitInterval(json, "confidence");
        String questionText = json.optString("question_text", "").trim();
        if (!json.optBoolean("is_question", false) || confidence < props.getConfidenceThreshold()
                || questionText.isEmpty()) {
            return;
        }
        TranscriptSegment attributed = attribute(questionText, snapshot);
        QuestionEvent event;
        synchronized (this) {
            if (attributedSegmentIds.contains(attributed.id())) {
                LOG.debug("Segment {} already produced a question", attributed.id());
                return;
            }
            for (String recent : recentQuestions) {
                if (similarity(recent, questionText) >= props.getSimilarityThreshold()) {
                    LOG.debug("Skipping repeated question: {}", LogSanitizer.preview(questionText));
                    return;
                }
            }
            attributedSegmentIds.add(attributed.id());
            recentQuestions.addLast(questionText);
            while (recentQuestions.size() > props.getRecentQuestions()) {
                recentQuestions.pollFirst();
            }
            event = new QuestionEvent(UUID.randomUUID().toString(), attributed.id(), questionText, Instant.now(),
                    confidence, QuestionKind.fromLabel(json.optString("question_type", "")),
                    snapshot.stream().map(TranscriptSegment::id).collect(Collectors.toList()));
        }
        metrics.incrementAnalysisSuccess(AnalyzerKind.QUESTION.label());
        LOG.info("Question detected ({}, confidence={}): {}", event.kind(), confidence,
                LogSanitizer.preview(questionText));
        bus.publish(Topic.QUESTION_DETECTED, event);
    }

    /**
     * Picks the segment sharing the most words with the question; the newest wins ties.
     */
    static TranscriptSegment attribute(String question, List<TranscriptSegment> segments) {
        Set<String> questionTokens = tokens(question);
        TranscriptSegment best = segments.get(segments.size() - 1);
        int bestOverlap = 0;
        for (int i = segments.size() - 1; i >= 0; i--) {
            Set<String> overlap = tokens(segments.get(i).text());
            overlap.retainAll(questionTokens);
            if (overlap.size() > bestOverlap) {
                bestOverlap = overlap.size();
                best = segments.get(i);
            }
        }
        return best;
    }

    /** Jaccard similarity of the normalized word sets. */
    static double similarity(String a, String b) {
        Set<String> left = tokens(a);
        Set<String> right = tokens(b);
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        left.retainAll(right);
        return (double) left.size() / union.size();
    }

    static Set<String> tokens(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toCollection(HashSet::new));
    }
}
