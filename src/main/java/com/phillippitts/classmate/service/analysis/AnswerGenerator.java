package com.phillippitts.classmate.service.analysis;

import com.phillippitts.classmate.config.properties.AnalysisProperties;
import com.phillippitts.classmate.domain.AnswerEvent;
import com.phillippitts.classmate.domain.QuestionEvent;
import com.phillippitts.classmate.exception.AnalysisException;
import com.phillippitts.classmate.exception.UnknownQuestionException;
import com.phillippitts.classmate.service.bus.EventBus;
import com.phillippitts.classmate.service.bus.Topic;
import com.phillippitts.classmate.service.metrics.PipelineMetrics;
import com.phillippitts.classmate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Answers each detected question once, retrying the model a bounded number of times. When
 * no answer can be produced a placeholder answer is published so the listener is never left
 * waiting. {@link #regenerate} produces a superseding answer with the next revision.
 */
final class AnswerGenerator {

    private static final Logger LOG = LogManager.getLogger(AnswerGenerator.class);

    private final AnalysisProperties.Answer props;
    private final AnalysisLane lane;
    private final ModelInvoker invoker;
    private final EventBus bus;
    private final FailureReporter failures;
    private final PipelineMetrics metrics;
    private final TranscriptContext context;
    private final String systemPrompt;
    private final String materials;

    private final Map<String, QuestionEvent> questions = new ConcurrentHashMap<>();
    private final Map<String, Integer> revisions = new ConcurrentHashMap<>();

    AnswerGenerator(AnalysisProperties.Answer props,
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

    void onQuestion(QuestionEvent question) {
        if (questions.putIfAbsent(question.id(), question) != null) {
            LOG.debug("Question {} already answered", question.id());
            return;
        }
        revisions.put(question.id(), 1);
        enqueue(question, 1);
    }

    /**
     * Queues a fresh answer for a known question.
     *
     * @return false if the question id is unknown
     */
    boolean regenerate(String questionId) {
        QuestionEvent question = questions.get(questionId);
        if (question == null) {
            throw new UnknownQuestionException(questionId);
        }
        int revision = revisions.merge(questionId, 1, Integer::sum);
        enqueue(question, revision);
        return true;
    }

    private void enqueue(QuestionEvent question, int revision) {
        lane.submit(() -> generate(question, revision), () -> {
            failures.report(AnalyzerKind.ANSWER, question.id(), "rejected", "answer queue full or cancelled");
            bus.publish(Topic.ANSWER_GENERATED, AnswerEvent.unavailable(question.id(), 0, revision));
        });
    }

    void generate(QuestionEvent question, int revision) {
        long start = System.nanoTime();
        String transcript = TranscriptContext.text(context.recent(props.getContextSegments()));
        CompletionRequest request = CompletionRequest.of(AnalyzerKind.ANSWER, systemPrompt,
                Prompts.answer(question.questionText(), transcript, materials));
        try {
            String reply = invoker.invoke(request, props.getMaxAttempts());
            String answer = ModelResponseParser.parseObject(reply)
                    .map(json -> json.optString("answer", ""))
                    .filter(text -> !text.isBlank())
                    .orElse(reply)
                    .trim();
            if (answer.isEmpty()) {
                throw new AnalysisException("Empty answer", AnalyzerKind.ANSWER.label());
            }
            metrics.incrementAnalysisSuccess(AnalyzerKind.ANSWER.label());
            bus.publish(Topic.ANSWER_GENERATED, new AnswerEvent(question.id(), answer, Instant.now(),
                    TimeUtils.elapsedMillis(start), revision, false));
        } catch (AnalysisException e) {
            failures.report(AnalyzerKind.ANSWER, question.id(), "exhausted", e.getMessage());
            bus.publish(Topic.ANSWER_GENERATED,
                    AnswerEvent.unavailable(question.id(), TimeUtils.elapsedMillis(start), revision));
        }
    }

    int knownQuestions() {
        return questions.size();
    }
}
