package com.phillippitts.classmate.service.analysis;

import com.phillippitts.classmate.config.properties.AnalysisProperties;
import com.phillippitts.classmate.domain.AnalysisFailureEvent;
import com.phillippitts.classmate.domain.AnswerEvent;
import com.phillippitts.classmate.domain.IdeaEvent;
import com.phillippitts.classmate.domain.QuestionEvent;
import com.phillippitts.classmate.domain.QuestionKind;
import com.phillippitts.classmate.domain.SuggestionEvent;
import com.phillippitts.classmate.domain.SummaryEvent;
import com.phillippitts.classmate.domain.TranscriptSegment;
import com.phillippitts.classmate.exception.NothingToAnalyzeException;
import com.phillippitts.classmate.exception.UnknownQuestionException;
import com.phillippitts.classmate.service.bus.EventBus;
import com.phillippitts.classmate.service.bus.Topic;
import com.phillippitts.classmate.service.metrics.PipelineMetrics;
import com.phillippitts.classmate.testutil.RecordingSubscriber;
import com.phillippitts.classmate.testutil.ScriptedAnalyzerBackend;
import com.phillippitts.classmate.testutil.SyncExecutor;
import com.phillippitts.classmate.testutil.TestPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Drives a whole analysis session through the bus with every executor running inline.
 */
class AnalysisEngineScenarioTest {

    private static final String NOT_A_QUESTION =
            "{\"is_question\": false, \"question_text\": \"\", \"question_type\": \"direct\", \"confidence\": 0.1}";
    private static final String CAPITAL_QUESTION = """
            {"is_question": true, "question_text": "What is the capital of France?",
             "question_type": "direct", "confidence": 0.95}""";
    private static final String SUMMARY_REPLY = """
            ```json
            {"title": "Geography", "summary": "European capitals.",
             "key_points": ["France", "Paris"], "important_concepts": ["capital city"]}
            ```""";

    private ScriptedAnalyzerBackend backend;
    private EventBus bus;
    private AnalysisProperties props;
    private RecordingSubscriber<QuestionEvent> questions;
    private RecordingSubscriber<AnswerEvent> answers;
    private RecordingSubscriber<SummaryEvent> summaries;
    private RecordingSubscriber<AnalysisFailureEvent> failures;

    @BeforeEach
    void setUp() {
        backend = new ScriptedAnalyzerBackend()
                .reply(AnalyzerKind.QUESTION, request -> request.prompt().contains("capital of France")
                        ? CAPITAL_QUESTION : NOT_A_QUESTION)
                .reply(AnalyzerKind.ANSWER, "{\"answer\": \"Paris\"}")
                .reply(AnalyzerKind.SUMMARY, SUMMARY_REPLY);
        PipelineMetrics metrics = TestPipeline.metrics();
        bus = TestPipeline.syncBus(metrics);
        props = TestPipeline.analysisProperties();
        questions = new RecordingSubscriber<>();
        answers = new RecordingSubscriber<>();
        summaries = new RecordingSubscriber<>();
        failures = new RecordingSubscriber<>();
        bus.subscribe(Topic.QUESTION_DETECTED, questions);
        bus.subscribe(Topic.ANSWER_GENERATED, answers);
        bus.subscribe(Topic.SUMMARY_GENERATED, summaries);
        bus.subscribe(Topic.ANALYSIS_FAILED, failures);
    }

    private AnalysisSession open() {
        PipelineMetrics metrics = TestPipeline.metrics();
        ModelInvoker invoker = new ModelInvoker(backend, new SyncExecutor(), props, metrics);
        AnalysisEngine engine = new AnalysisEngine(props, invoker, bus, metrics, new SyncExecutor());
        return engine.open(UUID.randomUUID(), "");
    }

    private void publishFinal(String id, long startMs, long endMs, String text) {
        bus.publish(Topic.TRANSCRIPT_SEGMENT, TranscriptSegment.finalSegment(id, startMs, endMs, text));
    }

    @Test
    void shouldDetectAndAnswerLecturerQuestion() {
        AnalysisSession session = open();

        publishFinal("s-1", 0, 8000, "Good morning everyone.");
        publishFinal("s-2", 8000, 19000, "Today we look at European geography.");
        publishFinal("s-3", 19000, 30000, "So, what is the capital of France?");
        session.finish(Duration.ofSeconds(3));

        assertThat(questions.count()).isEqualTo(1);
        QuestionEvent question = questions.last();
        assertThat(question.kind()).isEqualTo(QuestionKind.DIRECT);
        assertThat(question.segmentId()).isEqualTo("s-3");
        assertThat(question.coveredSegmentIds()).containsExactly("s-1", "s-2", "s-3");
        assertThat(answers.count()).isEqualTo(1);
        AnswerEvent answer = answers.last();
        assertThat(answer.questionEventId()).isEqualTo(question.id());
        assertThat(answer.answerText()).contains("Paris");
        assertThat(answer.fallback()).isFalse();
        assertThat(answer.revision()).isEqualTo(1);
    }

    @Test
    void shouldIgnoreRedeliveredFinal() {
        AnalysisSession session = open();

        publishFinal("s-1", 0, 5000, "What is the capital of France?");
        publishFinal("s-1", 0, 5000, "What is the capital of France?");
        session.finish(Duration.ofSeconds(3));

        assertThat(questions.count()).isEqualTo(1);
        assertThat(backend.callCount(AnalyzerKind.QUESTION)).isEqualTo(1);
        assertThat(session.finalSegmentCount()).isEqualTo(1);
    }

    @Test
    void shouldNotRepeatQuestionWhileItStaysInWindow() {
        AnalysisSession session = open();

        publishFinal("s-1", 0, 5000, "What is the capital of France?");
        publishFinal("s-2", 5000, 9000, "Think about it for a moment.");
        publishFinal("s-3", 9000, 12000, "Take your time.");
        session.finish(Duration.ofSeconds(3));

        assertThat(backend.callCount(AnalyzerKind.QUESTION)).isEqualTo(3);
        assertThat(questions.count()).isEqualTo(1);
        assertThat(answers.count()).isEqualTo(1);
    }

    @Test
    void shouldIgnorePartialSegments() {
        AnalysisSession session = open();

        bus.publish(Topic.TRANSCRIPT_SEGMENT,
                TranscriptSegment.partialSegment("s-1", 0, 2000, "What is the capital of"));
        session.finish(Duration.ofSeconds(3));

        assertThat(backend.callCount(AnalyzerKind.QUESTION)).isZero();
        assertThat(questions.count()).isZero();
    }

    @Test
    void shouldSkipQuestionsBelowConfidenceThreshold() {
        backend.reply(AnalyzerKind.QUESTION, """
                {"is_question": true, "question_text": "Right?", "question_type": "rhetorical",
                 "confidence": 0.4}""");
        AnalysisSession session = open();

        publishFinal("s-1", 0, 3000, "This is obvious, right?");
        session.finish(Duration.ofSeconds(3));

        assertThat(questions.count()).isZero();
    }

    @Test
    void shouldPublishSingleAnswerAfterTransientFailures() {
        backend.failNext(AnalyzerKind.ANSWER, 2);
        AnalysisSession session = open();

        publishFinal("s-1", 0, 5000, "What is the capital of France?");
        session.finish(Duration.ofSeconds(3));

        assertThat(backend.callCount(AnalyzerKind.ANSWER)).isEqualTo(3);
        assertThat(answers.count()).isEqualTo(1);
        assertThat(answers.last().fallback()).isFalse();
        assertThat(answers.last().answerText()).isEqualTo("Paris");
    }

    @Test
    void shouldPublishPlaceholderAnswerWhenRetriesExhausted() {
        backend.failNext(AnalyzerKind.ANSWER, 10);
        AnalysisSession session = open();

        publishFinal("s-1", 0, 5000, "What is the capital of France?");
        session.finish(Duration.ofSeconds(3));

        assertThat(answers.count()).isEqualTo(1);
        AnswerEvent answer = answers.last();
        assertThat(answer.fallback()).isTrue();
        assertThat(answer.answerText()).isEqualTo(AnswerEvent.UNAVAILABLE);
        assertThat(failures.events()).extracting(AnalysisFailureEvent::analyzer).contains("answer");
    }

    @Test
    void shouldRegenerateAnswerWithNextRevision() {
        AnalysisSession session = open();
        publishFinal("s-1", 0, 5000, "What is the capital of France?");
        String questionId = questions.last().id();
        backend.reply(AnalyzerKind.ANSWER, "{\"answer\": \"Paris, on the Seine\"}");

        boolean accepted = session.regenerateAnswer(questionId);
        session.finish(Duration.ofSeconds(3));

        assertThat(accepted).isTrue();
        assertThat(answers.count()).isEqualTo(2);
        assertThat(answers.last().revision()).isEqualTo(2);
        assertThat(answers.last().answerText()).isEqualTo("Paris, on the Seine");
        assertThatThrownBy(() -> session.regenerateAnswer("unknown"))
                .isInstanceOf(UnknownQuestionException.class)
                .hasMessageContaining("unknown");
    }

    @Test
    void shouldSummarizeConsecutiveWindows() {
        props.getSummary().setIntervalMs(10_000);
        AnalysisSession session = open();

        publishFinal("s-1", 0, 4000, "Opening remarks.");
        publishFinal("s-2", 4000, 9000, "First topic.");
        publishFinal("s-3", 10_000, 14_000, "Second topic.");
        publishFinal("s-4", 15_000, 19_000, "More on the second topic.");
        publishFinal("s-5", 20_000, 25_000, "Closing.");

        assertThat(summaries.count()).isEqualTo(2);
        assertThat(summaries.events()).extracting(SummaryEvent::windowStartMs).containsExactly(0L, 10_000L);

        session.finish(Duration.ofSeconds(3));

        List<SummaryEvent> events = summaries.events();
        assertThat(events).extracting(SummaryEvent::windowStartMs).containsExactly(0L, 10_000L, 20_000L);
        assertThat(events).extracting(SummaryEvent::windowEndMs).containsExactly(10_000L, 20_000L, 25_000L);
        assertThat(events).extracting(SummaryEvent::segmentCount).containsExactly(2, 2, 1);
        assertThat(events.get(0).title()).isEqualTo("Geography");
        assertThat(events.get(0).keyPoints()).containsExactly("France", "Paris");
        assertThat(events.get(0).concepts()).containsExactly("capital city");
    }

    @Test
    void shouldCoalesceSilentWindowsWithoutModelCall() {
        props.getSummary().setIntervalMs(10_000);
        AnalysisSession session = open();

        publishFinal("s-1", 0, 4000, "Before the break.");
        publishFinal("s-2", 35_000, 38_000, "After the break.");
        session.finish(Duration.ofSeconds(3));

        List<SummaryEvent> events = summaries.events();
        assertThat(events).extracting(SummaryEvent::windowStartMs).containsExactly(0L, 10_000L, 30_000L);
        assertThat(events).extracting(SummaryEvent::windowEndMs).containsExactly(10_000L, 30_000L, 38_000L);
        assertThat(events.get(1).segmentCount()).isZero();
        assertThat(backend.callCount(AnalyzerKind.SUMMARY)).isEqualTo(2);
    }

    @Test
    void shouldCutWindowOnExplicitRequestAndStitchToGrid() {
        props.getSummary().setIntervalMs(10_000);
        AnalysisSession session = open();

        publishFinal("s-1", 0, 3000, "Introduction.");
        boolean first = session.requestSummary();
        assertThatThrownBy(session::requestSummary)
                .isInstanceOf(NothingToAnalyzeException.class)
                .hasMessageContaining("No new transcript");
        publishFinal("s-2", 4000, 8000, "Details.");
        publishFinal("s-3", 12_000, 15_000, "Next part.");
        session.finish(Duration.ofSeconds(3));

        assertThat(first).isTrue();
        assertThat(summaries.events()).extracting(SummaryEvent::windowStartMs)
                .containsExactly(0L, 3000L, 10_000L);
        assertThat(summaries.events()).extracting(SummaryEvent::windowEndMs)
                .containsExactly(3000L, 10_000L, 15_000L);
    }

    @Test
    void shouldCloseWindowEarlyWhenSpeechStalls() {
        props.getSummary().setIntervalMs(60_000);
        AnalysisSession session = open();

        publishFinal("s-1", 0, 3000, "Short statement.");
        session.onSummaryStallTick();
        session.onSummaryStallTick();

        assertThat(summaries.count()).isEqualTo(1);
        assertThat(summaries.last().windowEndMs()).isEqualTo(3000L);
    }

    @Test
    void shouldPublishPlaceholderSummaryWhenModelFails() {
        backend.failNext(AnalyzerKind.SUMMARY, 10);
        AnalysisSession session = open();

        publishFinal("s-1", 0, 3000, "Some content.");
        session.finish(Duration.ofSeconds(3));

        assertThat(summaries.count()).isEqualTo(1);
        assertThat(summaries.last().fallback()).isTrue();
        assertThat(summaries.last().text()).isEqualTo(SummaryEvent.UNAVAILABLE);
    }

    @Test
    void shouldGenerateSuggestionAndIdeasOnRequest() {
        backend.reply(AnalyzerKind.SUGGESTION, """
                {"question": "How does Paris compare to Berlin?", "rationale": "extends the topic",
                 "timing": "after the current point", "expected_impact": "discussion"}""");
        backend.reply(AnalyzerKind.IDEA, """
                {"creative_ideas": [{"idea": "Map capitals by river", "connection": "geography"}],
                 "deep_learning": [{"topic": "Urban history", "reason": "context"}],
                 "cross_discipline": []}""");
        RecordingSubscriber<SuggestionEvent> suggestions = new RecordingSubscriber<>();
        RecordingSubscriber<IdeaEvent> ideas = new RecordingSubscriber<>();
        bus.subscribe(Topic.SUGGESTION_GENERATED, suggestions);
        bus.subscribe(Topic.IDEA_GENERATED, ideas);
        AnalysisSession session = open();
        publishFinal("s-1", 0, 3000, "Paris is on the Seine.");

        assertThat(session.requestSuggestion()).isTrue();
        assertThat(session.requestIdeas()).isTrue();

        assertThat(suggestions.last().question()).isEqualTo("How does Paris compare to Berlin?");
        assertThat(ideas.last().ideas()).containsExactly("Map capitals by river - geography");
        assertThat(ideas.last().deepLearning()).containsExactly("Urban history - context");
        assertThat(ideas.last().crossDiscipline()).isEmpty();
    }

    @Test
    void shouldGenerateIdeasOnceWhenSessionEnds() {
        props.getIdeas().setOnEnd(true);
        backend.reply(AnalyzerKind.IDEA, """
                {"creative_ideas": [{"idea": "Sketch the Seine", "connection": "rivers"}],
                 "deep_learning": [], "cross_discipline": []}""");
        RecordingSubscriber<IdeaEvent> ideas = new RecordingSubscriber<>();
        bus.subscribe(Topic.IDEA_GENERATED, ideas);
        AnalysisSession session = open();
        publishFinal("s-1", 0, 3000, "Paris is on the Seine.");

        assertThat(ideas.count()).isZero();
        assertThat(session.finish(Duration.ofSeconds(3))).isTrue();

        assertThat(ideas.count()).isEqualTo(1);
        assertThat(ideas.last().ideas()).containsExactly("Sketch the Seine - rivers");
        assertThat(backend.callCount(AnalyzerKind.IDEA)).isEqualTo(1);
    }

    @Test
    void shouldSkipEndOfSessionIdeasWithoutTranscript() {
        props.getIdeas().setOnEnd(true);
        AnalysisSession session = open();

        assertThat(session.finish(Duration.ofSeconds(3))).isTrue();

        assertThat(backend.callCount(AnalyzerKind.IDEA)).isZero();
    }

    @Test
    void shouldRefuseSummaryWhenSummariesDisabled() {
        props.getSummary().setEnabled(false);
        AnalysisSession session = open();
        publishFinal("s-1", 0, 3000, "Content.");

        assertThatThrownBy(session::requestSummary)
                .isInstanceOf(NothingToAnalyzeException.class)
                .hasMessageContaining("disabled");
    }

    @Test
    void shouldRefuseRequestsAfterFinish() {
        AnalysisSession session = open();
        publishFinal("s-1", 0, 3000, "Content.");

        assertThat(session.finish(Duration.ofSeconds(3))).isTrue();

        assertThat(session.requestSummary()).isFalse();
        assertThat(session.requestSuggestion()).isFalse();
        assertThat(session.requestIdeas()).isFalse();
    }
}
