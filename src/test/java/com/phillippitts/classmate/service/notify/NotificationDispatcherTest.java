package com.phillippitts.classmate.service.notify;

import com.phillippitts.classmate.config.properties.NotificationProperties;
import com.phillippitts.classmate.domain.AnalysisFailureEvent;
import com.phillippitts.classmate.domain.AnswerEvent;
import com.phillippitts.classmate.domain.LifecycleEvent;
import com.phillippitts.classmate.domain.QuestionEvent;
import com.phillippitts.classmate.domain.QuestionKind;
import com.phillippitts.classmate.domain.SummaryEvent;
import com.phillippitts.classmate.service.bus.EventBus;
import com.phillippitts.classmate.service.bus.Topic;
import com.phillippitts.classmate.testutil.TestPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

    @Mock
    private NotificationSink sink;

    private EventBus bus;
    private NotificationProperties props;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        lenient().when(sink.name()).thenReturn("log");
        bus = TestPipeline.syncBus(TestPipeline.metrics());
        props = new NotificationProperties();
        dispatcher = new NotificationDispatcher(props, bus, List.of(sink));
    }

    private Notification lastSent() {
        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(sink).send(captor.capture());
        return captor.getValue();
    }

    @Test
    void shouldNotifyDetectedQuestionThroughBus() {
        dispatcher.start();

        bus.publish(Topic.QUESTION_DETECTED, new QuestionEvent("q-1", "s-1", "Why does ice float?", Instant.now(),
                0.9, QuestionKind.DIRECT, List.of("s-1")));

        Notification sent = lastSent();
        assertThat(sent.level()).isEqualTo(Notification.Level.INFO);
        assertThat(sent.title()).isEqualTo("Question detected (direct)");
        assertThat(sent.body()).isEqualTo("Why does ice float?");
    }

    @Test
    void shouldTitleRegeneratedAnswersAsUpdates() {
        dispatcher.onAnswer(new AnswerEvent("q-1", "Density.", Instant.now(), 10, 2, false));

        assertThat(lastSent().title()).isEqualTo("Answer updated");
    }

    @Test
    void shouldSkipPlaceholderAnswersAndEmptySummaries() {
        dispatcher.onAnswer(AnswerEvent.unavailable("q-1", 10, 1));
        dispatcher.onSummary(new SummaryEvent(0, 10_000, "", "", List.of(), List.of(), 0, Instant.now(), false));

        verify(sink, never()).send(any());
    }

    @Test
    void shouldThrottleRepeatedWarnings() {
        UUID id = UUID.randomUUID();

        dispatcher.onLifecycle(LifecycleEvent.of(id, LifecycleEvent.Kind.CHANNEL_DEGRADED, "down"));
        dispatcher.onLifecycle(LifecycleEvent.of(id, LifecycleEvent.Kind.CHANNEL_DEGRADED, "still down"));
        dispatcher.onFailure(new AnalysisFailureEvent("answer", "q-1", "timeout", Instant.now()));
        dispatcher.onFailure(new AnalysisFailureEvent("answer", "q-2", "timeout", Instant.now()));

        verify(sink, times(2)).send(any());
    }

    @Test
    void shouldAnnounceRecoveryAndIgnoreRoutineLifecycle() {
        UUID id = UUID.randomUUID();

        dispatcher.onLifecycle(LifecycleEvent.of(id, LifecycleEvent.Kind.STARTED, null));
        dispatcher.onLifecycle(LifecycleEvent.of(id, LifecycleEvent.Kind.CHANNEL_RECOVERED, "attempt 2"));

        assertThat(lastSent().title()).isEqualTo("Transcription recovered");
    }

    @Test
    void shouldSurviveFailingSink() {
        doThrow(new IllegalStateException("display unavailable")).when(sink).send(any());

        dispatcher.onAnswer(new AnswerEvent("q-1", "Density.", Instant.now(), 10, 1, false));

        verify(sink).send(any());
    }

    @Test
    void shouldNotSubscribeWhenDisabled() {
        props.setEnabled(false);

        dispatcher.start();

        assertThat(bus.subscriberCount(Topic.QUESTION_DETECTED)).isZero();
    }

    @Test
    void shouldUnsubscribeOnStop() {
        dispatcher.start();

        dispatcher.stop();

        assertThat(bus.subscriberCount(Topic.SESSION_LIFECYCLE)).isZero();
    }
}
