package com.phillippitts.classmate.service.bus;

import com.phillippitts.classmate.config.properties.EventBusProperties;
import com.phillippitts.classmate.domain.LifecycleEvent;
import com.phillippitts.classmate.domain.TranscriptSegment;
import com.phillippitts.classmate.service.metrics.PipelineMetrics;
import com.phillippitts.classmate.testutil.RecordingSubscriber;
import com.phillippitts.classmate.testutil.TestPipeline;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class EventBusTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void shouldDeliverToEverySubscriberPresentAtPublish() {
        EventBus bus = TestPipeline.syncBus(TestPipeline.metrics());
        RecordingSubscriber<TranscriptSegment> first = new RecordingSubscriber<>();
        RecordingSubscriber<TranscriptSegment> second = new RecordingSubscriber<>();
        bus.subscribe(Topic.TRANSCRIPT_SEGMENT, first);
        bus.subscribe(Topic.TRANSCRIPT_SEGMENT, second);

        bus.publish(Topic.TRANSCRIPT_SEGMENT, TranscriptSegment.finalSegment("s-1", 0, 1000, "hello"));

        assertThat(first.count()).isEqualTo(1);
        assertThat(second.count()).isEqualTo(1);
    }

    @Test
    void shouldRejectEventOfWrongTypeBeforeDelivery() {
        EventBus bus = TestPipeline.syncBus(TestPipeline.metrics());
        RecordingSubscriber<TranscriptSegment> subscriber = new RecordingSubscriber<>();
        bus.subscribe(Topic.TRANSCRIPT_SEGMENT, subscriber);
        Topic raw = Topic.TRANSCRIPT_SEGMENT;

        assertThatThrownBy(() -> bus.publish(raw, "not a segment")).isInstanceOf(ClassCastException.class);
        assertThat(subscriber.count()).isZero();
    }

    @Test
    void shouldNotReplayToLateSubscribers() {
        EventBus bus = TestPipeline.syncBus(TestPipeline.metrics());
        bus.publish(Topic.TRANSCRIPT_SEGMENT, TranscriptSegment.finalSegment("s-1", 0, 1000, "early"));
        RecordingSubscriber<TranscriptSegment> late = new RecordingSubscriber<>();

        bus.subscribe(Topic.TRANSCRIPT_SEGMENT, late);

        assertThat(late.count()).isZero();
    }

    @Test
    void shouldKeepTopicsSeparate() {
        EventBus bus = TestPipeline.syncBus(TestPipeline.metrics());
        RecordingSubscriber<LifecycleEvent> lifecycle = new RecordingSubscriber<>();
        bus.subscribe(Topic.SESSION_LIFECYCLE, lifecycle);

        bus.publish(Topic.TRANSCRIPT_SEGMENT, TranscriptSegment.finalSegment("s-1", 0, 1000, "text"));

        assertThat(lifecycle.count()).isZero();
    }

    @Test
    void shouldPreservePublishOrderPerSubscriberOnThreadPool() {
        EventBus bus = TestPipeline.bus(pool, TestPipeline.metrics());
        RecordingSubscriber<TranscriptSegment> subscriber = new RecordingSubscriber<>();
        bus.subscribe(Topic.TRANSCRIPT_SEGMENT, subscriber);

        for (int i = 0; i < 200; i++) {
            bus.publish(Topic.TRANSCRIPT_SEGMENT, TranscriptSegment.finalSegment("s-" + i, i * 10L, i * 10L + 5, "w"));
        }

        assertThat(bus.awaitQuiescence(Duration.ofSeconds(5))).isTrue();
        List<String> ids = subscriber.events().stream().map(TranscriptSegment::id).toList();
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            expected.add("s-" + i);
        }
        assertThat(ids).containsExactlyElementsOf(expected);
    }

    @Test
    void shouldIsolateThrowingSubscriber() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        EventBus bus = TestPipeline.syncBus(new PipelineMetrics(registry));
        RecordingSubscriber<TranscriptSegment> healthy = new RecordingSubscriber<>();
        bus.subscribe(Topic.TRANSCRIPT_SEGMENT, "broken", s -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(Topic.TRANSCRIPT_SEGMENT, healthy);

        bus.publish(Topic.TRANSCRIPT_SEGMENT, TranscriptSegment.finalSegment("s-1", 0, 1000, "a"));
        bus.publish(Topic.TRANSCRIPT_SEGMENT, TranscriptSegment.finalSegment("s-2", 1000, 2000, "b"));

        assertThat(healthy.count()).isEqualTo(2);
        assertThat(registry.find("classmate.bus.subscriber.failure").tag("topic", "transcript.segment")
                .counter().count()).isEqualTo(2.0);
    }

    @Test
    void shouldDropForFullMailboxAfterTimeout() throws InterruptedException {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        EventBusProperties props = new EventBusProperties();
        props.setMailboxCapacity(1);
        props.setPublishTimeoutMs(20);
        EventBus bus = new EventBus(props, pool, new PipelineMetrics(registry));
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch entered = new CountDownLatch(1);
        bus.subscribe(Topic.SESSION_LIFECYCLE, "slow", e -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
        UUID id = UUID.randomUUID();

        bus.publish(Topic.SESSION_LIFECYCLE, LifecycleEvent.of(id, LifecycleEvent.Kind.STARTED, null));
        assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();
        bus.publish(Topic.SESSION_LIFECYCLE, LifecycleEvent.of(id, LifecycleEvent.Kind.PAUSED, null));
        bus.publish(Topic.SESSION_LIFECYCLE, LifecycleEvent.of(id, LifecycleEvent.Kind.RESUMED, null));
        release.countDown();

        await().atMost(Duration.ofSeconds(2)).until(bus::isQuiescent);
        assertThat(registry.find("classmate.bus.dropped").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldStopDeliveringAfterUnsubscribe() {
        EventBus bus = TestPipeline.syncBus(TestPipeline.metrics());
        RecordingSubscriber<TranscriptSegment> subscriber = new RecordingSubscriber<>();
        Subscription subscription = bus.subscribe(Topic.TRANSCRIPT_SEGMENT, subscriber);

        bus.unsubscribe(subscription);
        bus.publish(Topic.TRANSCRIPT_SEGMENT, TranscriptSegment.finalSegment("s-1", 0, 1000, "a"));

        assertThat(subscriber.count()).isZero();
        assertThat(subscription.isActive()).isFalse();
        assertThat(bus.subscriberCount(Topic.TRANSCRIPT_SEGMENT)).isZero();
    }

    @Test
    void shouldReportQuiescenceWhenIdle() {
        EventBus bus = TestPipeline.bus(pool, TestPipeline.metrics());
        bus.subscribe(Topic.TRANSCRIPT_SEGMENT, s -> { });

        assertThat(bus.awaitQuiescence(Duration.ofMillis(100))).isTrue();
    }

    @Test
    void shouldResolveTopicsByName() {
        assertThat(Topic.byName("question.detected")).isSameAs(Topic.QUESTION_DETECTED);
        assertThat(Topic.all()).hasSize(9);
        assertThatThrownBy(() -> Topic.byName("nope")).isInstanceOf(IllegalArgumentException.class);
    }
}
