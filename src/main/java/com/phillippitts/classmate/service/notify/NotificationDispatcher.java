package com.phillippitts.classmate.service.notify;

import com.phillippitts.classmate.config.properties.NotificationProperties;
import com.phillippitts.classmate.domain.AnalysisFailureEvent;
import com.phillippitts.classmate.domain.AnswerEvent;
import com.phillippitts.classmate.domain.LifecycleEvent;
import com.phillippitts.classmate.domain.QuestionEvent;
import com.phillippitts.classmate.domain.SummaryEvent;
import com.phillippitts.classmate.service.bus.EventBus;
import com.phillippitts.classmate.service.bus.Subscription;
import com.phillippitts.classmate.service.bus.Topic;
import com.phillippitts.classmate.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Renders bus events as alerts and hands them to the configured sinks.
 *
 * <p>Runs on its own bus subscriptions, so a slow or failing sink never stalls the pipeline.
 * Repeated warnings of the same kind are throttled.
 */
@Component
public class NotificationDispatcher {

    private static final Logger LOG = LogManager.getLogger(NotificationDispatcher.class);
    private static final Duration THROTTLE = Duration.ofMinutes(1);
    private static final int BODY_CHARS = 200;

    private final NotificationProperties properties;
    private final EventBus bus;
    private final List<NotificationSink> sinks;
    private final List<Subscription> subscriptions = new ArrayList<>();
    private final Map<String, Instant> lastWarning = new ConcurrentHashMap<>();

    public NotificationDispatcher(NotificationProperties properties, EventBus bus, List<NotificationSink> available) {
        this.properties = properties;
        this.bus = bus;
        List<NotificationSink> selected = new ArrayList<>();
        for (NotificationProperties.SinkType type : properties.getSinks()) {
            String wanted = type.name().toLowerCase(Locale.ROOT);
            available.stream()
                    .filter(s -> s.name().equalsIgnoreCase(wanted))
                    .findFirst()
                    .ifPresentOrElse(selected::add,
                            () -> LOG.warn("No notification sink named '{}' is available", wanted));
        }
        this.sinks = List.copyOf(selected);
    }

    @PostConstruct
    public void start() {
        if (!properties.isEnabled() || sinks.isEmpty()) {
            LOG.info("Notifications disabled");
            return;
        }
        subscribe(Topic.QUESTION_DETECTED, this::onQuestion);
        subscribe(Topic.ANSWER_GENERATED, this::onAnswer);
        subscribe(Topic.SUMMARY_GENERATED, this::onSummary);
        subscribe(Topic.SESSION_LIFECYCLE, this::onLifecycle);
        subscribe(Topic.ANALYSIS_FAILED, this::onFailure);
        LOG.info("Notifications enabled: sinks={}", sinks.stream().map(NotificationSink::name).toList());
    }

    @PreDestroy
    public void stop() {
        subscriptions.forEach(bus::unsubscribe);
        subscriptions.clear();
    }

    void onQuestion(QuestionEvent q) {
        dispatch(Notification.info("Question detected (" + q.kind().name().toLowerCase(Locale.ROOT) + ")",
                LogSanitizer.truncate(q.questionText(), BODY_CHARS)));
    }

    void onAnswer(AnswerEvent a) {
        if (a.fallback()) {
            return;
        }
        String title = a.revision() > 1 ? "Answer updated" : "Answer ready";
        dispatch(Notification.info(title, LogSanitizer.truncate(a.answerText(), BODY_CHARS)));
    }

    void onSummary(SummaryEvent s) {
        if (s.fallback() || s.segmentCount() == 0) {
            return;
        }
        dispatch(Notification.info("Summary: " + s.title(), LogSanitizer.truncate(s.text(), BODY_CHARS)));
    }

    void onLifecycle(LifecycleEvent e) {
        if (e.isWarning()) {
            if (shouldWarn(e.kind().name())) {
                dispatch(Notification.warning(e.kind().name(), e.detail()));
            }
        } else if (e.kind() == LifecycleEvent.Kind.CHANNEL_RECOVERED) {
            dispatch(Notification.info("Transcription recovered", e.detail()));
        }
    }

    void onFailure(AnalysisFailureEvent f) {
        if (shouldWarn("analysis-" + f.analyzer())) {
            dispatch(Notification.warning("Analysis failed: " + f.analyzer(), f.message()));
        }
    }

    // Package-private for tests
    boolean shouldWarn(String key) {
        Instant now = Instant.now();
        Instant prev = lastWarning.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastWarning.put(key, now);
            return true;
        }
        return false;
    }

    private void dispatch(Notification notification) {
        for (NotificationSink sink : sinks) {
            try {
                sink.send(notification);
            } catch (RuntimeException e) {
                LOG.warn("Notification sink '{}' failed: {}", sink.name(), e.getMessage());
            }
        }
    }

    private <T> void subscribe(Topic<T> topic, Consumer<T> handler) {
        subscriptions.add(bus.subscribe(topic, "notify", handler));
    }
}
