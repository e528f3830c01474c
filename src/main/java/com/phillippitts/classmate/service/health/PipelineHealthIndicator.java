package com.phillippitts.classmate.service.health;

import com.phillippitts.classmate.domain.LifecycleEvent;
import com.phillippitts.classmate.domain.Session;
import com.phillippitts.classmate.service.bus.EventBus;
import com.phillippitts.classmate.service.bus.Subscription;
import com.phillippitts.classmate.service.bus.Topic;
import com.phillippitts.classmate.service.orchestration.LectureOrchestrator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Health indicator for the listening pipeline.
 *
 * <p>Reports pipeline status for monitoring:
 * <ul>
 *   <li>UP: no session running, or a running session with a live channel and healthy records</li>
 *   <li>DEGRADED: transcription reconnects exhausted, or session records failing to persist</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class PipelineHealthIndicator implements HealthIndicator {

    private final LectureOrchestrator orchestrator;
    private final EventBus bus;
    private Subscription subscription;

    private volatile boolean channelDegraded;
    private volatile boolean persistenceDegraded;

    public PipelineHealthIndicator(LectureOrchestrator orchestrator, EventBus bus) {
        this.orchestrator = orchestrator;
        this.bus = bus;
    }

    @PostConstruct
    public void start() {
        subscription = bus.subscribe(Topic.SESSION_LIFECYCLE, "health", this::onLifecycle);
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            bus.unsubscribe(subscription);
        }
    }

    void onLifecycle(LifecycleEvent event) {
        switch (event.kind()) {
            case STARTED -> {
                channelDegraded = false;
                persistenceDegraded = false;
            }
            case CHANNEL_DEGRADED -> channelDegraded = true;
            case CHANNEL_RECOVERED -> channelDegraded = false;
            case PERSISTENCE_DEGRADED -> persistenceDegraded = true;
            default -> {
                // state changes are read from the orchestrator
            }
        }
    }

    @Override
    public Health health() {
        Optional<Session> session = orchestrator.current();
        boolean running = orchestrator.isRunning();

        Health.Builder builder = running && (channelDegraded || persistenceDegraded)
                ? new Health.Builder().status("DEGRADED")
                : new Health.Builder().up();
        builder.withDetail("session", session.map(s -> s.state().name()).orElse("none"));
        if (running) {
            builder.withDetail("transcription", channelDegraded ? "degraded" : "connected")
                    .withDetail("persistence", persistenceDegraded ? "degraded" : "ok");
        }
        return builder.build();
    }
}
