package com.phillippitts.classmate.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Published on {@code session.lifecycle} for state transitions and component health changes.
 *
 * <p>PII note: {@code detail} carries technical diagnostics only, never transcript text.
 */
public record LifecycleEvent(UUID sessionId, Kind kind, String detail, Instant at) {

    public enum Kind {
        STARTED,
        PAUSED,
        RESUMED,
        ENDED,
        CHANNEL_DEGRADED,
        CHANNEL_RECOVERED,
        TRANSCRIPTION_COMPLETED,
        PERSISTENCE_DEGRADED
    }

    public LifecycleEvent {
        Objects.requireNonNull(kind, "kind must not be null");
        detail = detail == null ? "" : detail;
        if (at == null) {
            at = Instant.now();
        }
    }

    public static LifecycleEvent of(UUID sessionId, Kind kind, String detail) {
        return new LifecycleEvent(sessionId, kind, detail, Instant.now());
    }

    public boolean isWarning() {
        return kind == Kind.CHANNEL_DEGRADED || kind == Kind.PERSISTENCE_DEGRADED;
    }
}
