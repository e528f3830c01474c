package com.phillippitts.classmate.service.notify;

import java.time.Instant;
import java.util.Objects;

/**
 * A rendered user-facing alert.
 */
public record Notification(Level level, String title, String body, Instant at) {

    public enum Level { INFO, WARNING }

    public Notification {
        Objects.requireNonNull(level, "level must not be null");
        Objects.requireNonNull(title, "title must not be null");
        body = body == null ? "" : body;
        if (at == null) {
            at = Instant.now();
        }
    }

    public static Notification info(String title, String body) {
        return new Notification(Level.INFO, title, body, Instant.now());
    }

    public static Notification warning(String title, String body) {
        return new Notification(Level.WARNING, title, body, Instant.now());
    }
}
