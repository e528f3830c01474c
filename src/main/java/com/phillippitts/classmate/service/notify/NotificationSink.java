package com.phillippitts.classmate.service.notify;

/**
 * Outbound destination for user-facing alerts. Implementations must not block for long;
 * they run on the event bus executor.
 */
public interface NotificationSink {

    /** Stable identifier matched against {@code classmate.notify.sinks}. */
    String name();

    void send(Notification notification);
}
