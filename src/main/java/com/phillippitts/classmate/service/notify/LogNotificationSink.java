package com.phillippitts.classmate.service.notify;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/** Writes alerts to the application log. */
@Component
class LogNotificationSink implements NotificationSink {

    private static final Logger LOG = LogManager.getLogger(LogNotificationSink.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void send(Notification notification) {
        if (notification.level() == Notification.Level.WARNING) {
            LOG.warn("[{}] {}", notification.title(), notification.body());
        } else {
            LOG.info("[{}] {}", notification.title(), notification.body());
        }
    }
}
