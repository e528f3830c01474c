package com.phillippitts.classmate.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the in-process event bus.
 */
@Validated
@ConfigurationProperties(prefix = "classmate.bus")
public class EventBusProperties {

    /** Maximum queued events per subscription before the publisher is made to wait. */
    @Positive
    private int mailboxCapacity = 1024;

    /** Longest a publisher waits on a full mailbox before the event is dropped for that subscriber. */
    @Positive
    private long publishTimeoutMs = 2000;

    /** Longest {@code awaitQuiescence} waits for all mailboxes to drain. */
    @Positive
    private long quiescenceTimeoutMs = 5000;

    public int getMailboxCapacity() {
        return mailboxCapacity;
    }

    public void setMailboxCapacity(int mailboxCapacity) {
        this.mailboxCapacity = mailboxCapacity;
    }

    public long getPublishTimeoutMs() {
        return publishTimeoutMs;
    }

    public void setPublishTimeoutMs(long publishTimeoutMs) {
        this.publishTimeoutMs = publishTimeoutMs;
    }

    public long getQuiescenceTimeoutMs() {
        return quiescenceTimeoutMs;
    }

    public void setQuiescenceTimeoutMs(long quiescenceTimeoutMs) {
        this.quiescenceTimeoutMs = quiescenceTimeoutMs;
    }
}
