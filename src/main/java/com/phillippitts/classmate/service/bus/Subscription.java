package com.phillippitts.classmate.service.bus;

/**
 * Handle returned by {@link EventBus#subscribe}. Pass it back to
 * {@link EventBus#unsubscribe} to stop delivery; queued but undelivered events are discarded.
 */
public interface Subscription {

    Topic<?> topic();

    /** Subscriber name used in logs. */
    String name();

    boolean isActive();
}
