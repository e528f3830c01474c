package com.phillippitts.classmate.service.bus;

import com.phillippitts.classmate.config.properties.EventBusProperties;
import com.phillippitts.classmate.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe bus connecting the pipeline stages.
 *
 * <p>Delivery semantics:
 * <ul>
 *   <li>An event reaches every subscription present on its topic at publish time.
 *       Late subscribers receive nothing retroactively.</li>
 *   <li>Each subscription owns a bounded mailbox that is drained by at most one task at a time
 *       on the event executor, so a subscriber sees events of a topic in publish order.</li>
 *   <li>A subscriber that throws is logged and counted; other subscribers are unaffected.</li>
 *   <li>A full mailbox blocks the publisher for at most {@code classmate.bus.publish-timeout-ms};
 *       after that the event is dropped for that subscriber only.</li>
 * </ul>
 *
 * <p>No ordering is promised across topics.
 */
@Component
public class EventBus {

    private static final Logger LOG = LogManager.getLogger(EventBus.class);
    private static final long QUIESCENCE_POLL_MS = 10;

    private final Map<String, List<Mailbox<?>>> subscriptions = new ConcurrentHashMap<>();
    private final Executor executor;
    private final EventBusProperties properties;
    private final PipelineMetrics metrics;
    private final AtomicLong ids = new AtomicLong();

    public EventBus(EventBusProperties properties,
                    @Qualifier("eventExecutor") Executor executor,
                    PipelineMetrics metrics) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public <T> Subscription subscribe(Topic<T> topic, Consumer<? super T> consumer) {
        return subscribe(topic, "subscriber-" + (ids.get() + 1), consumer);
    }

    /**
     * Registers a consumer on a topic.
     *
     * @param topic topic to listen on
     * @param name label used when logging failures of this subscriber
     * @param consumer callback, invoked on an event executor thread
     * @return handle for {@link #unsubscribe}
     */
    public <T> Subscription subscribe(Topic<T> topic, String name, Consumer<? super T> consumer) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(consumer, "consumer");
        Mailbox<T> mailbox = new Mailbox<>(ids.incrementAndGet(), topic, name, consumer,
                properties.getMailboxCapacity());
        subscriptions.computeIfAbsent(topic.name(), k -> new CopyOnWriteArrayList<>()).add(mailbox);
        LOG.debug("Subscribed {} to {}", name, topic);
        return mailbox;
    }

    public void unsubscribe(Subscription subscription) {
        if (!(subscription instanceof Mailbox<?> mailbox)) {
            return;
        }
        mailbox.active = false;
        mailbox.queue.clear();
        List<Mailbox<?>> list = subscriptions.get(mailbox.topic.name());
        if (list != null) {
            list.remove(mailbox);
        }
        LOG.debug("Unsubscribed {} from {}", mailbox.name, mailbox.topic);
    }

    /**
     * Fans an event out to the current subscribers of its topic.
     *
     * @param topic destination topic
     * @param event event to deliver (must not be null)
     */
    public <T> void publish(Topic<T> topic, T event) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(event, "event");
        List<Mailbox<?>> list = subscriptions.get(topic.name());
        if (list == null || list.isEmpty()) {
            return;
        }
        for (Mailbox<?> mailbox : list) {
            mailbox.offerPublished(event);
        }
    }

    /**
     * Waits until every mailbox is empty and no subscriber is running.
     *
     * @param timeout upper bound on the wait
     * @return true if the bus went quiet within the timeout
     */
    public boolean awaitQuiescence(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!isQuiescent()) {
            if (System.nanoTime() >= deadline) {
                LOG.warn("Event bus did not quiesce within {} ms", timeout.toMillis());
                return false;
            }
            try {
                Thread.sleep(QUIESCENCE_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    /** Same as {@link #awaitQuiescence(Duration)} with the configured default timeout. */
    public boolean awaitQuiescence() {
        return awaitQuiescence(Duration.ofMillis(properties.getQuiescenceTimeoutMs()));
    }

    public boolean isQuiescent() {
        for (List<Mailbox<?>> list : subscriptions.values()) {
            for (Mailbox<?> mailbox : list) {
                if (!mailbox.isIdle()) {
                    return false;
                }
            }
        }
        return true;
    }

    public int subscriberCount(Topic<?> topic) {
        List<Mailbox<?>> list = subscriptions.get(topic.name());
        return list == null ? 0 : list.size();
    }

    private final class Mailbox<T> implements Subscription {
        private final long id;
        private final Topic<T> topic;
        private final String name;
        private final Consumer<? super T> consumer;
        private final BlockingQueue<T> queue;
        private final AtomicBoolean scheduled = new AtomicBoolean(false);
        private volatile boolean active = true;

        Mailbox(long id, Topic<T> topic, String name, Consumer<? super T> consumer, int capacity) {
            this.id = id;
            this.topic = topic;
            this.name = name == null ? "subscriber-" + id : name;
            this.consumer = consumer;
            this.queue = new LinkedBlockingQueue<>(capacity);
        }

        /** Narrows an event published on this mailbox's topic to the topic's event type. */
        void offerPublished(Object event) {
            offer(topic.eventType().cast(event));
        }

        void offer(T event) {
            if (!active) {
                return;
            }
            boolean accepted;
            try {
                accepted = queue.offer(event, properties.getPublishTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                accepted = false;
            }
            if (!accepted) {
                metrics.incrementBusDrop(topic.name());
                LOG.warn("Dropped {} event for slow subscriber {} (mailbox full)", topic, name);
                return;
            }
            schedule();
        }

        private void schedule() {
            if (scheduled.compareAndSet(false, true)) {
                executor.execute(this::drain);
            }
        }

        private void drain() {
            try {
                T event;
                while (active && (event = queue.poll()) != null) {
                    deliver(event);
                }
            } finally {
                scheduled.set(false);
                if (active && !queue.isEmpty()) {
                    schedule();
                }
            }
        }

        private void deliver(T event) {
            try {
                consumer.accept(event);
            } catch (RuntimeException e) {
                metrics.incrementSubscriberFailure(topic.name());
                LOG.error("Subscriber {} failed handling {} event: {}", name, topic, e.getMessage(), e);
            }
        }

        boolean isIdle() {
            return !scheduled.get() && queue.isEmpty();
        }

        @Override
        public Topic<?> topic() {
            return topic;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public String toString() {
            return "Subscription[" + name + "@" + topic + "]";
        }
    }
}
