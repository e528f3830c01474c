package com.phillippitts.classmate.service.analysis;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Bounded work queue for one analyzer: at most {@code maxConcurrent} entries run at a time
 * and at most {@code capacity} wait. What happens on overflow is the lane's
 * {@link OverflowPolicy}. Every entry that does not run (evicted, rejected or cancelled)
 * gets its {@code onDropped} callback, on the caller's thread.
 */
public final class AnalysisLane {

    private static final Logger LOG = LogManager.getLogger(AnalysisLane.class);

    public enum OverflowPolicy {
        /** Evict the oldest waiting entry to make room (newest wins). */
        DROP_OLDEST,
        /** Refuse the new entry (oldest wins). */
        REJECT_NEWEST
    }

    private final String name;
    private final Executor executor;
    private final int capacity;
    private final int maxConcurrent;
    private final OverflowPolicy policy;
    private final Deque<Entry> pending = new ArrayDeque<>();
    private int running = 0;

    public AnalysisLane(String name, Executor executor, int capacity, int maxConcurrent, OverflowPolicy policy) {
        if (capacity < 1 || maxConcurrent < 1) {
            throw new IllegalArgumentException("capacity and maxConcurrent must be >= 1");
        }
        this.name = name;
        this.executor = executor;
        this.capacity = capacity;
        this.maxConcurrent = maxConcurrent;
        this.policy = policy;
    }

    /**
     * Queues work.
     *
     * @param task      work to run on the lane executor
     * @param onDropped invoked instead of {@code task} if the entry never runs
     * @return false if this entry was refused
     */
    public boolean submit(Runnable task, Runnable onDropped) {
        Entry entry = new Entry(task, onDropped);
        Entry dropped = null;
        boolean accepted = true;
        synchronized (this) {
            if (pending.size() >= capacity) {
                if (policy == OverflowPolicy.DROP_OLDEST) {
                    dropped = pending.pollFirst();
                    pending.addLast(entry);
                } else {
                    dropped = entry;
                    accepted = false;
                }
            } else {
                pending.addLast(entry);
            }
        }
        if (dropped != null) {
            LOG.debug("Lane {} full ({}); dropping {} entry", name, capacity,
                    accepted ? "oldest" : "newest");
            dropped.dropped();
        }
        pump();
        return accepted;
    }

    public boolean submit(Runnable task) {
        return submit(task, () -> { });
    }

    /**
     * Removes every waiting entry. Running entries are not interrupted.
     *
     * @return number of entries removed
     */
    public int cancelPending() {
        List<Entry> cancelled;
        synchronized (this) {
            cancelled = new ArrayList<>(pending);
            pending.clear();
        }
        for (Entry entry : cancelled) {
            entry.dropped();
        }
        if (!cancelled.isEmpty()) {
            LOG.info("Lane {} cancelled {} pending entries", name, cancelled.size());
        }
        return cancelled.size();
    }

    /**
     * Waits until nothing is running or waiting.
     *
     * @return true if the lane went idle within the timeout
     */
    public synchronized boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (running > 0 || !pending.isEmpty()) {
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
            if (remainingMs <= 0) {
                LOG.warn("Lane {} still busy after {} ms ({} running, {} pending)", name, timeout.toMillis(),
                        running, pending.size());
                return false;
            }
            try {
                wait(remainingMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized int runningCount() {
        return running;
    }

    public String name() {
        return name;
    }

    public OverflowPolicy policy() {
        return policy;
    }

    private void pump() {
        List<Entry> toStart = new ArrayList<>();
        synchronized (this) {
            while (running < maxConcurrent && !pending.isEmpty()) {
                toStart.add(pending.pollFirst());
                running++;
            }
        }
        for (Entry entry : toStart) {
            executor.execute(() -> run(entry));
        }
    }

    private void run(Entry entry) {
        try {
            entry.task.run();
        } catch (RuntimeException e) {
            LOG.error("Lane {} task failed: {}", name, e.getMessage(), e);
        } finally {
            synchronized (this) {
                running--;
                notifyAll();
            }
        }
        pump();
    }

    private record Entry(Runnable task, Runnable onDropped) {
        void dropped() {
            try {
                onDropped.run();
            } catch (RuntimeException e) {
                LOG.error("Drop handler failed: {}", e.getMessage(), e);
            }
        }
    }
}
