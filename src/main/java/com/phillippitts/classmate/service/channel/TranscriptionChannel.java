package com.phillippitts.classmate.service.channel;

import com.phillippitts.classmate.domain.AudioFrame;
import com.phillippitts.classmate.domain.LifecycleEvent;
import com.phillippitts.classmate.domain.TranscriptSegment;
import com.phillippitts.classmate.exception.ChannelClosedException;
import com.phillippitts.classmate.exception.ConnectionException;
import com.phillippitts.classmate.exception.TranscriptProtocolException;
import com.phillippitts.classmate.service.audio.PcmFormat;
import com.phillippitts.classmate.service.bus.EventBus;
import com.phillippitts.classmate.service.bus.Topic;
import com.phillippitts.classmate.service.metrics.PipelineMetrics;
import com.phillippitts.classmate.util.Backoff;
import com.phillippitts.classmate.util.LogSanitizer;
import com.phillippitts.classmate.util.ThreadTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Handle on one open streaming transcription for a session.
 *
 * <p>The audio pump calls {@link #sendAudio}; backend messages are pushed into a bounded
 * inbox and drained by a dedicated receiver thread, which normalizes them and publishes
 * {@link TranscriptSegment}s on {@link Topic#TRANSCRIPT_SEGMENT}.
 *
 * <p>Every backend connection is a new recognition task: it numbers sentences from 1 and
 * starts its clock at 0. Segments are therefore mapped onto the session timeline per
 * connection. Ids of the second and later connections are prefixed ({@code c2-s-1}), and
 * times are shifted by the audio already sent to earlier connections (never less than the
 * end of the last published final).
 *
 * <p>Segment rules enforced on the receiver thread, after that mapping:
 * <ul>
 *   <li>Partials are published as-is; consumers replace a partial by id.</li>
 *   <li>A final already emitted (same id, or same start and text) is never republished.
 *       Right after a reconnect, finals repeating the text of the last finals before the
 *       drop are suppressed as replays.</li>
 *   <li>A final starting before the previous final is a protocol error: dropped and counted.</li>
 *   <li>A partial starting before the last final, or for an already finalized id, is dropped.</li>
 *   <li>Messages from a replaced connection are ignored.</li>
 * </ul>
 *
 * <p>On a transient failure the channel buffers frames (dropping the oldest when full) and
 * reconnects with exponential backoff. Exhausting the attempts publishes
 * {@link LifecycleEvent.Kind#CHANNEL_DEGRADED}; a successful reconnect publishes
 * {@link LifecycleEvent.Kind#CHANNEL_RECOVERED} and flushes the buffer.
 */
public class TranscriptionChannel {

    private static final Logger LOG = LogManager.getLogger(TranscriptionChannel.class);
    private static final long INBOX_OFFER_TIMEOUT_MS = 1_000;
    private static final long RECEIVER_POLL_MS = 50;
    private static final int REPLAY_WINDOW = 3;

    enum State { CONNECTED, RECONNECTING, DEGRADED, CLOSED }

    private final ChannelConfig config;
    private final TranscriptionBackend backend;
    private final EventBus bus;
    private final PipelineMetrics metrics;
    private final TaskScheduler scheduler;
    private final Backoff reconnectBackoff;
    private final Duration drainTimeout;
    private final FrameBuffer buffer;
    private final BlockingQueue<Inbound> inbox;

    private final ReentrantLock sendLock = new ReentrantLock();
    private final Object stateLock = new Object();
    private final AtomicBoolean closing = new AtomicBoolean(false);
    private final CountDownLatch completed = new CountDownLatch(1);
    private final AtomicLong protocolErrors = new AtomicLong();
    private final AtomicLong sentAudioBytes = new AtomicLong();
    private final AtomicInteger generations = new AtomicInteger();
    private final Thread receiver;

    private volatile BackendConnection connection;
    private volatile State state;
    private volatile boolean receiving = true;
    private volatile int liveGeneration;
    private ScheduledFuture<?> pendingReconnect;

    // Receiver-thread state
    private final Set<String> emittedFinalIds = new HashSet<>();
    private final Set<String> emittedFinalKeys = new HashSet<>();
    private final Deque<String> recentFinalTexts = new ArrayDeque<>();
    private long lastFinalStartMs = -1;
    private long lastFinalEndMs;
    private int epochGeneration;
    private long epochOffsetMs;
    private boolean awaitingFreshFinal;

    TranscriptionChannel(ChannelConfig config,
                         TranscriptionBackend backend,
                         EventBus bus,
                         PipelineMetrics metrics,
                         TaskScheduler scheduler,
                         Backoff reconnectBackoff,
                         Duration drainTimeout,
                         int bufferFrames,
                         int inboxCapacity) {
        this.config = config;
        this.backend = backend;
        this.bus = bus;
        this.metrics = metrics;
        this.scheduler = scheduler;
        this.reconnectBackoff = reconnectBackoff;
        this.drainTimeout = drainTimeout;
        this.buffer = new FrameBuffer(bufferFrames);
        this.inbox = new LinkedBlockingQueue<>(inboxCapacity);
        this.receiver = new Thread(this::receiveLoop, "transcript-receiver");
        this.receiver.setDaemon(true);
    }

    /**
     * Connects to the backend and starts the receiver thread.
     *
     * @throws ConnectionException if the first connection attempt fails
     */
    void open() {
        this.connection = connect();
        this.state = State.CONNECTED;
        receiver.start();
        LOG.info("Transcription channel open (backend={})", backend.name());
    }

    /**
     * Forwards one audio frame. While the backend is unreachable, frames are buffered.
     *
     * @throws ChannelClosedException if the channel was closed
     */
    public void sendAudio(AudioFrame frame) {
        if (closing.get()) {
            throw new ChannelClosedException("Transcription channel is closed");
        }
        sendLock.lock();
        try {
            if (state != State.CONNECTED) {
                buffer.add(frame);
                return;
            }
            try {
                connection.sendAudio(frame.pcm());
                sentAudioBytes.addAndGet(frame.size());
            } catch (ConnectionException e) {
                buffer.add(frame);
                LOG.warn("Audio send failed, reconnecting: {}", e.getMessage());
                connectionLost(e.getMessage());
            }
        } finally {
            sendLock.unlock();
        }
    }

    /**
     * Gracefully closes the channel: flushes buffered frames, asks the backend to stop, waits
     * up to the drain timeout for its completion signal, drains received messages and stops
     * the receiver. Idempotent.
     */
    public void close() {
        if (!closing.compareAndSet(false, true)) {
            return;
        }
        cancelPendingReconnect();
        State atClose = state;
        sendLock.lock();
        try {
            if (atClose == State.CONNECTED) {
                flushBuffer();
            }
            if (state == State.CONNECTED) {
                try {
                    connection.requestStop();
                } catch (ConnectionException e) {
                    LOG.warn("Stop request failed: {}", e.getMessage());
                    completed.countDown();
                }
            } else {
                LOG.warn("Closing channel while {}; {} buffered frames discarded", state, buffer.size());
                buffer.clear();
                completed.countDown();
            }
        } finally {
            sendLock.unlock();
        }
        awaitCompletion();
        BackendConnection current = connection;
        if (current != null) {
            current.close();
        }
        receiving = false;
        joinReceiver();
        state = State.CLOSED;
        bus.publish(Topic.SESSION_LIFECYCLE, LifecycleEvent.of(config.sessionId(),
                LifecycleEvent.Kind.TRANSCRIPTION_COMPLETED, protocolErrors.get() + " protocol errors"));
        LOG.info("Transcription channel closed");
    }

    public boolean isOpen() {
        return !closing.get();
    }

    public boolean isDegraded() {
        return state == State.DEGRADED;
    }

    State state() {
        return state;
    }

    int bufferedFrames() {
        return buffer.size();
    }

    long protocolErrors() {
        return protocolErrors.get();
    }

    /**
     * Opens a backend connection tagged with the next generation. Audio sent so far marks
     * where the new connection's clock starts on the session timeline.
     */
    private BackendConnection connect() {
        int generation = generations.incrementAndGet();
        long audioOffsetMs = sentAudioBytes.get() * 1000L / ((long) config.sampleRate() * PcmFormat.BLOCK_ALIGN);
        liveGeneration = generation;
        return backend.connect(config, message -> enqueue(new Inbound(generation, audioOffsetMs, message)));
    }

    private void enqueue(Inbound inbound) {
        BackendMessage message = inbound.message();
        try {
            if (!inbox.offer(inbound, INBOX_OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                LOG.warn("Transcription inbox full; dropping {} message", message.type());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while queuing {} message", message.type());
        }
    }

    private void receiveLoop() {
        ThreadContext.put("sessionId", config.sessionId().toString());
        try {
            while (receiving || !inbox.isEmpty()) {
                Inbound message;
                try {
                    message = inbox.poll(RECEIVER_POLL_MS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (message != null) {
                    handle(message);
                }
            }
        } finally {
            ThreadContext.clearAll();
        }
    }

    private void handle(Inbound inbound) {
        BackendMessage message = inbound.message();
        if (message.isSegment()) {
            if (!enterEpoch(inbound)) {
                metrics.incrementSegmentDropped("stale_connection");
                LOG.debug("Ignored segment {} from replaced connection {}", message.segmentId(),
                        inbound.generation());
                return;
            }
            accept(rebase(message.toSegment(), inbound.generation()));
            return;
        }
        if (inbound.generation() != liveGeneration) {
            LOG.debug("Ignored {} from replaced connection {}", message.type(), inbound.generation());
            return;
        }
        switch (message.type()) {
            case COMPLETED -> completed.countDown();
            case ERROR -> {
                LOG.warn("Transcription backend reported an error: {}", message.text());
                if (closing.get()) {
                    completed.countDown();
                } else {
                    connectionLost(message.text());
                }
            }
            case DISCONNECTED -> {
                if (closing.get()) {
                    completed.countDown();
                } else {
                    LOG.warn("Transcription backend disconnected: {}", message.text());
                    connectionLost(message.text());
                }
            }
            default -> LOG.debug("Unexpected {} message", message.type());
        }
    }

    /**
     * Switches the receiver to a newer connection when its first segment arrives.
     *
     * @return false if the segment belongs to a connection that was already replaced
     */
    private boolean enterEpoch(Inbound inbound) {
        if (inbound.generation() < epochGeneration) {
            return false;
        }
        if (inbound.generation() > epochGeneration) {
            boolean reconnected = epochGeneration > 0;
            epochGeneration = inbound.generation();
            epochOffsetMs = Math.max(inbound.audioOffsetMs(), lastFinalEndMs);
            awaitingFreshFinal = reconnected && !recentFinalTexts.isEmpty();
            if (reconnected) {
                LOG.info("Transcription stream restarted: connection {}, timeline offset {} ms",
                        epochGeneration, epochOffsetMs);
            }
        }
        return true;
    }

    private TranscriptSegment rebase(TranscriptSegment segment, int generation) {
        if (generation == 1 && epochOffsetMs == 0) {
            return segment;
        }
        String id = generation == 1 ? segment.id() : "c" + generation + "-" + segment.id();
        return new TranscriptSegment(id, segment.startMs() + epochOffsetMs, segment.endMs() + epochOffsetMs,
                segment.text(), segment.isFinal(), segment.language(), segment.speakerId());
    }

    private boolean isReplay(TranscriptSegment segment) {
        if (!awaitingFreshFinal) {
            return false;
        }
        if (recentFinalTexts.contains(normalize(segment.text()))) {
            return true;
        }
        awaitingFreshFinal = false;
        return false;
    }

    private void remember(TranscriptSegment segment) {
        recentFinalTexts.addLast(normalize(segment.text()));
        while (recentFinalTexts.size() > REPLAY_WINDOW) {
            recentFinalTexts.removeFirst();
        }
    }

    private static String normalize(String text) {
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private void accept(TranscriptSegment segment) {
        if (segment.isFinal()) {
            String key = segment.startMs() + "|" + segment.text();
            if (emittedFinalIds.contains(segment.id()) || emittedFinalKeys.contains(key) || isReplay(segment)) {
                metrics.incrementSegmentDropped("duplicate");
                LOG.debug("Suppressed duplicate final {}", segment.id());
                return;
            }
            if (segment.startMs() < lastFinalStartMs) {
                TranscriptProtocolException error = new TranscriptProtocolException(
                        "Final starts at " + segment.startMs() + "ms before previous final at "
                                + lastFinalStartMs + "ms", segment.id());
                protocolErrors.incrementAndGet();
                metrics.incrementSegmentDropped("out_of_order");
                LOG.warn("Dropping segment: {}", error.getMessage());
                return;
            }
            emittedFinalIds.add(segment.id());
            emittedFinalKeys.add(key);
            lastFinalStartMs = segment.startMs();
            lastFinalEndMs = Math.max(lastFinalEndMs, segment.endMs());
            remember(segment);
            LOG.debug("Final {} [{}-{}ms]: {}", segment.id(), segment.startMs(), segment.endMs(),
                    LogSanitizer.preview(segment.text()));
        } else if (segment.startMs() < lastFinalStartMs || emittedFinalIds.contains(segment.id())) {
            metrics.incrementSegmentDropped("stale_partial");
            LOG.debug("Dropped stale partial {}", segment.id());
            return;
        }
        metrics.incrementSegment(segment.isFinal());
        bus.publish(Topic.TRANSCRIPT_SEGMENT, segment);
    }

    private void connectionLost(String reason) {
        synchronized (stateLock) {
            if (state != State.CONNECTED || closing.get()) {
                return;
            }
            state = State.RECONNECTING;
            BackendConnection broken = connection;
            if (broken != null) {
                broken.close();
            }
            LOG.warn("Transcription connection lost ({}); reconnecting", reason);
            scheduleReconnect(0);
        }
    }

    private void scheduleReconnect(int attempt) {
        Duration delay = reconnectBackoff.delayFor(attempt);
        pendingReconnect = scheduler.schedule(() -> tryReconnect(attempt), Instant.now().plus(delay));
    }

    private void tryReconnect(int attempt) {
        synchronized (stateLock) {
            if (state != State.RECONNECTING || closing.get()) {
                return;
            }
        }
        BackendConnection fresh;
        try {
            fresh = connect();
        } catch (ConnectionException e) {
            reconnectFailed(attempt, e.getMessage());
            return;
        }
        sendLock.lock();
        try {
            connection = fresh;
            if (!flushBuffer()) {
                fresh.close();
                reconnectFailed(attempt, "flush failed");
                return;
            }
            synchronized (stateLock) {
                state = State.CONNECTED;
            }
        } finally {
            sendLock.unlock();
        }
        metrics.incrementReconnect("success");
        LOG.info("Transcription connection recovered after {} attempt(s)", attempt + 1);
        bus.publish(Topic.SESSION_LIFECYCLE, LifecycleEvent.of(config.sessionId(),
                LifecycleEvent.Kind.CHANNEL_RECOVERED, "attempt " + (attempt + 1)));
    }

    private void reconnectFailed(int attempt, String reason) {
        metrics.incrementReconnect("failure");
        int made = attempt + 1;
        synchronized (stateLock) {
            if (closing.get()) {
                return;
            }
            if (reconnectBackoff.allowsAnother(made)) {
                LOG.warn("Reconnect attempt {} failed: {}", made, reason);
                scheduleReconnect(made);
                return;
            }
            state = State.DEGRADED;
        }
        metrics.incrementReconnect("exhausted");
        LOG.error("Transcription backend unreachable after {} attempts; buffering audio locally", made);
        bus.publish(Topic.SESSION_LIFECYCLE, LifecycleEvent.of(config.sessionId(),
                LifecycleEvent.Kind.CHANNEL_DEGRADED, "reconnect attempts exhausted: " + reason));
    }

    /**
     * Sends buffered frames in order. Caller holds {@link #sendLock}.
     *
     * @return false if a send failed; unsent frames are put back
     */
    private boolean flushBuffer() {
        List<AudioFrame> pending = buffer.drain();
        for (int i = 0; i < pending.size(); i++) {
            try {
                connection.sendAudio(pending.get(i).pcm());
                sentAudioBytes.addAndGet(pending.get(i).size());
            } catch (ConnectionException e) {
                buffer.requeue(pending.subList(i, pending.size()));
                LOG.warn("Flushing buffered audio failed after {} frames: {}", i, e.getMessage());
                return false;
            }
        }
        if (!pending.isEmpty()) {
            LOG.info("Flushed {} buffered audio frames", pending.size());
        }
        return true;
    }

    private void cancelPendingReconnect() {
        synchronized (stateLock) {
            if (pendingReconnect != null) {
                pendingReconnect.cancel(false);
            }
        }
    }

    private void awaitCompletion() {
        try {
            if (!completed.await(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Backend did not confirm completion within {} ms", drainTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Backend message tagged with the connection that produced it. */
    private record Inbound(int generation, long audioOffsetMs, BackendMessage message) {}

    private void joinReceiver() {
        try {
            receiver.join(ThreadTimeouts.RECEIVER_STOP_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (receiver.isAlive()) {
            LOG.warn("Receiver thread did not stop within {} ms", ThreadTimeouts.RECEIVER_STOP_TIMEOUT.toMillis());
        }
    }
}
