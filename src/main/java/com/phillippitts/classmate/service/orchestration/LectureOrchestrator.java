package com.phillippitts.classmate.service.orchestration;

import com.phillippitts.classmate.config.properties.AnalysisProperties;
import com.phillippitts.classmate.domain.LifecycleEvent;
import com.phillippitts.classmate.domain.Session;
import com.phillippitts.classmate.domain.SessionState;
import com.phillippitts.classmate.exception.InvalidStateTransitionException;
import com.phillippitts.classmate.service.analysis.AnalysisEngine;
import com.phillippitts.classmate.service.analysis.AnalysisSession;
import com.phillippitts.classmate.service.audio.AudioSource;
import com.phillippitts.classmate.service.audio.AudioSourceFactory;
import com.phillippitts.classmate.service.bus.EventBus;
import com.phillippitts.classmate.service.bus.Topic;
import com.phillippitts.classmate.service.channel.TranscriptionChannel;
import com.phillippitts.classmate.service.channel.TranscriptionChannelFactory;
import com.phillippitts.classmate.service.materials.MaterialsProvider;
import com.phillippitts.classmate.service.orchestration.SessionStateMachine.Action;
import com.phillippitts.classmate.service.store.SessionRecorder;
import com.phillippitts.classmate.service.store.SessionStore;
import com.phillippitts.classmate.service.store.StoredSession;
import com.phillippitts.classmate.util.ThreadTimeouts;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Owns the lifecycle of the single listening session and wires the pipeline for it:
 * audio source → transcription channel → event bus → analyzers and session store.
 *
 * <p>Lifecycle calls are serialized by one lock. A rejected transition throws
 * {@link InvalidStateTransitionException} before anything is touched. A failed
 * {@link #start()} releases whatever it had acquired and leaves the session CREATED.
 *
 * <p>Shutdown order at {@link #end()}: stop the audio pump, cancel tickers, close the channel
 * (drains late finals), finish the analyzers (flushes the last summary window), wait for the
 * bus to quiesce, publish ENDED, finalize persistence.
 */
@Component
public class LectureOrchestrator {

    private static final Logger LOG = LogManager.getLogger(LectureOrchestrator.class);
    private static final String MDC_SESSION = "sessionId";

    private final SessionStateMachine states = new SessionStateMachine();
    private final ReentrantLock lifecycleLock = new ReentrantLock();

    private final AudioSourceFactory audioSources;
    private final TranscriptionChannelFactory channels;
    private final AnalysisEngine analysisEngine;
    private final SessionStore store;
    private final MaterialsProvider materials;
    private final EventBus bus;
    private final TaskScheduler scheduler;

    // Guarded by lifecycleLock
    private Pipeline pipeline;

    public LectureOrchestrator(AudioSourceFactory audioSources,
                               TranscriptionChannelFactory channels,
                               AnalysisEngine analysisEngine,
                               SessionStore store,
                               MaterialsProvider materials,
                               EventBus bus,
                               @Qualifier("pipelineScheduler") TaskScheduler scheduler) {
        this.audioSources = audioSources;
        this.channels = channels;
        this.analysisEngine = analysisEngine;
        this.store = store;
        this.materials = materials;
        this.bus = bus;
        this.scheduler = scheduler;
    }

    /**
     * Creates a new session in state CREATED.
     *
     * @throws InvalidStateTransitionException if another session is running
     */
    public Session create(String name, String description, List<String> materialsRefs) {
        lifecycleLock.lock();
        try {
            Session session = Session.create(name, description, materialsRefs);
            states.install(session);
            LOG.info("Session created: id={}, name='{}', materials={}", session.id(), session.name(),
                    session.materialsRefs().size());
            return session;
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Starts capture, transcription, analysis and recording.
     *
     * @throws InvalidStateTransitionException if the session is not CREATED
     * @throws com.phillippitts.classmate.exception.ConnectionException if the transcription
     *         backend cannot be reached; the session stays CREATED
     * @throws com.phillippitts.classmate.exception.AudioCaptureException if the microphone
     *         cannot be opened; the session stays CREATED
     */
    public Session start() {
        lifecycleLock.lock();
        try {
            Session session = states.require(Action.START);
            ThreadContext.put(MDC_SESSION, session.id().toString());
            Path directory = store.prepare(session);
            TranscriptionChannel channel = null;
            AudioSource audio = null;
            SessionRecorder recorder = null;
            try {
                String materialsText = materials.load(session.materialsRefs());
                channel = channels.open(channels.configFor(session.id()));
                audio = audioSources.create();
                audio.open();
                recorder = store.attach(session, directory);
                AnalysisSession analysis = analysisEngine.open(session.id(), materialsText);
                Session active = states.transition(Action.START);

                Pipeline p = new Pipeline(channel, recorder, analysis,
                        new AudioPump(session.id(), audio, channel, bus));
                p.pump.start();
                scheduleTickers(p);
                pipeline = p;

                bus.publish(Topic.SESSION_LIFECYCLE, LifecycleEvent.of(active.id(), LifecycleEvent.Kind.STARTED,
                        "backend=" + channels.backendName()));
                recorder.updateSession(active);
                LOG.info("Session started: {}", directory);
                return active;
            } catch (RuntimeException e) {
                LOG.warn("Session start aborted: {}", e.getMessage());
                if (audio != null) {
                    audio.close();
                }
                if (channel != null) {
                    step("close transcription channel", channel::close);
                }
                if (recorder != null) {
                    SessionRecorder attached = recorder;
                    step("detach session records", () -> attached.finalizeSession(session));
                }
                step("discard session directory", () -> store.discard(directory));
                throw e;
            }
        } finally {
            ThreadContext.remove(MDC_SESSION);
            lifecycleLock.unlock();
        }
    }

    /** Stops forwarding audio and drops queued analyzer work. The channel stays open. */
    public Session pause() {
        lifecycleLock.lock();
        try {
            states.require(Action.PAUSE);
            pipeline.pump.setPaused(true);
            pipeline.analysis.pause();
            Session paused = states.transition(Action.PAUSE);
            bus.publish(Topic.SESSION_LIFECYCLE, LifecycleEvent.of(paused.id(), LifecycleEvent.Kind.PAUSED, null));
            pipeline.recorder.updateSession(paused);
            LOG.info("Session paused");
            return paused;
        } finally {
            lifecycleLock.unlock();
        }
    }

    public Session resume() {
        lifecycleLock.lock();
        try {
            states.require(Action.RESUME);
            pipeline.pump.setPaused(false);
            Session active = states.transition(Action.RESUME);
            bus.publish(Topic.SESSION_LIFECYCLE, LifecycleEvent.of(active.id(), LifecycleEvent.Kind.RESUMED, null));
            pipeline.recorder.updateSession(active);
            LOG.info("Session resumed");
            return active;
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Ends the session and finalizes its records. Each shutdown step runs even if an earlier
     * one failed.
     */
    public Session end() {
        lifecycleLock.lock();
        try {
            Session current = states.require(Action.END);
            ThreadContext.put(MDC_SESSION, current.id().toString());
            Pipeline p = pipeline;
            long started = System.nanoTime();

            p.pump.stop(ThreadTimeouts.CAPTURE_THREAD_STOP_TIMEOUT);
            p.tickers.forEach(t -> t.cancel(false));
            step("close transcription channel", p.channel::close);
            if (!bus.awaitQuiescence()) {
                LOG.warn("Event bus did not quiesce after channel close");
            }
            Duration stopTimeout = Duration.ofMillis(analysisEngine.properties().getStopTimeoutMs());
            step("finish analysis", () -> p.analysis.finish(stopTimeout));
            bus.awaitQuiescence();

            Session ended = states.transition(Action.END);
            bus.publish(Topic.SESSION_LIFECYCLE, LifecycleEvent.of(ended.id(), LifecycleEvent.Kind.ENDED,
                    p.analysis.finalSegmentCount() + " segments"));
            bus.awaitQuiescence();
            step("finalize session records", () -> p.recorder.finalizeSession(ended));

            pipeline = null;
            LOG.info("Session {} ended in {} ms ({} segments)", current.id(),
                    Duration.ofNanos(System.nanoTime() - started).toMillis(), p.analysis.finalSegmentCount());
            return ended;
        } finally {
            ThreadContext.remove(MDC_SESSION);
            lifecycleLock.unlock();
        }
    }

    /**
     * Summarizes the transcript since the last window.
     *
     * @throws com.phillippitts.classmate.exception.NothingToAnalyzeException if there is no
     *         new transcript
     */
    public boolean requestSummary() {
        return withRunning("summarize", p -> p.analysis.requestSummary());
    }

    public boolean requestSuggestion() {
        return withRunning("suggest", p -> p.analysis.requestSuggestion());
    }

    public boolean requestIdeas() {
        return withRunning("generate ideas for", p -> p.analysis.requestIdeas());
    }

    /**
     * Produces a superseding answer for a detected question.
     *
     * @throws com.phillippitts.classmate.exception.UnknownQuestionException if the running
     *         session never detected that question
     */
    public boolean regenerateAnswer(String questionId) {
        return withRunning("regenerate an answer in", p -> p.analysis.regenerateAnswer(questionId));
    }

    public Optional<Session> current() {
        return states.current();
    }

    public List<StoredSession> listSessions() {
        return store.listSessions();
    }

    /** True while a started session has not ended. */
    public boolean isRunning() {
        return states.isIn(SessionState.ACTIVE) || states.isIn(SessionState.PAUSED);
    }

    @PreDestroy
    public void shutdown() {
        if (isRunning()) {
            LOG.info("Application stopping; ending running session");
            try {
                end();
            } catch (RuntimeException e) {
                LOG.warn("Session did not end cleanly on shutdown: {}", e.getMessage());
            }
        }
    }

    private boolean withRunning(String action, Predicate<Pipeline> call) {
        lifecycleLock.lock();
        try {
            Session session = states.current().orElseThrow(() -> new InvalidStateTransitionException(action));
            if (session.state() != SessionState.ACTIVE && session.state() != SessionState.PAUSED) {
                throw new InvalidStateTransitionException(session.state(), action);
            }
            return call.test(pipeline);
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void scheduleTickers(Pipeline p) {
        AnalysisProperties props = analysisEngine.properties();
        p.tickers.add(scheduler.scheduleAtFixedRate(() -> {
            if (!p.pump.isPaused()) {
                p.analysis.onSummaryStallTick();
            }
        }, Duration.ofMillis(props.getSummary().getStallCheckMs())));
        if (props.getSuggestion().isAutoEnabled()) {
            p.tickers.add(scheduler.scheduleAtFixedRate(() -> {
                if (!p.pump.isPaused()) {
                    p.analysis.onSuggestionTick();
                }
            }, Duration.ofMillis(props.getSuggestion().getIntervalMs())));
        }
    }

    private static void step(String name, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOG.error("Shutdown step '{}' failed", name, e);
        }
    }

    /** Per-session pipeline resources. */
    private static final class Pipeline {
        final TranscriptionChannel channel;
        final SessionRecorder recorder;
        final AnalysisSession analysis;
        final AudioPump pump;
        final List<ScheduledFuture<?>> tickers = new ArrayList<>();

        Pipeline(TranscriptionChannel channel, SessionRecorder recorder, AnalysisSession analysis,
                 AudioPump pump) {
            this.channel = channel;
            this.recorder = recorder;
            this.analysis = analysis;
            this.pump = pump;
        }
    }
}
