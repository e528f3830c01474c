package com.phillippitts.classmate.service.store;

import com.phillippitts.classmate.config.MdcTaskDecorator;
import com.phillippitts.classmate.config.properties.SessionStoreProperties;
import com.phillippitts.classmate.domain.AnswerEvent;
import com.phillippitts.classmate.domain.LifecycleEvent;
import com.phillippitts.classmate.domain.QuestionEvent;
import com.phillippitts.classmate.domain.Session;
import com.phillippitts.classmate.domain.TranscriptSegment;
import com.phillippitts.classmate.exception.PersistenceException;
import com.phillippitts.classmate.service.bus.EventBus;
import com.phillippitts.classmate.service.bus.Subscription;
import com.phillippitts.classmate.service.bus.Topic;
import com.phillippitts.classmate.service.metrics.PipelineMetrics;
import com.phillippitts.classmate.util.Backoff;
import com.phillippitts.classmate.util.ThreadTimeouts;
import com.phillippitts.classmate.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Persists one session while it is attached. Every bus event is handed to a single writer
 * thread, so record files are only ever touched by one thread.
 *
 * <p>Append-only records ({@code realtime.jsonl}, {@code events.jsonl}) get one write per line.
 * Collections ({@code questions.json} and friends) and {@code meta.json} are rewritten through
 * a temp file and an atomic move. A write that keeps failing is logged, counted and reported
 * once as {@link LifecycleEvent.Kind#PERSISTENCE_DEGRADED}; capture carries on.
 */
public final class SessionRecorder {

    private static final Logger LOG = LogManager.getLogger(SessionRecorder.class);

    @FunctionalInterface
    private interface IoAction {
        void run() throws IOException;
    }

    private final SessionFiles files;
    private final EventBus bus;
    private final PipelineMetrics metrics;
    private final SessionStoreProperties properties;
    private final Backoff retryBackoff;
    private final ThreadPoolTaskExecutor writer;
    private final List<Subscription> subscriptions = new ArrayList<>();

    // Writer-thread state
    private Session session;
    private final List<TranscriptSegment> finals = new ArrayList<>();
    private final Set<String> finalIds = new HashSet<>();
    private final Map<String, JSONObject> questions = new LinkedHashMap<>();
    private final Map<String, AnswerEvent> unmatchedAnswers = new HashMap<>();
    private final JSONArray summaries = new JSONArray();
    private final JSONArray suggestions = new JSONArray();
    private final JSONArray ideas = new JSONArray();
    private boolean degraded;

    private volatile boolean closed;

    SessionRecorder(Session session, SessionFiles files, EventBus bus, PipelineMetrics metrics,
                    SessionStoreProperties properties) {
        this.session = session;
        this.files = files;
        this.bus = bus;
        this.metrics = metrics;
        this.properties = properties;
        this.retryBackoff = Backoff.ofMillis(properties.getRetryBackoffMs(),
                Math.max(properties.getRetryBackoffMs(), properties.getRetryBackoffMs() * 8),
                properties.getWriteAttempts());
        this.writer = new ThreadPoolTaskExecutor();
        writer.setCorePoolSize(1);
        writer.setMaxPoolSize(1);
        writer.setThreadNamePrefix("session-writer-");
        writer.setWaitForTasksToCompleteOnShutdown(true);
        writer.setAwaitTerminationSeconds((int) ThreadTimeouts.WRITER_FLUSH_TIMEOUT.toSeconds());
        writer.setTaskDecorator(new MdcTaskDecorator());
        writer.initialize();
    }

    void attach() {
        subscribe(Topic.TRANSCRIPT_SEGMENT, this::onSegment);
        subscribe(Topic.QUESTION_DETECTED, this::onQuestion);
        subscribe(Topic.ANSWER_GENERATED, this::onAnswer);
        subscribe(Topic.SUMMARY_GENERATED, s -> appendToCollection(SessionFiles.SUMMARIES, summaries,
                SessionRecords.summary(s)));
        subscribe(Topic.SUGGESTION_GENERATED, s -> appendToCollection(SessionFiles.SUGGESTIONS, suggestions,
                SessionRecords.suggestion(s)));
        subscribe(Topic.IDEA_GENERATED, i -> appendToCollection(SessionFiles.IDEAS, ideas,
                SessionRecords.ideas(i)));
        subscribe(Topic.SESSION_LIFECYCLE, this::onLifecycle);
        subscribe(Topic.ANALYSIS_FAILED, f -> write(SessionFiles.EVENTS,
                () -> files.appendLine(SessionFiles.EVENTS, SessionRecords.failure(f))));
        if (properties.isSaveAudio()) {
            subscribe(Topic.AUDIO_FRAME, frame -> write(SessionFiles.AUDIO,
                    () -> files.appendBytes(SessionFiles.AUDIO, frame.pcm())));
        }
        submit(this::writeMeta);
    }

    /** Rewrites {@code meta.json} after a state transition. */
    public void updateSession(Session updated) {
        submit(() -> {
            session = updated;
            writeMeta();
        });
    }

    /**
     * Detaches from the bus, writes the consolidated transcript and the final metadata, then
     * waits for the writer to drain. Call after the bus has quiesced.
     */
    public void finalizeSession(Session ended) {
        if (closed) {
            return;
        }
        subscriptions.forEach(bus::unsubscribe);
        subscriptions.clear();
        submit(() -> {
            session = ended;
            write(SessionFiles.FULL_TRANSCRIPT,
                    () -> files.writeStringAtomic(SessionFiles.FULL_TRANSCRIPT, fullTranscript()));
            writeMeta();
        });
        closed = true;
        // Blocks until queued writes finish or the flush timeout passes
        writer.shutdown();
        LOG.info("Session records finalized in {}", files.root());
    }

    public Path directory() {
        return files.root();
    }

    public boolean isClosed() {
        return closed;
    }

    private <T> void subscribe(Topic<T> topic, Consumer<T> handler) {
        subscriptions.add(bus.subscribe(topic, "store:" + topic.name(), event -> submit(() -> handler.accept(event))));
    }

    private void submit(Runnable task) {
        if (closed) {
            LOG.debug("Session writer closed; dropping record");
            return;
        }
        try {
            writer.execute(task);
        } catch (TaskRejectedException e) {
            LOG.warn("Session writer rejected a record: {}", e.getMessage());
        }
    }

    private void onSegment(TranscriptSegment segment) {
        if (!segment.isFinal() || !finalIds.add(segment.id())) {
            return;
        }
        finals.add(segment);
        write(SessionFiles.REALTIME, () -> files.appendLine(SessionFiles.REALTIME, SessionRecords.segment(segment)));
    }

    private void onQuestion(QuestionEvent question) {
        JSONObject record = SessionRecords.question(question);
        AnswerEvent early = unmatchedAnswers.remove(question.id());
        if (early != null) {
            record.put("answer", SessionRecords.answer(early));
        }
        questions.put(question.id(), record);
        writeQuestions();
    }

    private void onAnswer(AnswerEvent answer) {
        JSONObject question = questions.get(answer.questionEventId());
        if (question == null) {
            // Topics are not ordered against each other; keep until the question arrives
            unmatchedAnswers.merge(answer.questionEventId(), answer,
                    (a, b) -> a.revision() >= b.revision() ? a : b);
            return;
        }
        JSONObject current = question.optJSONObject("answer");
        if (current != null && current.optInt("revision", 0) > answer.revision()) {
            return;
        }
        question.put("answer", SessionRecords.answer(answer));
        writeQuestions();
    }

    private void onLifecycle(LifecycleEvent event) {
        write(SessionFiles.EVENTS, () -> files.appendLine(SessionFiles.EVENTS, SessionRecords.lifecycle(event)));
    }

    private void writeQuestions() {
        JSONArray array = new JSONArray();
        questions.values().forEach(array::put);
        write(SessionFiles.QUESTIONS, () -> files.writeJsonAtomic(SessionFiles.QUESTIONS, array));
    }

    private void appendToCollection(String record, JSONArray collection, JSONObject item) {
        collection.put(item);
        write(record, () -> files.writeJsonAtomic(record, collection));
    }

    private void writeMeta() {
        JSONObject meta = SessionRecords.meta(session, finals.size());
        write(SessionFiles.META, () -> files.writeJsonAtomic(SessionFiles.META, meta));
    }

    private String fullTranscript() {
        StringBuilder out = new StringBuilder();
        for (TranscriptSegment segment : finals) {
            out.append('[').append(TimeUtils.formatOffset(segment.startMs())).append("] ");
            if (!segment.speakerId().isEmpty()) {
                out.append(segment.speakerId()).append(": ");
            }
            out.append(segment.text()).append(System.lineSeparator());
        }
        return out.toString();
    }

    private void write(String record, IoAction action) {
        PersistenceException failure = null;
        for (int attempt = 0; retryBackoff.allowsAnother(attempt); attempt++) {
            if (attempt > 0 && !retryBackoff.sleep(attempt - 1)) {
                break;
            }
            try {
                action.run();
                return;
            } catch (IOException e) {
                failure = new PersistenceException("Write failed", files.resolve(record), e);
                LOG.warn("Write attempt {} for {} failed: {}", attempt + 1, record, e.getMessage());
            }
        }
        metrics.incrementPersistenceFailure(record);
        LOG.error("Giving up on {}: {}", record, failure == null ? "interrupted" : failure.getMessage(), failure);
        if (!degraded) {
            degraded = true;
            bus.publish(Topic.SESSION_LIFECYCLE, LifecycleEvent.of(session.id(),
                    LifecycleEvent.Kind.PERSISTENCE_DEGRADED, "cannot write " + record));
        }
    }
}
