package com.phillippitts.classmate.service.store;

import com.phillippitts.classmate.config.properties.SessionStoreProperties;
import com.phillippitts.classmate.domain.AnswerEvent;
import com.phillippitts.classmate.domain.LifecycleEvent;
import com.phillippitts.classmate.domain.QuestionEvent;
import com.phillippitts.classmate.domain.QuestionKind;
import com.phillippitts.classmate.domain.Session;
import com.phillippitts.classmate.domain.SessionState;
import com.phillippitts.classmate.domain.SummaryEvent;
import com.phillippitts.classmate.domain.TranscriptSegment;
import com.phillippitts.classmate.service.bus.EventBus;
import com.phillippitts.classmate.service.bus.Topic;
import com.phillippitts.classmate.testutil.RecordingSubscriber;
import com.phillippitts.classmate.testutil.TestPipeline;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class SessionStoreTest {

    @TempDir
    Path dataDir;

    private EventBus bus;
    private SessionStore store;
    private SessionStoreProperties props;

    @BeforeEach
    void setUp() {
        bus = TestPipeline.syncBus(TestPipeline.metrics());
        props = new SessionStoreProperties();
        props.setDataDir(dataDir.toString());
        props.setRetryBackoffMs(1);
        store = new SessionStore(props, bus, TestPipeline.metrics());
    }

    private static QuestionEvent question(String id, String segmentId) {
        return new QuestionEvent(id, segmentId, "What is entropy?", Instant.now(), 0.9, QuestionKind.DIRECT,
                List.of(segmentId));
    }

    private static AnswerEvent answer(String questionId, String text, int revision) {
        return new AnswerEvent(questionId, text, Instant.now(), 120, revision, false);
    }

    @Test
    void shouldNameDirectoryAfterDateNameAndShortId() {
        Session session = new Session(UUID.fromString("12345678-9abc-def0-1234-56789abcdef0"), "Thermo Lecture #3",
                "", Instant.parse("2024-03-05T12:00:00Z"), List.of(), SessionState.CREATED);

        String name = SessionStore.directoryName(session);

        assertThat(name).matches("\\d{4}-\\d{2}-\\d{2}_Thermo_Lecture_3_12345678");
    }

    @Test
    void shouldCreateLayoutAndCopyMaterials() throws IOException {
        Path material = Files.writeString(dataDir.resolve("notes.md"), "# Entropy");
        Session session = Session.create("Physics", "", List.of(material.toString(), "/missing/file.txt"));

        Path root = store.prepare(session);

        assertThat(root.resolve("transcripts")).isDirectory();
        assertThat(root.resolve("analysis")).isDirectory();
        assertThat(root.resolve("materials/notes.md")).hasContent("# Entropy");
        assertThat(root.getParent()).isEqualTo(dataDir.toAbsolutePath().normalize());
    }

    @Test
    void shouldRecordTranscriptAndAnalysisUntilFinalized() throws IOException {
        Session session = Session.create("Physics", "week 3", List.of()).withState(SessionState.ACTIVE);
        Path root = store.prepare(session);
        SessionRecorder recorder = store.attach(session, root);

        bus.publish(Topic.TRANSCRIPT_SEGMENT, TranscriptSegment.partialSegment("s-1", 0, 500, "Entro"));
        bus.publish(Topic.TRANSCRIPT_SEGMENT, TranscriptSegment.finalSegment("s-1", 0, 2000, "Entropy rises."));
        bus.publish(Topic.TRANSCRIPT_SEGMENT, TranscriptSegment.finalSegment("s-1", 0, 2000, "Entropy rises."));
        bus.publish(Topic.TRANSCRIPT_SEGMENT, TranscriptSegment.finalSegment("s-2", 65_000, 67_000,
                "What is entropy?"));
        bus.publish(Topic.QUESTION_DETECTED, question("q-1", "s-2"));
        bus.publish(Topic.ANSWER_GENERATED, answer("q-1", "A measure of disorder.", 1));
        bus.publish(Topic.ANSWER_GENERATED, answer("q-1", "Disorder, counted in microstates.", 2));
        bus.publish(Topic.ANSWER_GENERATED, answer("q-2", "Early answer.", 1));
        bus.publish(Topic.QUESTION_DETECTED, question("q-2", "s-1"));
        bus.publish(Topic.SUMMARY_GENERATED, new SummaryEvent(0, 67_000, "Entropy", "Entropy was introduced.",
                List.of("disorder"), List.of("entropy"), 2, Instant.now(), false));
        recorder.finalizeSession(session.withState(SessionState.ENDED));

        List<String> realtime = Files.readAllLines(root.resolve("transcripts/realtime.jsonl"), StandardCharsets.UTF_8);
        assertThat(realtime).hasSize(2);
        assertThat(new JSONObject(realtime.get(1)).getLong("start_ms")).isEqualTo(65_000);

        String transcript = Files.readString(root.resolve("transcripts/full_transcript.txt"));
        assertThat(transcript).contains("[00:00] Entropy rises.").contains("[01:05] What is entropy?");

        JSONArray questions = new JSONArray(Files.readString(root.resolve("analysis/questions.json")));
        assertThat(questions.length()).isEqualTo(2);
        JSONObject first = questions.getJSONObject(0);
        assertThat(first.getJSONObject("answer").getInt("revision")).isEqualTo(2);
        assertThat(first.getJSONObject("answer").getString("text")).isEqualTo("Disorder, counted in microstates.");
        assertThat(questions.getJSONObject(1).getJSONObject("answer").getString("text")).isEqualTo("Early answer.");

        JSONArray summaries = new JSONArray(Files.readString(root.resolve("analysis/summaries.json")));
        assertThat(summaries.getJSONObject(0).getString("title")).isEqualTo("Entropy");

        JSONObject meta = new JSONObject(Files.readString(root.resolve("meta.json")));
        assertThat(meta.getString("state")).isEqualTo("ENDED");
        assertThat(meta.getInt("segment_count")).isEqualTo(2);
        assertThat(meta.getString("description")).isEqualTo("week 3");
        assertThat(recorder.isClosed()).isTrue();
    }

    @Test
    void shouldIgnoreEventsAfterFinalize() throws IOException {
        Session session = Session.create("Physics", "", List.of()).withState(SessionState.ACTIVE);
        Path root = store.prepare(session);
        SessionRecorder recorder = store.attach(session, root);

        recorder.finalizeSession(session.withState(SessionState.ENDED));
        bus.publish(Topic.TRANSCRIPT_SEGMENT, TranscriptSegment.finalSegment("s-1", 0, 1000, "too late"));

        assertThat(root.resolve("transcripts/realtime.jsonl")).doesNotExist();
        assertThat(bus.subscriberCount(Topic.TRANSCRIPT_SEGMENT)).isZero();
    }

    @Test
    void shouldReportPersistenceDegradedOnceWhenWritesKeepFailing() throws IOException {
        RecordingSubscriber<LifecycleEvent> lifecycle = new RecordingSubscriber<>();
        bus.subscribe(Topic.SESSION_LIFECYCLE, lifecycle);
        Session session = Session.create("Physics", "", List.of()).withState(SessionState.ACTIVE);
        Path root = store.prepare(session);
        // A non-empty directory where the questions file belongs makes every rewrite fail
        Files.createDirectories(root.resolve("analysis/questions.json/blocker"));
        SessionRecorder recorder = store.attach(session, root);

        bus.publish(Topic.QUESTION_DETECTED, question("q-1", "s-1"));
        bus.publish(Topic.QUESTION_DETECTED, question("q-2", "s-2"));
        bus.publish(Topic.TRANSCRIPT_SEGMENT, TranscriptSegment.finalSegment("s-1", 0, 1000, "still recorded"));

        await().atMost(Duration.ofSeconds(5)).until(() -> lifecycle.events().stream()
                .anyMatch(e -> e.kind() == LifecycleEvent.Kind.PERSISTENCE_DEGRADED));
        recorder.finalizeSession(session.withState(SessionState.ENDED));
        assertThat(lifecycle.events()).filteredOn(e -> e.kind() == LifecycleEvent.Kind.PERSISTENCE_DEGRADED)
                .hasSize(1);
        assertThat(root.resolve("transcripts/realtime.jsonl")).exists();
    }

    @Test
    void shouldListSessionsNewestFirstAndSkipBrokenEntries() throws IOException {
        Session older = new Session(UUID.randomUUID(), "Older", "", Instant.parse("2024-01-01T10:00:00Z"),
                List.of(), SessionState.ENDED);
        Session newer = new Session(UUID.randomUUID(), "Newer", "", Instant.parse("2024-02-01T10:00:00Z"),
                List.of(), SessionState.ENDED);
        for (Session session : List.of(older, newer)) {
            Path root = store.prepare(session);
            store.attach(session, root).finalizeSession(session);
        }
        Path broken = Files.createDirectories(dataDir.resolve("broken"));
        Files.writeString(broken.resolve("meta.json"), "{not json");

        List<StoredSession> sessions = store.listSessions();

        assertThat(sessions).extracting(StoredSession::name).containsExactly("Newer", "Older");
        assertThat(sessions.get(0).state()).isEqualTo("ENDED");
    }

    @Test
    void shouldReturnEmptyListWhenDataDirMissing() {
        props.setDataDir(dataDir.resolve("nothing-here").toString());

        assertThat(store.listSessions()).isEmpty();
    }
}
