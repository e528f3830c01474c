package com.phillippitts.classmate.service.store;

import com.phillippitts.classmate.config.properties.SessionStoreProperties;
import com.phillippitts.classmate.domain.Session;
import com.phillippitts.classmate.exception.PersistenceException;
import com.phillippitts.classmate.service.bus.EventBus;
import com.phillippitts.classmate.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Durable session records under {@code classmate.store.data-dir}, one directory per session
 * named {@code <yyyy-MM-dd>_<name>_<shortId>}.
 */
@Component
public class SessionStore {

    private static final Logger LOG = LogManager.getLogger(SessionStore.class);
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final int SHORT_ID_LENGTH = 8;

    private final SessionStoreProperties properties;
    private final EventBus bus;
    private final PipelineMetrics metrics;

    public SessionStore(SessionStoreProperties properties, EventBus bus, PipelineMetrics metrics) {
        this.properties = properties;
        this.bus = bus;
        this.metrics = metrics;
    }

    /**
     * Creates the session directory and copies imported materials into it. A material that
     * cannot be copied is skipped with a warning.
     *
     * @throws PersistenceException if the directory cannot be created
     */
    public Path prepare(Session session) {
        Path root = dataDir().resolve(directoryName(session));
        SessionFiles files = new SessionFiles(root);
        try {
            files.createLayout();
        } catch (IOException e) {
            throw new PersistenceException("Cannot create session directory", root, e);
        }
        for (String ref : session.materialsRefs()) {
            Path source = Paths.get(ref);
            if (!Files.isRegularFile(source)) {
                LOG.warn("Material not found, not copied: {}", ref);
                continue;
            }
            try {
                Files.copy(source, files.resolve(SessionFiles.MATERIALS_DIR).resolve(source.getFileName()),
                        StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                LOG.warn("Cannot copy material {}: {}", ref, e.getMessage());
            }
        }
        LOG.info("Session directory ready: {}", root);
        return root;
    }

    /** Starts recording bus events for the session into its prepared directory. */
    /**
     * Removes a prepared session directory after an aborted start. Files that cannot be
     * deleted are logged and left in place.
     */
    public void discard(Path directory) {
        if (!Files.isDirectory(directory)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(directory)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            LOG.warn("Cannot list aborted session directory {}: {}", directory, e.getMessage());
            return;
        }
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                LOG.warn("Cannot delete {}: {}", path, e.getMessage());
            }
        }
        LOG.info("Discarded session directory of aborted start: {}", directory);
    }

    public SessionRecorder attach(Session session, Path directory) {
        SessionRecorder recorder = new SessionRecorder(session, new SessionFiles(directory), bus, metrics,
                properties);
        recorder.attach();
        return recorder;
    }

    /**
     * Reads every {@code meta.json} under the data directory, newest first. Unreadable
     * entries are skipped.
     */
    public List<StoredSession> listSessions() {
        List<StoredSession> sessions = new ArrayList<>();
        Path dir = dataDir();
        if (!Files.isDirectory(dir)) {
            return sessions;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir, Files::isDirectory)) {
            for (Path entry : entries) {
                Path meta = entry.resolve(SessionFiles.META);
                if (!Files.isRegularFile(meta)) {
                    continue;
                }
                try {
                    JSONObject json = new JSONObject(Files.readString(meta));
                    sessions.add(new StoredSession(json.optString("id"), json.optString("name"),
                            json.optString("state"), Instant.parse(json.getString("created_at")),
                            json.optInt("segment_count", 0), entry));
                } catch (IOException | JSONException | DateTimeParseException e) {
                    LOG.warn("Skipping unreadable session metadata {}: {}", meta, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new PersistenceException("Cannot list sessions", dir, e);
        }
        sessions.sort(Comparator.comparing(StoredSession::createdAt).reversed());
        return sessions;
    }

    Path dataDir() {
        return Paths.get(properties.getDataDir()).toAbsolutePath().normalize();
    }

    static String directoryName(Session session) {
        String day = DAY.format(session.createdAt().atZone(ZoneId.systemDefault()));
        String safeName = session.name().trim().replaceAll("[^\\p{L}\\p{N}._-]+", "_");
        String shortId = session.id().toString().replace("-", "").substring(0, SHORT_ID_LENGTH);
        return day + "_" + safeName + "_" + shortId;
    }
}
