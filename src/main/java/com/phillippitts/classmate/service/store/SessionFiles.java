package com.phillippitts.classmate.service.store;

import org.json.JSONArray;
import org.json.JSONObject;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * File layout of one session directory and the low-level writes against it.
 *
 * <pre>
 * meta.json
 * events.jsonl
 * transcripts/realtime.jsonl
 * transcripts/full_transcript.txt
 * analysis/questions.json, summaries.json, suggestions.json, ideas.json
 * materials/
 * audio/recording.pcm
 * </pre>
 */
final class SessionFiles {

    static final String META = "meta.json";
    static final String EVENTS = "events.jsonl";
    static final String REALTIME = "transcripts/realtime.jsonl";
    static final String FULL_TRANSCRIPT = "transcripts/full_transcript.txt";
    static final String QUESTIONS = "analysis/questions.json";
    static final String SUMMARIES = "analysis/summaries.json";
    static final String SUGGESTIONS = "analysis/suggestions.json";
    static final String IDEAS = "analysis/ideas.json";
    static final String MATERIALS_DIR = "materials";
    static final String AUDIO = "audio/recording.pcm";

    private final Path root;

    SessionFiles(Path root) {
        this.root = root;
    }

    Path root() {
        return root;
    }

    Path resolve(String relative) {
        return root.resolve(relative);
    }

    void createLayout() throws IOException {
        Files.createDirectories(root.resolve("transcripts"));
        Files.createDirectories(root.resolve("analysis"));
        Files.createDirectories(root.resolve(MATERIALS_DIR));
        Files.createDirectories(root.resolve("audio"));
    }

    /** Appends one JSON record followed by a newline in a single write. */
    void appendLine(String relative, JSONObject record) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(resolve(relative), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            writer.write(record.toString() + System.lineSeparator());
        }
    }

    void appendBytes(String relative, byte[] bytes) throws IOException {
        try (OutputStream out = Files.newOutputStream(resolve(relative),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            out.write(bytes);
        }
    }

    void writeJsonAtomic(String relative, Object json) throws IOException {
        String text = json instanceof JSONArray array ? array.toString(2) : ((JSONObject) json).toString(2);
        writeStringAtomic(relative, text);
    }

    /** Writes to a sibling temp file and moves it over the target, so readers never see partial content. */
    void writeStringAtomic(String relative, String content) throws IOException {
        Path target = resolve(relative);
        Path tmpFile = target.resolveSibling(target.getFileName().toString() + ".tmp");
        Files.writeString(tmpFile, content, StandardCharsets.UTF_8);
        Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
