package com.phillippitts.classmate.service.channel;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parses the JSON header/payload dialect spoken by the streaming transcription service.
 *
 * <p>Recognized message names:
 * <ul>
 *   <li>{@code SentenceBegin}: remembers the sentence start time, no output</li>
 *   <li>{@code TranscriptionResultChanged}: partial result</li>
 *   <li>{@code SentenceEnd}: final result</li>
 *   <li>{@code TranscriptionCompleted}: backend finished after a stop command</li>
 *   <li>{@code TaskFailed}: backend-side error</li>
 * </ul>
 * Unknown names are ignored. Segment ids are {@code s-<index>}.
 *
 * <p>One instance per connection; not thread-safe.
 */
final class TranscriptMessageParser {

    private static final Logger LOG = LogManager.getLogger(TranscriptMessageParser.class);

    /** Caps messages from a misbehaving backend (1MB). */
    static final int MAX_MESSAGE_SIZE = 1_048_576;

    private final Map<Long, Long> sentenceStarts = new HashMap<>();

    Optional<BackendMessage> parse(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        if (json.length() > MAX_MESSAGE_SIZE) {
            LOG.warn("Transcription message exceeds {} bytes; ignoring", MAX_MESSAGE_SIZE);
            return Optional.empty();
        }
        try {
            JSONObject msg = new JSONObject(json);
            JSONObject header = msg.optJSONObject("header");
            JSONObject payload = msg.optJSONObject("payload");
            if (header == null) {
                return Optional.empty();
            }
            if (payload == null) {
                payload = new JSONObject();
            }
            String name = header.optString("name", "");
            switch (name) {
                case "SentenceBegin":
                    sentenceStarts.put(payload.optLong("index", 0), payload.optLong("time", 0));
                    return Optional.empty();
                case "TranscriptionResultChanged":
                    return Optional.of(segment(BackendMessage.Type.PARTIAL, payload));
                case "SentenceEnd": {
                    BackendMessage result = segment(BackendMessage.Type.FINAL, payload);
                    sentenceStarts.remove(payload.optLong("index", 0));
                    return Optional.of(result);
                }
                case "TranscriptionCompleted":
                    return Optional.of(BackendMessage.completed());
                case "TaskFailed":
                    return Optional.of(BackendMessage.error(
                            header.optString("status", "") + " " + header.optString("status_text", "")));
                default:
                    LOG.debug("Ignoring transcription message {}", name);
                    return Optional.empty();
            }
        } catch (JSONException e) {
            LOG.warn("Malformed transcription message: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private BackendMessage segment(BackendMessage.Type type, JSONObject payload) {
        long index = payload.optLong("index", 0);
        long time = payload.optLong("time", 0);
        long start = payload.has("begin_time")
                ? payload.optLong("begin_time", 0)
                : sentenceStarts.getOrDefault(index, time);
        return new BackendMessage(type, "s-" + index, start, Math.max(start, time),
                payload.optString("result", "").trim(),
                payload.optString("source_lang", ""),
                payload.optString("speaker_id", ""));
    }

    static String command(String name, String appKey, long messageId) {
        JSONObject header = new JSONObject()
                .put("namespace", "SpeechTranscriber")
                .put("name", name)
                .put("message_id", "msg_" + messageId)
                .put("appkey", appKey);
        return new JSONObject().put("header", header).toString();
    }
}
