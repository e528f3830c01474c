package com.phillippitts.classmate.service.channel;

import com.phillippitts.classmate.domain.TranscriptSegment;

/**
 * Normalized message pushed by a {@link TranscriptionBackend} into the channel inbox.
 *
 * @param type      message type
 * @param segmentId segment id for PARTIAL/FINAL, empty otherwise
 * @param startMs   segment start on the stream timeline
 * @param endMs     segment end on the stream timeline
 * @param text      recognized text, or the error description for ERROR/DISCONNECTED
 * @param language  language tag (may be empty)
 * @param speakerId speaker label (may be empty)
 */
public record BackendMessage(
        Type type,
        String segmentId,
        long startMs,
        long endMs,
        String text,
        String language,
        String speakerId
) {

    public enum Type { PARTIAL, FINAL, COMPLETED, ERROR, DISCONNECTED }

    public BackendMessage {
        segmentId = segmentId == null ? "" : segmentId;
        text = text == null ? "" : text;
        language = language == null ? "" : language;
        speakerId = speakerId == null ? "" : speakerId;
    }

    public static BackendMessage partial(String id, long startMs, long endMs, String text) {
        return new BackendMessage(Type.PARTIAL, id, startMs, endMs, text, "", "");
    }

    public static BackendMessage finalResult(String id, long startMs, long endMs, String text) {
        return new BackendMessage(Type.FINAL, id, startMs, endMs, text, "", "");
    }

    public static BackendMessage completed() {
        return new BackendMessage(Type.COMPLETED, "", 0, 0, "", "", "");
    }

    public static BackendMessage error(String reason) {
        return new BackendMessage(Type.ERROR, "", 0, 0, reason, "", "");
    }

    public static BackendMessage disconnected(String reason) {
        return new BackendMessage(Type.DISCONNECTED, "", 0, 0, reason, "", "");
    }

    public boolean isSegment() {
        return type == Type.PARTIAL || type == Type.FINAL;
    }

    /**
     * Converts a PARTIAL or FINAL message into a transcript segment. End times that precede
     * the start are clamped to the start.
     */
    public TranscriptSegment toSegment() {
        if (!isSegment()) {
            throw new IllegalStateException("Not a segment message: " + type);
        }
        long start = Math.max(0, startMs);
        long end = Math.max(start, endMs);
        return new TranscriptSegment(segmentId, start, end, text, type == Type.FINAL, language, speakerId);
    }
}
