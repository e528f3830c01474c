package com.phillippitts.classmate.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One fixed-size block of raw PCM audio (16 kHz, 16-bit signed, mono, little-endian).
 *
 * <p>The PCM array is not copied; producers hand over ownership and must not reuse it.
 *
 * @param pcm        raw PCM bytes
 * @param sequence   monotonic sequence number assigned by the audio source
 * @param capturedAt capture timestamp
 */
public record AudioFrame(byte[] pcm, long sequence, Instant capturedAt) {

    public AudioFrame {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(capturedAt, "capturedAt must not be null");
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0, got: " + sequence);
        }
    }

    public int size() {
        return pcm.length;
    }
}
