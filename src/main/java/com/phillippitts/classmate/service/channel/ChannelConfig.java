package com.phillippitts.classmate.service.channel;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Connection parameters handed to a {@link TranscriptionBackend} for one session.
 *
 * @param sessionId      owning session, used for logging and lifecycle events
 * @param url            backend streaming endpoint
 * @param appKey         application key sent with start/stop commands
 * @param apiKey         bearer credential (may be empty)
 * @param language       requested source language
 * @param sampleRate     PCM sample rate in Hz
 * @param connectTimeout handshake timeout
 */
public record ChannelConfig(
        UUID sessionId,
        String url,
        String appKey,
        String apiKey,
        String language,
        int sampleRate,
        Duration connectTimeout
) {

    public ChannelConfig {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        url = url == null ? "" : url;
        appKey = appKey == null ? "" : appKey;
        apiKey = apiKey == null ? "" : apiKey;
        language = language == null ? "" : language;
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be > 0, got: " + sampleRate);
        }
        connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
    }
}
