package com.phillippitts.classmate.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the streaming transcription channel and its backend.
 */
@Validated
@ConfigurationProperties(prefix = "classmate.transcription")
public class TranscriptionProperties {

    public enum Backend { WEBSOCKET }

    /** Backend implementation used for new channels. */
    @NotNull
    private Backend backend = Backend.WEBSOCKET;

    /** Streaming endpoint of the transcription backend (e.g. {@code wss://host/stream}). */
    private String url = "";

    /** Application key sent in the start command. */
    private String appKey = "";

    /** Bearer credential sent when connecting. */
    private String apiKey = "";

    /** Source language requested from the backend. */
    private String language = "en";

    @Positive
    private int sampleRate = 16_000;

    /** Connect/handshake timeout. */
    @Positive
    private long connectTimeoutMs = 10_000;

    /** Longest {@code close()} waits for the backend to confirm completion. */
    @Positive
    private long drainTimeoutMs = 5_000;

    /** Capacity of the receiver inbox between backend push and bus publication. */
    @Positive
    private int inboxCapacity = 1024;

    /** Frames kept while disconnected; oldest frames are dropped beyond this. */
    @Positive
    private int bufferFrames = 3000;

    @Valid
    private Reconnect reconnect = new Reconnect();

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getAppKey() {
        return appKey;
    }

    public void setAppKey(String appKey) {
        this.appKey = appKey;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public void setSampleRate(int sampleRate) {
        this.sampleRate = sampleRate;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public long getDrainTimeoutMs() {
        return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
        this.drainTimeoutMs = drainTimeoutMs;
    }

    public int getInboxCapacity() {
        return inboxCapacity;
    }

    public void setInboxCapacity(int inboxCapacity) {
        this.inboxCapacity = inboxCapacity;
    }

    public int getBufferFrames() {
        return bufferFrames;
    }

    public void setBufferFrames(int bufferFrames) {
        this.bufferFrames = bufferFrames;
    }

    public Reconnect getReconnect() {
        return reconnect;
    }

    public void setReconnect(Reconnect reconnect) {
        this.reconnect = reconnect;
    }

    /**
     * Reconnection backoff after a transient backend failure.
     */
    public static class Reconnect {
        @Min(0)
        private long baseDelayMs = 1000;
        @Positive
        private long maxDelayMs = 30_000;
        @Positive
        private int maxAttempts = 5;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }
}
