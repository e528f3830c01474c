package com.phillippitts.classmate.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for durable session records.
 */
@Validated
@ConfigurationProperties(prefix = "classmate.store")
public class SessionStoreProperties {

    /** Root directory holding one sub-directory per session. */
    @NotBlank
    private String dataDir = "./classroom_data";

    /** Also keep the raw PCM stream under {@code audio/recording.pcm}. */
    private boolean saveAudio = false;

    /** Attempts per record write before the session is flagged as degraded. */
    @Positive
    private int writeAttempts = 3;

    @Min(0)
    private long retryBackoffMs = 200;

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public boolean isSaveAudio() {
        return saveAudio;
    }

    public void setSaveAudio(boolean saveAudio) {
        this.saveAudio = saveAudio;
    }

    public int getWriteAttempts() {
        return writeAttempts;
    }

    public void setWriteAttempts(int writeAttempts) {
        this.writeAttempts = writeAttempts;
    }

    public long getRetryBackoffMs() {
        return retryBackoffMs;
    }

    public void setRetryBackoffMs(long retryBackoffMs) {
        this.retryBackoffMs = retryBackoffMs;
    }
}
