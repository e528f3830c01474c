package com.phillippitts.classmate.util;

import java.time.Duration;

/**
 * Standard timeout values for pipeline thread management.
 *
 * <p>Centralized so the audio pump, the transcription receiver and the session writer
 * shut down consistently.
 *
 * @since 1.0
 */
public final class ThreadTimeouts {

    /**
     * Timeout for the audio capture thread to terminate during a normal stop.
     *
     * <p>Capture may be blocked on a line read; 1000ms lets buffered data drain.
     */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for the transcription receiver thread to drain its inbox after close.
     */
    public static final Duration RECEIVER_STOP_TIMEOUT = Duration.ofMillis(2000);

    /**
     * Timeout for the session writer to flush queued records during finalize.
     */
    public static final Duration WRITER_FLUSH_TIMEOUT = Duration.ofSeconds(10);

    private ThreadTimeouts() {
        // Utility class - prevent instantiation
    }
}
