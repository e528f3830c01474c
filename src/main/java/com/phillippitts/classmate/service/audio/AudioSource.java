package com.phillippitts.classmate.service.audio;

import com.phillippitts.classmate.domain.AudioFrame;
import com.phillippitts.classmate.exception.AudioCaptureException;

import java.util.Optional;

/**
 * Pull-based source of fixed-size PCM frames for one session.
 */
public interface AudioSource extends AutoCloseable {

    /**
     * Acquires the input device.
     *
     * @throws AudioCaptureException if the device is unavailable or access is denied
     */
    void open();

    /**
     * Blocks until the next frame is available.
     *
     * @return the next frame, or empty at end of stream (after {@link #close()} or device loss)
     */
    Optional<AudioFrame> nextFrame();

    /** Releases the device; a blocked {@link #nextFrame()} returns empty. Never throws. */
    @Override
    void close();
}
