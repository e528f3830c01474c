package com.phillippitts.classmate.exception;

/**
 * Thrown when audio is sent to a transcription channel that has already been closed.
 * Never retried.
 */
public class ChannelClosedException extends ClassmateException {

    public ChannelClosedException(String message) {
        super(message);
    }
}
