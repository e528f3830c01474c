package com.phillippitts.classmate.exception;

/**
 * Thrown when the microphone cannot be opened or access is denied.
 */
public class AudioCaptureException extends ClassmateException {

    private final String reason;

    public AudioCaptureException(String reason, Throwable cause) {
        super("Audio capture failed: " + reason, cause);
        this.reason = reason;
    }

    /** Short machine-readable reason (e.g. MIC_UNAVAILABLE, MIC_PERMISSION_DENIED). */
    public String getReason() {
        return reason;
    }
}
