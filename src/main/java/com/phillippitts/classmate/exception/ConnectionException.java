package com.phillippitts.classmate.exception;

/**
 * Thrown when the transcription backend cannot be reached or rejects the credentials.
 * Transient occurrences are retried with backoff by the channel; a failure on the initial
 * open aborts session start.
 */
public class ConnectionException extends ClassmateException {

    private final String backendName;

    public ConnectionException(String message, String backendName) {
        super(message + " (backend: " + backendName + ")");
        this.backendName = backendName;
    }

    public ConnectionException(String message, String backendName, Throwable cause) {
        super(message + " (backend: " + backendName + ")", cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
