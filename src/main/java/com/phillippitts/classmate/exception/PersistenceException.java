package com.phillippitts.classmate.exception;

import java.nio.file.Path;

/**
 * Thrown when a session record cannot be written. Retried by the session writer; once
 * retries are exhausted the session is flagged as degraded but capture continues.
 */
public class PersistenceException extends ClassmateException {

    private final Path target;

    public PersistenceException(String message, Path target, Throwable cause) {
        super(message + " (target: " + target + ")", cause);
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }
}
