package com.phillippitts.classmate.exception;

/**
 * Base exception for all classmate application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class ClassmateException extends RuntimeException {

    public ClassmateException(String message) {
        super(message);
    }

    public ClassmateException(String message, Throwable cause) {
        super(message, cause);
    }

    public ClassmateException(Throwable cause) {
        super(cause);
    }
}
