package com.phillippitts.classmate.presentation.exception;

import com.phillippitts.classmate.exception.AudioCaptureException;
import com.phillippitts.classmate.exception.ClassmateException;
import com.phillippitts.classmate.exception.ConnectionException;
import com.phillippitts.classmate.exception.InvalidStateTransitionException;
import com.phillippitts.classmate.exception.NothingToAnalyzeException;
import com.phillippitts.classmate.exception.PersistenceException;
import com.phillippitts.classmate.exception.UnknownQuestionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Lifecycle action not allowed in the current state (HTTP 409).
     */
    @ExceptionHandler(InvalidStateTransitionException.class)
    ResponseEntity<ApiError> handleInvalidTransition(InvalidStateTransitionException ex) {
        LOG.warn("Rejected lifecycle action: action={}, state={}", ex.getAction(), ex.getFrom());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Action not allowed in the current session state",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Answer regeneration for a question the session never detected (HTTP 404).
     */
    @ExceptionHandler(UnknownQuestionException.class)
    ResponseEntity<ApiError> handleUnknownQuestion(UnknownQuestionException ex) {
        LOG.warn("Unknown question: id={}", ex.getQuestionId());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Question not found",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * On-demand analysis with nothing to work on (HTTP 409).
     */
    @ExceptionHandler(NothingToAnalyzeException.class)
    ResponseEntity<ApiError> handleNothingToAnalyze(NothingToAnalyzeException ex) {
        LOG.info("Request not queued: analyzer={}, reason={}", ex.getAnalyzer(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Nothing to analyze",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Transient error - transcription backend unreachable, retry possible (HTTP 503).
     */
    @ExceptionHandler(ConnectionException.class)
    ResponseEntity<ApiError> handleConnectionFailure(ConnectionException ex) {
        LOG.error("Transcription backend unavailable: backend={}", ex.getBackendName(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Transcription service temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Microphone missing or access denied (HTTP 503).
     */
    @ExceptionHandler(AudioCaptureException.class)
    ResponseEntity<ApiError> handleAudioCapture(AudioCaptureException ex) {
        LOG.error("Audio capture unavailable: reason={}", ex.getReason());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Microphone unavailable",
                "Check the input device and its permissions (" + ex.getReason() + ")",
                Instant.now()
            ));
    }

    /**
     * Session directory could not be created (HTTP 500).
     */
    @ExceptionHandler(PersistenceException.class)
    ResponseEntity<ApiError> handlePersistence(PersistenceException ex) {
        LOG.error("Persistence failure: path={}", ex.getTarget(), ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Session records could not be written",
                "Check the data directory permissions and free space",
                Instant.now()
            ));
    }

    /**
     * Client error - invalid request body (HTTP 400).
     */
    @ExceptionHandler({MethodArgumentNotValidException.class, IllegalArgumentException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Invalid request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex instanceof MethodArgumentNotValidException manv
                    ? manv.getBindingResult().getFieldErrors().stream()
                        .map(f -> f.getField() + " " + f.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b).orElse("validation failed")
                    : ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Other application errors (HTTP 500).
     */
    @ExceptionHandler(ClassmateException.class)
    ResponseEntity<ApiError> handleApplicationError(ClassmateException ex) {
        LOG.error("Application error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "The request could not be completed",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "See server logs",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
