package com.phillippitts.classmate.exception;

/**
 * Raised when a backend message violates segment ordering or carries an invalid payload.
 * The offending segment is dropped; the pipeline continues.
 */
public class TranscriptProtocolException extends ClassmateException {

    private final String segmentId;

    public TranscriptProtocolException(String message, String segmentId) {
        super(message + " (segment: " + segmentId + ")");
        this.segmentId = segmentId;
    }

    public String getSegmentId() {
        return segmentId;
    }
}
