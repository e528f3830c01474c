/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.classmate.exception.InvalidStateTransitionException} → 409 Conflict</li>
 *   <li>{@link com.phillippitts.classmate.exception.ConnectionException} → 503 Service Unavailable (retry)</li>
 *   <li>{@link com.phillippitts.classmate.exception.AudioCaptureException} → 503 Service Unavailable</li>
 *   <li>Validation errors → 400 Bad Request</li>
 *   <li>Other {@link com.phillippitts.classmate.exception.ClassmateException} and {@code Exception} → 500</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "InvalidStateTransitionException",
 *   "message": "Action not allowed in the current session state",
 *   "details": "Cannot end a session in state CREATED",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.classmate.presentation.exception;
