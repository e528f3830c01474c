/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.classmate.exception.ClassmateException}
 * so the REST boundary and the pipeline components can handle them uniformly:
 * <ul>
 *   <li>{@link com.phillippitts.classmate.exception.ConnectionException} - transcription
 *       backend unreachable; retried with backoff</li>
 *   <li>{@link com.phillippitts.classmate.exception.ChannelClosedException} - operation after
 *       channel shutdown; surfaced to the caller</li>
 *   <li>{@link com.phillippitts.classmate.exception.TranscriptProtocolException} - out-of-order
 *       or invalid segment; segment dropped</li>
 *   <li>{@link com.phillippitts.classmate.exception.AnalysisException} - model call failed or
 *       timed out; retried, then replaced by a placeholder artifact</li>
 *   <li>{@link com.phillippitts.classmate.exception.PersistenceException} - record write failed;
 *       retried, then reported as a degraded session</li>
 *   <li>{@link com.phillippitts.classmate.exception.InvalidStateTransitionException} - illegal
 *       lifecycle action; rejected synchronously</li>
 *   <li>{@link com.phillippitts.classmate.exception.AudioCaptureException} - microphone
 *       unavailable; session start is aborted</li>
 * </ul>
 *
 * @see com.phillippitts.classmate.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.classmate.exception;
