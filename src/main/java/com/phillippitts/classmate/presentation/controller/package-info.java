/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /sessions} - create a session</li>
 *   <li>{@code GET /sessions}, {@code GET /sessions/current} - stored sessions, live session</li>
 *   <li>{@code POST /sessions/current/{start|pause|resume|end}} - lifecycle</li>
 *   <li>{@code POST /sessions/current/{summary|suggestion|ideas}} - on-demand analysis</li>
 *   <li>{@code POST /sessions/current/answers/{questionId}/regenerate} - superseding answer</li>
 * </ul>
 *
 * @see com.phillippitts.classmate.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.classmate.presentation.controller;
