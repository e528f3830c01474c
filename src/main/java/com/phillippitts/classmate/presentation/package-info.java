/**
 * Presentation layer (REST control surface and exception handling).
 *
 * <p>Presentation depends on the service layer, never the other way round. Controllers are
 * thin adapters over {@link com.phillippitts.classmate.service.orchestration.LectureOrchestrator};
 * domain exceptions become HTTP responses in
 * {@link com.phillippitts.classmate.presentation.exception.GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.classmate.presentation;
