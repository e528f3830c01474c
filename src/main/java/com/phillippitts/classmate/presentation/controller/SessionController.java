package com.phillippitts.classmate.presentation.controller;

import com.phillippitts.classmate.service.orchestration.LectureOrchestrator;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Control surface for the listening session: lifecycle actions and on-demand analysis.
 *
 * <p>On-demand endpoints answer {@code 202 Accepted} when the work was queued and
 * {@code 429 Too Many Requests} when the analyzer queue is full or there is nothing to do.
 */
@RestController
@RequestMapping("/sessions")
class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    private final LectureOrchestrator orchestrator;

    SessionController(LectureOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    ResponseEntity<SessionView> create(@Valid @RequestBody CreateSessionRequest request) {
        List<String> materials = request.materials() == null ? List.of() : request.materials();
        SessionView view = SessionView.of(orchestrator.create(request.name(), request.description(), materials));
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    @GetMapping
    List<SessionView> list() {
        return orchestrator.listSessions().stream().map(SessionView::of).toList();
    }

    @GetMapping("/current")
    ResponseEntity<SessionView> current() {
        return orchestrator.current()
                .map(s -> ResponseEntity.ok(SessionView.of(s)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/current/start")
    SessionView start() {
        return SessionView.of(orchestrator.start());
    }

    @PostMapping("/current/pause")
    SessionView pause() {
        return SessionView.of(orchestrator.pause());
    }

    @PostMapping("/current/resume")
    SessionView resume() {
        return SessionView.of(orchestrator.resume());
    }

    @PostMapping("/current/end")
    SessionView end() {
        return SessionView.of(orchestrator.end());
    }

    @PostMapping("/current/summary")
    ResponseEntity<Map<String, Object>> summary() {
        return accepted("summary", orchestrator.requestSummary());
    }

    @PostMapping("/current/suggestion")
    ResponseEntity<Map<String, Object>> suggestion() {
        return accepted("suggestion", orchestrator.requestSuggestion());
    }

    @PostMapping("/current/ideas")
    ResponseEntity<Map<String, Object>> ideas() {
        return accepted("ideas", orchestrator.requestIdeas());
    }

    @PostMapping("/current/answers/{questionId}/regenerate")
    ResponseEntity<Map<String, Object>> regenerate(@PathVariable String questionId) {
        return accepted("answer", orchestrator.regenerateAnswer(questionId));
    }

    private static ResponseEntity<Map<String, Object>> accepted(String what, boolean queued) {
        if (!queued) {
            LOG.debug("On-demand {} request not queued", what);
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(Map.of("request", what, "queued", false));
        }
        return ResponseEntity.accepted().body(Map.of("request", what, "queued", true));
    }
}
