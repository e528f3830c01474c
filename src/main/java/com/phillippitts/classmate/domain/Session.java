package com.phillippitts.classmate.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable value describing one listening session. The orchestrator replaces the value on
 * every transition; no component holds a process-wide "current session".
 *
 * @param id            unique session id
 * @param name          lecture name, used in the session directory name
 * @param description   free-form description (may be empty)
 * @param createdAt     creation timestamp
 * @param materialsRefs paths of imported lecture materials
 * @param state         lifecycle state
 */
public record Session(
        UUID id,
        String name,
        String description,
        Instant createdAt,
        List<String> materialsRefs,
        SessionState state
) {

    public Session {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Session name must not be blank");
        }
        description = description == null ? "" : description;
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        materialsRefs = materialsRefs == null ? List.of() : List.copyOf(materialsRefs);
        Objects.requireNonNull(state, "state must not be null");
    }

    public static Session create(String name, String description, List<String> materialsRefs) {
        return new Session(UUID.randomUUID(), name, description, Instant.now(), materialsRefs,
                SessionState.CREATED);
    }

    public Session withState(SessionState next) {
        return new Session(id, name, description, createdAt, materialsRefs, next);
    }

    public boolean isEnded() {
        return state == SessionState.ENDED;
    }
}
