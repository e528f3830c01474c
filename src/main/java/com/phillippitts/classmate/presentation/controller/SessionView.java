package com.phillippitts.classmate.presentation.controller;

import com.phillippitts.classmate.domain.Session;
import com.phillippitts.classmate.service.store.StoredSession;

import java.time.Instant;
import java.util.List;

/** JSON view of a live or stored session. */
record SessionView(
        String id,
        String name,
        String description,
        String state,
        Instant createdAt,
        List<String> materials,
        Integer segmentCount,
        String directory
) {

    static SessionView of(Session s) {
        return new SessionView(s.id().toString(), s.name(), s.description(), s.state().name(), s.createdAt(),
                s.materialsRefs(), null, null);
    }

    static SessionView of(StoredSession s) {
        return new SessionView(s.id(), s.name(), null, s.state(), s.createdAt(), null, s.segmentCount(),
                s.directory().toString());
    }
}
