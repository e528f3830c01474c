package com.phillippitts.classmate.service.store;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Listing entry read back from a session's {@code meta.json}.
 */
public record StoredSession(String id, String name, String state, Instant createdAt, int segmentCount,
                            Path directory) {
}
