package com.phillippitts.classmate.domain;

/**
 * Lifecycle states of a listening session.
 *
 * <pre>
 * CREATED --start--> ACTIVE --pause--> PAUSED
 *                    ACTIVE <--resume-- PAUSED
 * ACTIVE | PAUSED --end--> ENDED
 * </pre>
 */
public enum SessionState {
    CREATED,
    ACTIVE,
    PAUSED,
    ENDED
}
