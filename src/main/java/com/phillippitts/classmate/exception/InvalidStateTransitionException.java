package com.phillippitts.classmate.exception;

import com.phillippitts.classmate.domain.SessionState;

/**
 * Thrown when a lifecycle action is not allowed from the session's current state
 * (e.g. {@code end} on a session that was never started). Rejected synchronously with
 * no side effects.
 */
public class InvalidStateTransitionException extends ClassmateException {

    private final SessionState from;
    private final String action;

    public InvalidStateTransitionException(SessionState from, String action) {
        super("Cannot " + action + " a session in state " + from);
        this.from = from;
        this.action = action;
    }

    /** No session exists to apply {@code action} to. */
    public InvalidStateTransitionException(String action) {
        super("No session to " + action);
        this.from = null;
        this.action = action;
    }

    /** Current state, or {@code null} when no session exists. */
    public SessionState getFrom() {
        return from;
    }

    public String getAction() {
        return action;
    }
}
