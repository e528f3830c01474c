package com.phillippitts.classmate.service.orchestration;

import com.phillippitts.classmate.domain.Session;
import com.phillippitts.classmate.domain.SessionState;
import com.phillippitts.classmate.exception.InvalidStateTransitionException;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe holder of the single current session and its lifecycle transitions.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * CREATED → ACTIVE (start)
 * ACTIVE  → PAUSED (pause)
 * PAUSED  → ACTIVE (resume)
 * ACTIVE | PAUSED → ENDED (end)
 * </pre>
 *
 * <p>Validation never changes state: callers run {@link #require(Action)} before any side
 * effect and {@link #transition(Action)} once the side effects have succeeded.
 *
 * @since 1.0
 */
public final class SessionStateMachine {

    public enum Action {
        START("start"),
        PAUSE("pause"),
        RESUME("resume"),
        END("end");

        private final String verb;

        Action(String verb) {
            this.verb = verb;
        }

        public String verb() {
            return verb;
        }
    }

    private final Lock lock = new ReentrantLock();
    private Session current;

    /**
     * Target state for {@code action} from {@code from}.
     *
     * @throws InvalidStateTransitionException if the action is not allowed from {@code from}
     */
    public static SessionState next(SessionState from, Action action) {
        SessionState target = switch (action) {
            case START -> from == SessionState.CREATED ? SessionState.ACTIVE : null;
            case PAUSE -> from == SessionState.ACTIVE ? SessionState.PAUSED : null;
            case RESUME -> from == SessionState.PAUSED ? SessionState.ACTIVE : null;
            case END -> from == SessionState.ACTIVE || from == SessionState.PAUSED ? SessionState.ENDED : null;
        };
        if (target == null) {
            throw new InvalidStateTransitionException(from, action.verb());
        }
        return target;
    }

    /**
     * Installs a newly created session. Replaces a session that never started or has ended.
     *
     * @throws InvalidStateTransitionException if a session is ACTIVE or PAUSED
     */
    public void install(Session session) {
        Objects.requireNonNull(session, "session must not be null");
        lock.lock();
        try {
            if (current != null && (current.state() == SessionState.ACTIVE
                    || current.state() == SessionState.PAUSED)) {
                throw new InvalidStateTransitionException(current.state(), "create a new session while running");
            }
            current = session;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks that {@code action} is allowed and returns the current session unchanged.
     *
     * @throws InvalidStateTransitionException if no session exists or the action is not allowed
     */
    public Session require(Action action) {
        lock.lock();
        try {
            if (current == null) {
                throw new InvalidStateTransitionException(action.verb());
            }
            next(current.state(), action);
            return current;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies {@code action} and returns the new session value.
     *
     * @throws InvalidStateTransitionException if no session exists or the action is not allowed
     */
    public Session transition(Action action) {
        lock.lock();
        try {
            if (current == null) {
                throw new InvalidStateTransitionException(action.verb());
            }
            current = current.withState(next(current.state(), action));
            return current;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Session> current() {
        lock.lock();
        try {
            return Optional.ofNullable(current);
        } finally {
            lock.unlock();
        }
    }

    /** True if the current session is in {@code state}. */
    public boolean isIn(SessionState state) {
        lock.lock();
        try {
            return current != null && current.state() == state;
        } finally {
            lock.unlock();
        }
    }
}
