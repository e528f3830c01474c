package com.phillippitts.classmate.service.orchestration;

import com.phillippitts.classmate.domain.Session;
import com.phillippitts.classmate.domain.SessionState;
import com.phillippitts.classmate.exception.InvalidStateTransitionException;
import com.phillippitts.classmate.service.orchestration.SessionStateMachine.Action;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionStateMachineTest {

    @Test
    void shouldFollowFullLifecycle() {
        SessionStateMachine machine = new SessionStateMachine();
        machine.install(Session.create("Lecture", "", List.of()));

        assertThat(machine.transition(Action.START).state()).isEqualTo(SessionState.ACTIVE);
        assertThat(machine.transition(Action.PAUSE).state()).isEqualTo(SessionState.PAUSED);
        assertThat(machine.transition(Action.RESUME).state()).isEqualTo(SessionState.ACTIVE);
        assertThat(machine.transition(Action.PAUSE).state()).isEqualTo(SessionState.PAUSED);
        assertThat(machine.transition(Action.END).state()).isEqualTo(SessionState.ENDED);
    }

    @Test
    void shouldRejectIllegalMoves() {
        assertThatThrownBy(() -> SessionStateMachine.next(SessionState.CREATED, Action.PAUSE))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(() -> SessionStateMachine.next(SessionState.ACTIVE, Action.RESUME))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(() -> SessionStateMachine.next(SessionState.CREATED, Action.END))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(() -> SessionStateMachine.next(SessionState.ENDED, Action.START))
                .isInstanceOf(InvalidStateTransitionException.class)
                .satisfies(e -> assertThat(((InvalidStateTransitionException) e).getFrom())
                        .isEqualTo(SessionState.ENDED));
    }

    @Test
    void shouldNotChangeStateWhenRequireFails() {
        SessionStateMachine machine = new SessionStateMachine();
        machine.install(Session.create("Lecture", "", List.of()));

        assertThatThrownBy(() -> machine.require(Action.PAUSE)).isInstanceOf(InvalidStateTransitionException.class);

        assertThat(machine.isIn(SessionState.CREATED)).isTrue();
        assertThat(machine.require(Action.START).state()).isEqualTo(SessionState.CREATED);
    }

    @Test
    void shouldRejectActionsWithoutSession() {
        SessionStateMachine machine = new SessionStateMachine();

        assertThatThrownBy(() -> machine.transition(Action.START))
                .isInstanceOf(InvalidStateTransitionException.class)
                .hasMessageContaining("No session");
        assertThat(machine.current()).isEmpty();
    }

    @Test
    void shouldRefuseNewSessionWhileRunning() {
        SessionStateMachine machine = new SessionStateMachine();
        machine.install(Session.create("First", "", List.of()));
        machine.transition(Action.START);

        assertThatThrownBy(() -> machine.install(Session.create("Second", "", List.of())))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThat(machine.current()).get().extracting(Session::name).isEqualTo("First");
    }

    @Test
    void shouldReplaceSessionThatNeverStarted() {
        SessionStateMachine machine = new SessionStateMachine();
        machine.install(Session.create("First", "", List.of()));

        machine.install(Session.create("Second", "", List.of()));

        assertThat(machine.current()).get().extracting(Session::name).isEqualTo("Second");
    }
}
