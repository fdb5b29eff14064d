package com.minicall.domain.call;

import com.minicall.domain.enums.CallAction;
import com.minicall.domain.enums.CallStatus;
import com.minicall.domain.exception.CallStateConflictException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class CallStateMachineTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 5, 1, 10, 0, 0);

    @Test
    void acceptThenEnd_ShouldEndWithNonNegativeDuration() {
        CallTransition accepted = CallStateMachine.apply(CallStatus.RINGING, CallAction.ACCEPT, false, T0);
        assertTrue(accepted.changed());
        assertEquals(CallStatus.ACCEPTED, accepted.to());
        assertEquals(T0, accepted.startedAt());
        assertNull(accepted.endedAt());

        LocalDateTime t1 = T0.plusSeconds(42);
        CallTransition ended = CallStateMachine.apply(CallStatus.ACCEPTED, CallAction.END, true, t1);
        assertEquals(CallStatus.ENDED, ended.to());
        assertNull(ended.startedAt());
        assertEquals(t1, ended.endedAt());
        assertEquals(42, CallStateMachine.durationSeconds(accepted.startedAt(), ended.endedAt()));
    }

    @Test
    void rejectFromRinging_ShouldBeTerminal() {
        CallTransition t = CallStateMachine.apply(CallStatus.RINGING, CallAction.REJECT, false, T0);
        assertEquals(CallStatus.REJECTED, t.to());
        assertTrue(t.to().isTerminal());
        assertNull(t.startedAt());
        assertEquals(T0, t.endedAt());
    }

    @Test
    void callerEndingRingingCall_ShouldBeMissed() {
        CallTransition t = CallStateMachine.apply(CallStatus.RINGING, CallAction.END, true, T0);
        assertEquals(CallStatus.MISSED, t.to());
        assertNull(t.startedAt());
    }

    @Test
    void calleeEndingRingingCall_ShouldBeRejected() {
        CallTransition t = CallStateMachine.apply(CallStatus.RINGING, CallAction.END, false, T0);
        assertEquals(CallStatus.REJECTED, t.to());
    }

    @Test
    void acceptOnAccepted_ShouldBeNoOp() {
        CallTransition t = CallStateMachine.apply(CallStatus.ACCEPTED, CallAction.ACCEPT, false, T0);
        assertFalse(t.changed());
        assertEquals(CallStatus.ACCEPTED, t.to());
        assertNull(t.startedAt());
    }

    @Test
    void rejectOnAccepted_ShouldConflict() {
        CallStateConflictException e = assertThrows(CallStateConflictException.class,
                () -> CallStateMachine.apply(CallStatus.ACCEPTED, CallAction.REJECT, false, T0));
        assertEquals(CallStatus.ACCEPTED, e.getCurrent());
    }

    @ParameterizedTest
    @EnumSource(value = CallStatus.class, names = {"ENDED", "REJECTED", "MISSED"})
    void terminalStates_ShouldNotTransition(CallStatus terminal) {
        assertThrows(CallStateConflictException.class,
                () -> CallStateMachine.apply(terminal, CallAction.ACCEPT, false, T0));

        for (CallAction action : new CallAction[]{CallAction.REJECT, CallAction.END}) {
            for (boolean caller : new boolean[]{true, false}) {
                CallTransition t = CallStateMachine.apply(terminal, action, caller, T0);
                assertFalse(t.changed());
                assertEquals(terminal, t.to());
                assertNull(t.endedAt());
            }
        }
        for (CallStatus target : CallStatus.values()) {
            assertFalse(CallStateMachine.isAllowed(terminal, target));
        }
    }

    @Test
    void allowedTransitions_ShouldMatchLifecycle() {
        assertTrue(CallStateMachine.isAllowed(CallStatus.RINGING, CallStatus.ACCEPTED));
        assertTrue(CallStateMachine.isAllowed(CallStatus.RINGING, CallStatus.REJECTED));
        assertTrue(CallStateMachine.isAllowed(CallStatus.RINGING, CallStatus.MISSED));
        assertFalse(CallStateMachine.isAllowed(CallStatus.RINGING, CallStatus.ENDED));
        assertTrue(CallStateMachine.isAllowed(CallStatus.ACCEPTED, CallStatus.ENDED));
        assertFalse(CallStateMachine.isAllowed(CallStatus.ACCEPTED, CallStatus.MISSED));
    }

    @Test
    void duration_ShouldBeClampedAndZeroWhenNeverStarted() {
        assertEquals(0, CallStateMachine.durationSeconds(null, T0));
        assertEquals(0, CallStateMachine.durationSeconds(T0, null));
        assertEquals(0, CallStateMachine.durationSeconds(T0.plusSeconds(5), T0));
        assertEquals(181, CallStateMachine.durationSeconds(T0, T0.plusMinutes(3).plusSeconds(1)));
    }
}
