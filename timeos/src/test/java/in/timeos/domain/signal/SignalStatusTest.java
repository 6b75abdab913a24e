package in.timeos.domain.signal;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SignalStatusTest {

    @Test
    void active_canMoveAnywhereElse() {
        assertTrue(SignalStatus.ACTIVE.canTransitionTo(SignalStatus.CONSUMED));
        assertTrue(SignalStatus.ACTIVE.canTransitionTo(SignalStatus.BALANCED));
        assertTrue(SignalStatus.ACTIVE.canTransitionTo(SignalStatus.EXPIRED));
        assertFalse(SignalStatus.ACTIVE.canTransitionTo(SignalStatus.ACTIVE));
    }

    @Test
    void consumed_canOnlyBeBalanced() {
        assertTrue(SignalStatus.CONSUMED.canTransitionTo(SignalStatus.BALANCED));
        assertFalse(SignalStatus.CONSUMED.canTransitionTo(SignalStatus.EXPIRED));
        assertFalse(SignalStatus.CONSUMED.canTransitionTo(SignalStatus.ACTIVE));
    }

    @Test
    void balancedAndExpired_areFinal() {
        for (SignalStatus next : SignalStatus.values()) {
            assertFalse(SignalStatus.BALANCED.canTransitionTo(next));
            assertFalse(SignalStatus.EXPIRED.canTransitionTo(next));
        }
        assertTrue(SignalStatus.BALANCED.isTerminal());
        assertFalse(SignalStatus.CONSUMED.isTerminal());
        assertTrue(SignalStatus.CONSUMED.isLive());
        assertFalse(SignalStatus.EXPIRED.isLive());
    }
}
