package com.mimecast.forwarder.forward;

import com.mimecast.forwarder.error.CompositionException;
import com.mimecast.forwarder.error.FailureKind;
import com.mimecast.forwarder.mime.Fidelity;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AttemptStateTest {

    @Test
    void testFidelityProgression() {
        AttemptState state = new AttemptState(1L, 3);

        assertEquals(1, state.getAttempt());
        assertEquals(Fidelity.FULL, state.getFidelity());

        state.recordFailure(new CompositionException("bad"));
        assertEquals(2, state.getAttempt());
        assertEquals(Fidelity.FULL, state.getFidelity());
        assertFalse(state.isExhausted());

        state.recordFailure(new CompositionException("bad"));
        assertEquals(Fidelity.DEGRADED, state.getFidelity());
        assertFalse(state.isExhausted());

        state.recordFailure(new CompositionException("worse"));
        assertTrue(state.isExhausted());
        assertEquals("worse", state.getLastFailure().getMessage());
    }

    @Test
    void testSingleAttemptIsDegraded() {
        assertEquals(Fidelity.DEGRADED, new AttemptState(1L, 1).getFidelity());
    }

    @Test
    void testInvalidMaxAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new AttemptState(1L, 0));
    }

    @Test
    void testAttemptResult() {
        AttemptResult success = AttemptResult.success(2, Fidelity.FULL);
        assertTrue(success.isSuccess());
        assertNull(success.getKind());

        AttemptResult failure = AttemptResult.failure(3, Fidelity.DEGRADED, new CompositionException("bad"));
        assertFalse(failure.isSuccess());
        assertEquals(FailureKind.COMPOSITION, failure.getKind());
        assertEquals(3, failure.getAttempt());
    }
}
