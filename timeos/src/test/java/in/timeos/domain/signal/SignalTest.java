package in.timeos.domain.signal;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SignalTest {

    private static Signal.Builder valid() {
        return Signal.builder()
            .signalType(SignalTypes.TASK_OVERDUE)
            .valence(-1)
            .magnitude(0.5)
            .entity("task", "T1");
    }

    @Test
    void build_fillsDefaults() {
        Instant at = Instant.parse("2024-03-01T10:00:00Z");

        Signal s = valid().detectedAt(at).build();

        assertTrue(s.id().startsWith("sig_"));
        assertEquals(SignalCategory.SCHEDULE, s.category());
        assertEquals(SignalStatus.ACTIVE, s.status());
        assertEquals(at, s.occurredAt());
        assertEquals(ScopeChain.EMPTY, s.scope());
        assertTrue(s.payload().isEmpty());
        assertTrue(s.isNegative());
        assertFalse(s.isPositive());
    }

    @Test
    void build_rejectsValenceOutOfRange() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> valid().valence(2).build());
        assertTrue(e.getMessage().contains("Valence"));
    }

    @Test
    void build_rejectsMagnitudeOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> valid().magnitude(1.01).build());
        assertThrows(IllegalArgumentException.class, () -> valid().magnitude(-0.1).build());
        assertThrows(IllegalArgumentException.class, () -> valid().magnitude(Double.NaN).build());
    }

    @Test
    void build_rejectsConfidenceOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> valid().detectionConfidence(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> valid().attributionConfidence(-0.5).build());
    }

    @Test
    void build_acceptsBoundaryValues() {
        assertDoesNotThrow(() -> valid().magnitude(0.0).build());
        assertDoesNotThrow(() -> valid().magnitude(1.0).valence(1).build());
    }

    @Test
    void unknownType_fallsBackToProcessCategory() {
        Signal s = valid().signalType("something_new").build();
        assertEquals(SignalCategory.PROCESS, s.category());
    }

    @Test
    void dedupKey_combinesTypeAndEntity() {
        assertEquals("task_overdue:T1", valid().build().dedupKey());
    }

    @Test
    void isExpired_comparesAgainstNow() {
        Instant expiry = Instant.parse("2024-03-10T00:00:00Z");
        Signal s = valid().expiresAt(expiry).build();

        assertFalse(s.isExpired(expiry.minusSeconds(1)));
        assertTrue(s.isExpired(expiry.plusSeconds(1)));
        assertFalse(valid().build().isExpired(Instant.MAX));
    }

    @Test
    void scopeChain_mergeMissingKeepsSetLevels() {
        ScopeChain task = new ScopeChain("T1", "P1", null, null, null, null);
        ScopeChain resolved = new ScopeChain("OTHER", "P2", null, "B1", "C1", null);

        ScopeChain merged = task.mergeMissing(resolved);

        assertEquals("T1", merged.taskId());
        assertEquals("P1", merged.projectId());
        assertEquals("B1", merged.brandId());
        assertEquals("C1", merged.clientId());
    }
}
