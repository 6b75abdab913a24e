package in.timeos.service.core;

import in.timeos.domain.common.SweepError;
import in.timeos.repository.JobLockRepository;
import in.timeos.support.InMemoryJobLockRepository;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LockedJobRunnerTest {

    @Test
    void runsSweepAndReleasesLock() {
        InMemoryJobLockRepository locks = new InMemoryJobLockRepository();
        LockedJobRunner runner = new LockedJobRunner(locks, "test-holder");

        String result = runner.run(Job.FORMATION, () -> {
            assertTrue(locks.isHeld("formation"));
            return "done";
        }, SweepError::message);

        assertEquals("done", result);
        assertFalse(locks.isHeld("formation"));
    }

    @Test
    void heldLock_returnsRefusalWithoutRunning() {
        InMemoryJobLockRepository locks = new InMemoryJobLockRepository();
        locks.tryAcquire("balance", "other-process");
        LockedJobRunner runner = new LockedJobRunner(locks, "test-holder");
        AtomicBoolean ran = new AtomicBoolean();

        String result = runner.run(Job.BALANCE, () -> {
            ran.set(true);
            return "done";
        }, SweepError::message);

        assertFalse(ran.get());
        assertEquals(LockedJobRunner.LOCK_REFUSED + ": balance", result);
        assertTrue(locks.isHeld("balance"));
    }

    @Test
    void failingSweep_stillReleasesLock() {
        InMemoryJobLockRepository locks = new InMemoryJobLockRepository();
        LockedJobRunner runner = new LockedJobRunner(locks, "test-holder");

        assertThrows(IllegalStateException.class, () -> runner.run(Job.DETECTION, () -> {
            throw new IllegalStateException("boom");
        }, SweepError::message));
        assertFalse(locks.isHeld("detection"));
    }

    @Test
    void releaseFailure_doesNotHideResult() {
        JobLockRepository locks = mock(JobLockRepository.class);
        when(locks.tryAcquire("expiry", "test-holder")).thenReturn(true);
        doThrow(new RuntimeException("connection reset")).when(locks).release("expiry");
        LockedJobRunner runner = new LockedJobRunner(locks, "test-holder");

        assertEquals(7, runner.run(Job.EXPIRY, () -> 7, e -> -1));
    }

    @Test
    void jobKeys_resolveCaseInsensitively() {
        assertEquals(Job.REGRESSIONS, Job.fromKey("Regressions").orElseThrow());
        assertTrue(Job.fromKey("reboot").isEmpty());
    }
}
