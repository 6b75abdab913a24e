package in.timeos.service.core;

import in.timeos.domain.common.SweepError;
import in.timeos.repository.JobLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs a sweep while holding its named lock in the job_locks table.
 *
 * A second caller, in this process or another, is refused while the lock is
 * held; it gets the refusal report instead of running the sweep.
 */
public final class LockedJobRunner {
    private static final Logger log = LoggerFactory.getLogger(LockedJobRunner.class);

    public static final String LOCK_REFUSED = "Could not acquire execution lock";

    private final JobLockRepository lockRepository;
    private final String holder;

    public LockedJobRunner(JobLockRepository lockRepository) {
        this(lockRepository, ManagementFactory.getRuntimeMXBean().getName());
    }

    public LockedJobRunner(JobLockRepository lockRepository, String holder) {
        this.lockRepository = lockRepository;
        this.holder = holder;
    }

    /**
     * @param sweep the work to run under the lock
     * @param whenLocked builds the report returned when the lock is taken
     */
    public <R> R run(Job job, Supplier<R> sweep, Function<SweepError, R> whenLocked) {
        String lockKey = job.key();
        if (!lockRepository.tryAcquire(lockKey, holder)) {
            log.warn("[JOB LOCK] {} already running, skipped", lockKey);
            return whenLocked.apply(new SweepError(lockKey, LOCK_REFUSED + ": " + lockKey));
        }

        log.debug("[JOB LOCK] Acquired {} ({})", lockKey, holder);
        try {
            return sweep.get();
        } finally {
            release(lockKey);
        }
    }

    private void release(String lockKey) {
        try {
            lockRepository.release(lockKey);
            log.debug("[JOB LOCK] Released {}", lockKey);
        } catch (RuntimeException e) {
            // the lock goes stale and is taken over by the next acquire
            log.error("[JOB LOCK] Failed to release {}: {}", lockKey, e.getMessage(), e);
        }
    }
}
