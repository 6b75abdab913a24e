package in.timeos.repository;

/**
 * Named mutex for batch sweeps, shared by every process on the same database.
 */
public interface JobLockRepository {
    /**
     * Try to take the lock.
     *
     * @return false if another holder has not released it yet
     */
    boolean tryAcquire(String lockKey, String holder);

    /**
     * Release the lock. Releasing a lock that is not held is a no-op.
     */
    void release(String lockKey);

    /**
     * Whether the lock is currently held.
     */
    boolean isHeld(String lockKey);
}
