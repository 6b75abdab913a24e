package in.timeos.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;

/**
 * PostgreSQL implementation of JobLockRepository.
 *
 * One row per lock key. A row with released_at IS NULL means the lock is held; acquiring
 * is a single conditional upsert so two processes can never both win. A lock held longer
 * than {@link #STALE_AFTER_MINUTES} is taken over.
 */
public final class PostgresJobLockRepository implements JobLockRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresJobLockRepository.class);

    static final int STALE_AFTER_MINUTES = 60;

    private final DataSource dataSource;

    public PostgresJobLockRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public boolean tryAcquire(String lockKey, String holder) {
        String sql = """
                INSERT INTO job_locks (lock_key, holder, acquired_at, released_at)
                VALUES (?, ?, NOW(), NULL)
                ON CONFLICT (lock_key) DO UPDATE
                    SET holder = EXCLUDED.holder, acquired_at = NOW(), released_at = NULL
                    WHERE job_locks.released_at IS NOT NULL
                       OR job_locks.acquired_at < NOW() - make_interval(mins => ?)
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, lockKey);
            ps.setString(2, holder);
            ps.setInt(3, STALE_AFTER_MINUTES);
            boolean acquired = ps.executeUpdate() > 0;
            log.debug("[JOB LOCK] {} acquire by {}: {}", lockKey, holder, acquired);
            return acquired;
        } catch (Exception e) {
            log.error("Failed to acquire job lock {}: {}", lockKey, e.getMessage());
            throw RepositoryErrors.wrap("Failed to acquire job lock", e);
        }
    }

    @Override
    public void release(String lockKey) {
        String sql = """
                UPDATE job_locks SET released_at = NOW()
                WHERE lock_key = ? AND released_at IS NULL
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, lockKey);
            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to release job lock {}: {}", lockKey, e.getMessage());
            throw RepositoryErrors.wrap("Failed to release job lock", e);
        }
    }

    @Override
    public boolean isHeld(String lockKey) {
        String sql = "SELECT 1 FROM job_locks WHERE lock_key = ? AND released_at IS NULL";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, lockKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (Exception e) {
            log.error("Failed to check job lock {}: {}", lockKey, e.getMessage());
            throw RepositoryErrors.wrap("Failed to check job lock", e);
        }
    }
}
