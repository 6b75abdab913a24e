package in.timeos.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;

/**
 * Schema Migration - creates the signal engine tables on startup.
 *
 * Creates three tables:
 * - signals: append-mostly observation log
 * - issues: correlated issues with JSONB signal_ids and state_history
 * - job_locks: named mutex rows for batch sweeps
 *
 * Indices are created with IF NOT EXISTS on every run.
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    private static final List<String> SCOPE_COLUMNS = List.of(
        "scope_task_id", "scope_project_id", "scope_retainer_id",
        "scope_brand_id", "scope_client_id"
    );

    private final DataSource dataSource;

    public SchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates tables if they don't exist, then ensures indices.
     */
    public void migrate() {
        log.info("[MIGRATION] Starting signal engine schema migration");

        try (Connection conn = dataSource.getConnection()) {
            createIfMissing(conn, "signals", SIGNALS_DDL);
            createIfMissing(conn, "issues", ISSUES_DDL);
            createIfMissing(conn, "job_locks", JOB_LOCKS_DDL);
            createIndices(conn);

            log.info("[MIGRATION] Migration completed successfully");

        } catch (Exception e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Schema migration failed", e);
        }
    }

    private void createIfMissing(Connection conn, String table, String ddl) throws Exception {
        if (tableExists(conn, table)) {
            log.info("[MIGRATION] {} table already exists", table);
            return;
        }
        log.info("[MIGRATION] Creating {} table...", table);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(ddl);
        }
        log.info("[MIGRATION] ✓ {} table created", table);
    }

    private boolean tableExists(Connection conn, String tableName) throws Exception {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createIndices(Connection conn) throws Exception {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_signals_type_status ON signals (signal_type, status)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_signals_entity ON signals (entity_type, entity_id)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_signals_detected ON signals (detected_at)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_signals_scope_person_id ON signals (scope_person_id)");
            for (String column : SCOPE_COLUMNS) {
                stmt.execute("CREATE INDEX IF NOT EXISTS idx_signals_" + column + " ON signals (" + column + ")");
                stmt.execute("CREATE INDEX IF NOT EXISTS idx_issues_" + column + " ON issues (" + column + ")");
            }
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_issues_subtype_scope_state "
                + "ON issues (issue_subtype, scope_id, state)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_issues_state ON issues (state)");
        }
        log.info("[MIGRATION] ✓ Indices ensured");
    }

    private static final String SIGNALS_DDL = """
        CREATE TABLE signals (
            id VARCHAR(40) PRIMARY KEY,
            signal_type VARCHAR(64) NOT NULL,
            signal_category VARCHAR(32) NOT NULL,
            valence SMALLINT NOT NULL CHECK (valence IN (-1, 0, 1)),
            magnitude DOUBLE PRECISION NOT NULL CHECK (magnitude >= 0 AND magnitude <= 1),

            -- Observed entity
            entity_type VARCHAR(32) NOT NULL,
            entity_id VARCHAR(128) NOT NULL,

            -- Scope chain
            scope_task_id VARCHAR(128),
            scope_project_id VARCHAR(128),
            scope_retainer_id VARCHAR(128),
            scope_brand_id VARCHAR(128),
            scope_client_id VARCHAR(128),
            scope_person_id VARCHAR(128),

            -- Evidence
            source_type VARCHAR(16) NOT NULL,
            source_id VARCHAR(256),
            source_url TEXT,
            source_excerpt TEXT,
            payload JSONB NOT NULL DEFAULT '{}'::jsonb,

            detection_confidence DOUBLE PRECISION NOT NULL DEFAULT 1.0,
            attribution_confidence DOUBLE PRECISION NOT NULL DEFAULT 1.0,

            occurred_at TIMESTAMPTZ NOT NULL,
            detected_at TIMESTAMPTZ NOT NULL,
            expires_at TIMESTAMPTZ,

            -- Lifecycle
            status VARCHAR(16) NOT NULL DEFAULT 'ACTIVE',
            consumed_by_issue_id VARCHAR(40),
            balanced_by_signal_id VARCHAR(40),
            balanced_at TIMESTAMPTZ,

            detector_id VARCHAR(64),
            detector_version VARCHAR(16),
            created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
            updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
        )
        """;

    private static final String ISSUES_DDL = """
        CREATE TABLE issues (
            id VARCHAR(40) PRIMARY KEY,
            issue_type VARCHAR(32) NOT NULL,
            issue_subtype VARCHAR(64) NOT NULL,

            scope_type VARCHAR(16) NOT NULL,
            scope_id VARCHAR(128) NOT NULL,
            scope_task_id VARCHAR(128),
            scope_project_id VARCHAR(128),
            scope_retainer_id VARCHAR(128),
            scope_brand_id VARCHAR(128),
            scope_client_id VARCHAR(128),

            headline TEXT NOT NULL,
            description TEXT,
            severity VARCHAR(16) NOT NULL,
            priority_score DOUBLE PRECISION NOT NULL DEFAULT 0,
            trajectory VARCHAR(16) NOT NULL DEFAULT 'STABLE',
            signal_ids JSONB NOT NULL DEFAULT '[]'::jsonb,

            -- Balance
            balance_negative_count INT NOT NULL DEFAULT 0,
            balance_neutral_count INT NOT NULL DEFAULT 0,
            balance_positive_count INT NOT NULL DEFAULT 0,
            balance_negative_magnitude DOUBLE PRECISION NOT NULL DEFAULT 0,
            balance_positive_magnitude DOUBLE PRECISION NOT NULL DEFAULT 0,
            balance_net_score DOUBLE PRECISION NOT NULL DEFAULT 0,

            recommended_action TEXT,
            recommended_owner_role VARCHAR(32),
            recommended_urgency VARCHAR(16),

            -- State machine
            state VARCHAR(16) NOT NULL,
            regression_count INT NOT NULL DEFAULT 0,
            state_history JSONB NOT NULL DEFAULT '[]'::jsonb,

            detected_at TIMESTAMPTZ,
            surfaced_at TIMESTAMPTZ,
            acknowledged_at TIMESTAMPTZ,
            acknowledged_by VARCHAR(128),
            addressing_started_at TIMESTAMPTZ,
            resolved_at TIMESTAMPTZ,
            resolution_method VARCHAR(32),
            resolved_by VARCHAR(128),
            resolution_notes TEXT,
            monitoring_until TIMESTAMPTZ,
            closed_at TIMESTAMPTZ,
            last_regression_at TIMESTAMPTZ,

            created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
            updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
        )
        """;

    private static final String JOB_LOCKS_DDL = """
        CREATE TABLE job_locks (
            lock_key VARCHAR(64) PRIMARY KEY,
            holder VARCHAR(128),
            acquired_at TIMESTAMPTZ NOT NULL,
            released_at TIMESTAMPTZ
        )
        """;
}
