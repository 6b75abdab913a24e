package in.timeos.repository;

import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.signal.ScopeChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.Optional;

/**
 * Resolves scope chains from the agency tables (tasks, projects, invoices, chat_spaces)
 * maintained by the sync jobs. This service never writes to them.
 */
public final class PostgresScopeResolver implements ScopeResolver {
    private static final Logger log = LoggerFactory.getLogger(PostgresScopeResolver.class);

    private final DataSource dataSource;

    public PostgresScopeResolver(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public ScopeChain forTask(String taskId) {
        String sql = """
            SELECT project_id, retainer_id, brand_id, client_id, assignee_id
            FROM tasks
            WHERE id = ?
            """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return new ScopeChain(
                        taskId,
                        rs.getString("project_id"),
                        rs.getString("retainer_id"),
                        rs.getString("brand_id"),
                        rs.getString("client_id"),
                        rs.getString("assignee_id")
                    );
                }
            }
        } catch (Exception e) {
            log.error("Failed to resolve scope for task {}: {}", taskId, e.getMessage());
            throw RepositoryErrors.wrap("Failed to resolve task scope", e);
        }
        return new ScopeChain(taskId, null, null, null, null, null);
    }

    @Override
    public ScopeChain forProject(String projectId) {
        String sql = """
            SELECT brand_id, client_id
            FROM projects
            WHERE id = ?
            """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return new ScopeChain(null, projectId, null,
                        rs.getString("brand_id"), rs.getString("client_id"), null);
                }
            }
        } catch (Exception e) {
            log.error("Failed to resolve scope for project {}: {}", projectId, e.getMessage());
            throw RepositoryErrors.wrap("Failed to resolve project scope", e);
        }
        return new ScopeChain(null, projectId, null, null, null, null);
    }

    @Override
    public ScopeChain forInvoice(String invoiceId) {
        // Brand comes from the invoice's project when it has one
        String sql = """
            SELECT i.project_id, i.retainer_id, i.client_id, p.brand_id
            FROM invoices i
            LEFT JOIN projects p ON p.id = i.project_id
            WHERE i.id = ?
            """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, invoiceId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return new ScopeChain(null,
                        rs.getString("project_id"),
                        rs.getString("retainer_id"),
                        rs.getString("brand_id"),
                        rs.getString("client_id"),
                        null);
                }
            }
        } catch (Exception e) {
            log.error("Failed to resolve scope for invoice {}: {}", invoiceId, e.getMessage());
            throw RepositoryErrors.wrap("Failed to resolve invoice scope", e);
        }
        return ScopeChain.EMPTY;
    }

    @Override
    public ScopeChain forSpace(String spaceId) {
        String sql = """
            SELECT project_id, brand_id, client_id
            FROM chat_spaces
            WHERE space_id = ?
            """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, spaceId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return new ScopeChain(null,
                        rs.getString("project_id"),
                        null,
                        rs.getString("brand_id"),
                        rs.getString("client_id"),
                        null);
                }
            }
        } catch (Exception e) {
            log.error("Failed to resolve scope for space {}: {}", spaceId, e.getMessage());
            throw RepositoryErrors.wrap("Failed to resolve space scope", e);
        }
        return ScopeChain.EMPTY;
    }

    @Override
    public Optional<String> scopeName(ScopeLevel level, String scopeId) {
        String table = switch (level) {
            case TASK -> "tasks";
            case PROJECT -> "projects";
            case RETAINER -> "retainers";
            case BRAND -> "brands";
            case CLIENT -> "clients";
            case PERSON -> null;
        };
        if (table == null || scopeId == null) {
            return Optional.empty();
        }

        String sql = "SELECT name FROM " + table + " WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, scopeId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getString("name"));
                }
            }
        } catch (Exception e) {
            log.error("Failed to resolve name for {} {}: {}", level, scopeId, e.getMessage());
            throw RepositoryErrors.wrap("Failed to resolve scope name", e);
        }
        return Optional.empty();
    }
}
