package in.timeos.repository;

import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.signal.ScopeChain;

import java.util.Optional;

/**
 * Read-only lookup of the agency hierarchy (task, project, retainer, brand, client).
 *
 * A missing row never fails: the chain holds only what the caller already knows.
 */
public interface ScopeResolver {
    ScopeChain forTask(String taskId);

    ScopeChain forProject(String projectId);

    ScopeChain forInvoice(String invoiceId);

    ScopeChain forSpace(String spaceId);

    /**
     * Display name of a scope entity, used in issue headlines.
     */
    Optional<String> scopeName(ScopeLevel level, String scopeId);

    /**
     * Resolve by the entity type recorded on a signal. Unknown types resolve to an empty chain.
     */
    default ScopeChain forEntity(String entityType, String entityId) {
        if (entityType == null || entityId == null) {
            return ScopeChain.EMPTY;
        }
        return switch (entityType) {
            case "task" -> forTask(entityId);
            case "project" -> forProject(entityId);
            case "invoice" -> forInvoice(entityId);
            case "space" -> forSpace(entityId);
            case "client" -> ScopeChain.ofClient(entityId);
            default -> ScopeChain.EMPTY;
        };
    }
}
