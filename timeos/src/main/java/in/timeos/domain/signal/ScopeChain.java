package in.timeos.domain.signal;

import in.timeos.domain.common.ScopeLevel;

/**
 * Resolved ancestor ids of an observed entity. Any level may be null.
 */
public record ScopeChain(
    String taskId,
    String projectId,
    String retainerId,
    String brandId,
    String clientId,
    String personId
) {
    public static final ScopeChain EMPTY = new ScopeChain(null, null, null, null, null, null);

    public static ScopeChain ofClient(String clientId) {
        return new ScopeChain(null, null, null, null, clientId, null);
    }

    public String idFor(ScopeLevel level) {
        return switch (level) {
            case TASK -> taskId;
            case PROJECT -> projectId;
            case RETAINER -> retainerId;
            case BRAND -> brandId;
            case CLIENT -> clientId;
            case PERSON -> personId;
        };
    }

    /**
     * Fill every null level of this chain from {@code other}; levels already set win.
     */
    public ScopeChain mergeMissing(ScopeChain other) {
        if (other == null) {
            return this;
        }
        return new ScopeChain(
            taskId != null ? taskId : other.taskId,
            projectId != null ? projectId : other.projectId,
            retainerId != null ? retainerId : other.retainerId,
            brandId != null ? brandId : other.brandId,
            clientId != null ? clientId : other.clientId,
            personId != null ? personId : other.personId
        );
    }

    public boolean isEmpty() {
        return taskId == null && projectId == null && retainerId == null
            && brandId == null && clientId == null && personId == null;
    }
}
