package in.timeos.service.issue;

/**
 * What one formation pass did for one (pattern, scope).
 *
 * @param issueId the created or touched issue
 */
public record FormationOutcome(String issueSubtype, String scopeId, String issueId, Result result) {
    public enum Result {
        CREATED,
        UPDATED,
        UNCHANGED
    }
}
