package in.timeos.repository;

import in.timeos.domain.issue.Issue;
import in.timeos.domain.issue.IssueState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Issue store. Issues are never deleted, only closed.
 */
public interface IssueRepository {
    /**
     * Insert new issue.
     */
    void insert(Issue issue);

    /**
     * Overwrite every mutable column of an existing issue.
     *
     * @return true if a row was updated
     */
    boolean update(Issue issue);

    /**
     * Find issue by ID.
     */
    Optional<Issue> findById(String issueId);

    /**
     * The open issue (DETECTED, SURFACED, ACKNOWLEDGED or ADDRESSING) for a subtype and scope.
     */
    Optional<Issue> findOpen(String issueSubtype, String scopeId);

    /**
     * Every open issue of a subtype.
     */
    List<Issue> findOpenBySubtype(String issueSubtype);

    /**
     * Issues in a state, oldest first.
     */
    List<Issue> findByState(IssueState state);

    /**
     * Monitoring issues whose window is still running at {@code now}.
     */
    List<Issue> findMonitoringActive(Instant now);

    /**
     * Monitoring issues whose window has elapsed at {@code now}.
     */
    List<Issue> findMonitoringExpired(Instant now);

    /**
     * Issues listing any of the given signals.
     */
    List<Issue> findBySignalIds(List<String> signalIds);

    /**
     * Facade listing with filters and paging, highest priority first.
     */
    List<Issue> query(IssueQuery query);
}
