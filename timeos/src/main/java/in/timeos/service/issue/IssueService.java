package in.timeos.service.issue;

import in.timeos.domain.issue.Issue;
import in.timeos.domain.issue.ResolutionMethod;
import in.timeos.repository.IssueQuery;
import in.timeos.repository.IssueRepository;
import in.timeos.service.resolution.ResolutionService;

import java.util.List;
import java.util.Optional;

/**
 * Facade over issues for the HTTP layer. Transitions delegate to {@link ResolutionService}.
 */
public final class IssueService {
    private final IssueRepository issueRepository;
    private final ResolutionService resolutionService;

    public IssueService(IssueRepository issueRepository, ResolutionService resolutionService) {
        this.issueRepository = issueRepository;
        this.resolutionService = resolutionService;
    }

    public Optional<Issue> get(String issueId) {
        return issueRepository.findById(issueId);
    }

    public List<Issue> list(IssueQuery query) {
        return issueRepository.query(query);
    }

    public boolean acknowledge(String issueId, String actor) {
        return resolutionService.acknowledge(issueId, actor);
    }

    public boolean startAddressing(String issueId, String actor) {
        return resolutionService.startAddressing(issueId, actor);
    }

    /**
     * Resolve by hand. A null method means MANUAL.
     *
     * @throws IllegalArgumentException for DISMISSED, which only {@link #dismiss} records
     */
    public boolean resolve(String issueId, ResolutionMethod method, String actor, String notes) {
        ResolutionMethod resolvedAs = method != null ? method : ResolutionMethod.MANUAL;
        if (resolvedAs == ResolutionMethod.DISMISSED) {
            throw new IllegalArgumentException("Use dismiss to close an issue as dismissed");
        }
        return resolutionService.resolve(issueId, resolvedAs, actor, notes);
    }

    public boolean dismiss(String issueId, String actor, String reason) {
        return resolutionService.dismiss(issueId, actor, reason);
    }
}
