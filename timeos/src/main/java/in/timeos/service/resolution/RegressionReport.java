package in.timeos.service.resolution;

import in.timeos.domain.common.SweepError;

import java.util.List;

/**
 * @param regressedIssueIds issues reopened to SURFACED
 * @param closed monitoring issues closed after their window elapsed
 */
public record RegressionReport(List<String> regressedIssueIds, int closed, List<SweepError> errors) {
    public RegressionReport {
        regressedIssueIds = List.copyOf(regressedIssueIds);
        errors = List.copyOf(errors);
    }
}
