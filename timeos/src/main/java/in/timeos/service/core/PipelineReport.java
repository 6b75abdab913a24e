package in.timeos.service.core;

import in.timeos.domain.common.SweepError;
import in.timeos.service.balance.BalanceReport;
import in.timeos.service.detection.DetectionReport;
import in.timeos.service.issue.FormationReport;
import in.timeos.service.resolution.RegressionReport;
import in.timeos.service.resolution.ResolutionCheckReport;

import java.util.List;

/**
 * One full cycle. Steps that did not run are null; {@code errors} holds cycle-level failures.
 */
public record PipelineReport(
    DetectionReport detection,
    BalanceReport balance,
    FormationReport formation,
    ResolutionCheckReport resolution,
    RegressionReport regressions,
    List<SweepError> errors
) {
    public PipelineReport {
        errors = List.copyOf(errors);
    }

    public static PipelineReport refused(SweepError error) {
        return new PipelineReport(null, null, null, null, null, List.of(error));
    }
}
