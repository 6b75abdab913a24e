package in.timeos.service.resolution;

import in.timeos.domain.common.SweepError;

import java.util.List;

public record ResolutionCheckReport(int checked, int autoResolved, List<SweepError> errors) {
    public ResolutionCheckReport {
        errors = List.copyOf(errors);
    }
}
