package in.timeos.service.core;

import in.timeos.domain.common.SweepError;

import java.util.List;

public record ExpiryReport(int expired, List<SweepError> errors) {
    public ExpiryReport {
        errors = List.copyOf(errors);
    }
}
