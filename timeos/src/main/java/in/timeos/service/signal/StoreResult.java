package in.timeos.service.signal;

import in.timeos.domain.common.SweepError;

import java.util.List;

public record StoreResult(int stored, List<SweepError> errors) {
    public StoreResult {
        errors = List.copyOf(errors);
    }
}
