package in.timeos.service.issue;

import in.timeos.domain.common.SweepError;

import java.util.List;

public record FormationReport(
    int created,
    int updated,
    int unchanged,
    List<FormationOutcome> outcomes,
    List<SweepError> errors
) {
    public FormationReport {
        outcomes = List.copyOf(outcomes);
        errors = List.copyOf(errors);
    }

    public static FormationReport of(List<FormationOutcome> outcomes, List<SweepError> errors) {
        int created = 0;
        int updated = 0;
        int unchanged = 0;
        for (FormationOutcome o : outcomes) {
            switch (o.result()) {
                case CREATED -> created++;
                case UPDATED -> updated++;
                case UNCHANGED -> unchanged++;
            }
        }
        return new FormationReport(created, updated, unchanged, outcomes, errors);
    }

    public static FormationReport failed(SweepError error) {
        return new FormationReport(0, 0, 0, List.of(), List.of(error));
    }
}
