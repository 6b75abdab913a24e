package in.timeos.service.balance;

import in.timeos.domain.common.SweepError;

import java.util.List;

/**
 * @param processed positive signals examined
 * @param balanced negative signals marked BALANCED
 * @param issuesRecalculated issues whose balance was refreshed
 * @param autoResolved ADDRESSING issues resolved with SIGNALS_BALANCED
 */
public record BalanceReport(int processed, int balanced, int issuesRecalculated, int autoResolved,
                            List<SweepError> errors) {
    public BalanceReport {
        errors = List.copyOf(errors);
    }
}
