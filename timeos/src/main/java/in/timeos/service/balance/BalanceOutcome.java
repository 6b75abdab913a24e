package in.timeos.service.balance;

import java.util.List;

/**
 * Effect of one positive signal.
 */
public record BalanceOutcome(List<String> balancedSignalIds, int issuesRecalculated, int autoResolved) {
    public static final BalanceOutcome NONE = new BalanceOutcome(List.of(), 0, 0);

    public BalanceOutcome {
        balancedSignalIds = List.copyOf(balancedSignalIds);
    }
}
