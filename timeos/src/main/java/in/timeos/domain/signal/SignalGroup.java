package in.timeos.domain.signal;

import java.util.List;

/**
 * Active signals sharing one scope id, with recency-weighted aggregates.
 */
public record SignalGroup(
    String scopeId,
    List<String> signalIds,
    SignalBalance balance,
    int categoryCount
) {
    public SignalGroup {
        signalIds = List.copyOf(signalIds);
    }

    public int signalCount() {
        return signalIds.size();
    }

    public double negativeMagnitude() {
        return balance.negativeMagnitude();
    }

    public double positiveMagnitude() {
        return balance.positiveMagnitude();
    }

    public double netScore() {
        return balance.netScore();
    }
}
