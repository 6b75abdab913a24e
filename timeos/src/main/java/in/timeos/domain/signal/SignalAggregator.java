package in.timeos.domain.signal;

import in.timeos.domain.common.ScopeLevel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Recency-weighted aggregation over signals.
 *
 * Store implementations select candidate rows and hand them here, so every backend computes
 * the same sums.
 */
public final class SignalAggregator {

    /**
     * Valence counts and decayed magnitudes over every given signal, whatever its status.
     */
    public static SignalBalance balanceOf(Collection<Signal> signals, Instant now) {
        int negCount = 0;
        int neutralCount = 0;
        int posCount = 0;
        double negMag = 0.0;
        double posMag = 0.0;

        for (Signal s : signals) {
            if (s.isNegative()) {
                negCount++;
                negMag += RecencyWeighting.weightedMagnitude(s, now);
            } else if (s.isPositive()) {
                posCount++;
                posMag += RecencyWeighting.weightedMagnitude(s, now);
            } else {
                neutralCount++;
            }
        }
        return new SignalBalance(negCount, neutralCount, posCount, negMag, posMag);
    }

    /**
     * Group signals by their id at {@code level}. Signals with no id at that level are skipped.
     * Groups come back ordered by scope id.
     */
    public static List<SignalGroup> groupByScope(Collection<Signal> signals, ScopeLevel level, Instant now) {
        Map<String, List<Signal>> byScope = new TreeMap<>();
        for (Signal s : signals) {
            String scopeId = s.scope().idFor(level);
            if (scopeId == null) {
                continue;
            }
            byScope.computeIfAbsent(scopeId, k -> new ArrayList<>()).add(s);
        }

        List<SignalGroup> groups = new ArrayList<>(byScope.size());
        for (Map.Entry<String, List<Signal>> e : byScope.entrySet()) {
            groups.add(toGroup(e.getKey(), e.getValue(), now));
        }
        return groups;
    }

    public static SignalGroup toGroup(String scopeId, List<Signal> members, Instant now) {
        List<String> ids = new ArrayList<>(members.size());
        Set<SignalCategory> categories = EnumSet.noneOf(SignalCategory.class);
        for (Signal s : members) {
            ids.add(s.id());
            categories.add(s.category());
        }
        return new SignalGroup(scopeId, ids, balanceOf(members, now), categories.size());
    }

    /**
     * Groups meeting both thresholds.
     */
    public static List<SignalGroup> qualifying(List<SignalGroup> groups, int minCount, double minNegativeMagnitude) {
        return groups.stream()
            .filter(g -> g.signalCount() >= minCount && g.negativeMagnitude() >= minNegativeMagnitude)
            .toList();
    }

    private SignalAggregator() {}
}
