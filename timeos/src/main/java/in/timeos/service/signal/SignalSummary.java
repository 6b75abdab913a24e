package in.timeos.service.signal;

import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.signal.CategoryCounts;
import in.timeos.domain.signal.SignalCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Active signal counts per category over a window, with totals.
 *
 * @param scopeLevel null for an unscoped summary
 */
public record SignalSummary(
    Map<SignalCategory, CategoryCounts> byCategory,
    long negative,
    long neutral,
    long positive,
    int windowDays,
    ScopeLevel scopeLevel,
    String scopeId
) {
    public SignalSummary {
        byCategory = byCategory.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(byCategory));
    }

    public static SignalSummary of(Map<SignalCategory, CategoryCounts> byCategory, int windowDays,
                                   ScopeLevel scopeLevel, String scopeId) {
        long negative = 0;
        long neutral = 0;
        long positive = 0;
        for (CategoryCounts c : byCategory.values()) {
            negative += c.negative();
            neutral += c.neutral();
            positive += c.positive();
        }
        return new SignalSummary(byCategory, negative, neutral, positive, windowDays, scopeLevel, scopeId);
    }

    public long total() {
        return negative + neutral + positive;
    }

    public long netCount() {
        return positive - negative;
    }
}
