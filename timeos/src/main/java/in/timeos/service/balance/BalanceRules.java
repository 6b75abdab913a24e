package in.timeos.service.balance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static in.timeos.domain.signal.SignalTypes.*;

/**
 * Which positive signal types cancel which negative ones, and how closely their
 * scopes must match.
 */
public final class BalanceRules {

    public enum ScopeMatch {
        EXACT_ENTITY,
        SAME_PROJECT,
        SAME_BRAND,
        SAME_CLIENT
    }

    /** Positives required within the window for sustained-balance types. */
    public static final int SUSTAINED_BALANCE_COUNT = 3;
    public static final int SUSTAINED_BALANCE_DAYS = 14;

    private static final Map<String, List<String>> BALANCE_PAIRS;
    private static final Map<String, ScopeMatch> SCOPE_MATCH;
    private static final Set<String> SUSTAINED = Set.of(SENTIMENT_NEGATIVE, ENGAGEMENT_DECREASING);

    static {
        Map<String, List<String>> pairs = new LinkedHashMap<>();
        // schedule
        pairs.put(TASK_OVERDUE, List.of(TASK_COMPLETED_ONTIME, TASK_COMPLETED_LATE, TASK_COMPLETED_EARLY));
        pairs.put(TASK_BLOCKED, List.of(TASK_UNBLOCKED));
        // quality
        pairs.put(REVISION_CYCLE_HIGH, List.of(MEETING_APPROVAL_GIVEN, SENTIMENT_POSITIVE));
        pairs.put(REVISION_CYCLE_EXCESSIVE, List.of(MEETING_APPROVAL_GIVEN));
        // financial
        pairs.put(INVOICE_OVERDUE_30, List.of(PAYMENT_RECEIVED_ONTIME, PAYMENT_RECEIVED_LATE));
        pairs.put(INVOICE_OVERDUE_60, List.of(PAYMENT_RECEIVED_ONTIME, PAYMENT_RECEIVED_LATE));
        pairs.put(INVOICE_OVERDUE_90, List.of(PAYMENT_RECEIVED_ONTIME, PAYMENT_RECEIVED_LATE));
        // communication
        pairs.put(COMMUNICATION_GAP, List.of(MEETING_OCCURRED, SENTIMENT_POSITIVE));
        pairs.put(RESPONSE_SLOW_CLIENT, List.of(RESPONSE_FAST_CLIENT));
        pairs.put(RESPONSE_SLOW_TEAM, List.of(RESPONSE_FAST_TEAM));
        pairs.put(SENTIMENT_NEGATIVE, List.of(SENTIMENT_POSITIVE));
        pairs.put(ESCALATION_DETECTED, List.of(SENTIMENT_POSITIVE, MEETING_DECISION_MADE, MEETING_APPROVAL_GIVEN));
        pairs.put(ENGAGEMENT_DECREASING, List.of(ENGAGEMENT_INCREASING));
        // relationship
        pairs.put(MEETING_NOSHOW_CLIENT, List.of(MEETING_OCCURRED));
        pairs.put(MEETING_NOSHOW_TEAM, List.of(MEETING_OCCURRED));
        pairs.put(MEETING_CONCERN_RAISED, List.of(MEETING_DECISION_MADE, MEETING_APPROVAL_GIVEN));
        pairs.put(MEETING_TITLE_URGENT, List.of(MEETING_OCCURRED, MEETING_DECISION_MADE));
        BALANCE_PAIRS = Collections.unmodifiableMap(pairs);

        Map<String, ScopeMatch> match = new LinkedHashMap<>();
        for (String type : List.of(TASK_OVERDUE, TASK_BLOCKED, REVISION_CYCLE_HIGH, REVISION_CYCLE_EXCESSIVE,
                INVOICE_OVERDUE_30, INVOICE_OVERDUE_60, INVOICE_OVERDUE_90)) {
            match.put(type, ScopeMatch.EXACT_ENTITY);
        }
        SCOPE_MATCH = Collections.unmodifiableMap(match);
    }

    /**
     * Positive types that can balance {@code negativeType}; empty when it cannot be balanced.
     */
    public static List<String> balancingTypes(String negativeType) {
        return BALANCE_PAIRS.getOrDefault(negativeType, List.of());
    }

    public static boolean canBalance(String negativeType, String positiveType) {
        return balancingTypes(negativeType).contains(positiveType);
    }

    /**
     * Negative types a positive of {@code positiveType} can balance, in rule order.
     */
    public static List<String> balancedBy(String positiveType) {
        return BALANCE_PAIRS.entrySet().stream()
            .filter(e -> e.getValue().contains(positiveType))
            .map(Map.Entry::getKey)
            .toList();
    }

    /**
     * Every positive type that balances something.
     */
    public static Set<String> allBalancingTypes() {
        Set<String> types = new LinkedHashSet<>();
        BALANCE_PAIRS.values().forEach(types::addAll);
        return types;
    }

    public static boolean requiresSustainedBalance(String negativeType) {
        return SUSTAINED.contains(negativeType);
    }

    public static ScopeMatch scopeMatch(String negativeType) {
        return SCOPE_MATCH.getOrDefault(negativeType, ScopeMatch.SAME_CLIENT);
    }

    private BalanceRules() {}
}
