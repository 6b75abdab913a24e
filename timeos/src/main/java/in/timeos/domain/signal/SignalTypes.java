package in.timeos.domain.signal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Known signal types with their category and default valence.
 */
public final class SignalTypes {

    // Schedule
    public static final String TASK_CREATED = "task_created";
    public static final String TASK_ASSIGNED = "task_assigned";
    public static final String TASK_COMPLETED_EARLY = "task_completed_early";
    public static final String TASK_COMPLETED_ONTIME = "task_completed_ontime";
    public static final String TASK_COMPLETED_LATE = "task_completed_late";
    public static final String TASK_OVERDUE = "task_overdue";
    public static final String TASK_APPROACHING = "task_approaching";
    public static final String TASK_BLOCKED = "task_blocked";
    public static final String TASK_UNBLOCKED = "task_unblocked";
    public static final String TASK_DUE_MOVED_OUT = "task_due_moved_out";

    // Quality
    public static final String VERSION_CREATED = "version_created";
    public static final String REVISION_CYCLE_NORMAL = "revision_cycle_normal";
    public static final String REVISION_CYCLE_HIGH = "revision_cycle_high";
    public static final String REVISION_CYCLE_EXCESSIVE = "revision_cycle_excessive";

    // Financial
    public static final String QUOTE_ACCEPTED = "quote_accepted";
    public static final String QUOTE_REJECTED = "quote_rejected";
    public static final String INVOICE_ADVANCE_ISSUED = "invoice_advance_issued";
    public static final String INVOICE_ADVANCE_PAID = "invoice_advance_paid";
    public static final String INVOICE_FINAL_ISSUED = "invoice_final_issued";
    public static final String INVOICE_FINAL_PAID = "invoice_final_paid";
    public static final String PAYMENT_RECEIVED_ONTIME = "payment_received_ontime";
    public static final String PAYMENT_RECEIVED_LATE = "payment_received_late";
    public static final String INVOICE_OVERDUE_30 = "invoice_overdue_30";
    public static final String INVOICE_OVERDUE_60 = "invoice_overdue_60";
    public static final String INVOICE_OVERDUE_90 = "invoice_overdue_90";

    // Communication
    public static final String RESPONSE_FAST_TEAM = "response_fast_team";
    public static final String RESPONSE_SLOW_TEAM = "response_slow_team";
    public static final String RESPONSE_FAST_CLIENT = "response_fast_client";
    public static final String RESPONSE_SLOW_CLIENT = "response_slow_client";
    public static final String SENTIMENT_POSITIVE = "sentiment_positive";
    public static final String SENTIMENT_NEGATIVE = "sentiment_negative";
    public static final String ESCALATION_DETECTED = "escalation_detected";
    public static final String ENGAGEMENT_INCREASING = "engagement_increasing";
    public static final String ENGAGEMENT_DECREASING = "engagement_decreasing";
    public static final String COMMUNICATION_GAP = "communication_gap";
    public static final String EMAIL_URGENT = "email_urgent";
    public static final String EMAIL_UNANSWERED = "email_unanswered";
    public static final String EMAIL_CLIENT_ACTIVE = "email_client_active";

    // Relationship
    public static final String MEETING_SCHEDULED = "meeting_scheduled";
    public static final String MEETING_OCCURRED = "meeting_occurred";
    public static final String MEETING_NOSHOW_CLIENT = "meeting_noshow_client";
    public static final String MEETING_NOSHOW_TEAM = "meeting_noshow_team";
    public static final String MEETING_CANCELLED = "meeting_cancelled";
    public static final String MEETING_DECISION_MADE = "meeting_decision_made";
    public static final String MEETING_APPROVAL_GIVEN = "meeting_approval_given";
    public static final String MEETING_CONCERN_RAISED = "meeting_concern_raised";
    public static final String MEETING_ACTION_ITEM = "meeting_action_item";
    public static final String ACTION_ITEM_NOT_TASKED = "action_item_not_tasked";
    public static final String MEETING_TITLE_URGENT = "meeting_title_urgent";

    public record TypeInfo(SignalCategory category, int defaultValence) {}

    private static final Map<String, TypeInfo> TYPES;

    static {
        Map<String, TypeInfo> m = new LinkedHashMap<>();

        put(m, SignalCategory.SCHEDULE, 0, TASK_CREATED, TASK_ASSIGNED, TASK_APPROACHING);
        put(m, SignalCategory.SCHEDULE, 1, TASK_COMPLETED_EARLY, TASK_COMPLETED_ONTIME, TASK_UNBLOCKED);
        put(m, SignalCategory.SCHEDULE, -1, TASK_COMPLETED_LATE, TASK_OVERDUE, TASK_BLOCKED, TASK_DUE_MOVED_OUT);

        put(m, SignalCategory.QUALITY, 0, VERSION_CREATED, REVISION_CYCLE_NORMAL);
        put(m, SignalCategory.QUALITY, -1, REVISION_CYCLE_HIGH, REVISION_CYCLE_EXCESSIVE);

        put(m, SignalCategory.FINANCIAL, 0, INVOICE_ADVANCE_ISSUED, INVOICE_FINAL_ISSUED);
        put(m, SignalCategory.FINANCIAL, 1, QUOTE_ACCEPTED, INVOICE_ADVANCE_PAID, INVOICE_FINAL_PAID,
            PAYMENT_RECEIVED_ONTIME, PAYMENT_RECEIVED_LATE);
        put(m, SignalCategory.FINANCIAL, -1, QUOTE_REJECTED, INVOICE_OVERDUE_30, INVOICE_OVERDUE_60,
            INVOICE_OVERDUE_90);

        put(m, SignalCategory.COMMUNICATION, 1, RESPONSE_FAST_TEAM, RESPONSE_FAST_CLIENT, SENTIMENT_POSITIVE,
            ENGAGEMENT_INCREASING, EMAIL_CLIENT_ACTIVE);
        put(m, SignalCategory.COMMUNICATION, -1, RESPONSE_SLOW_TEAM, RESPONSE_SLOW_CLIENT, SENTIMENT_NEGATIVE,
            ESCALATION_DETECTED, ENGAGEMENT_DECREASING, COMMUNICATION_GAP, EMAIL_URGENT, EMAIL_UNANSWERED);

        put(m, SignalCategory.RELATIONSHIP, 0, MEETING_SCHEDULED, MEETING_CANCELLED, MEETING_ACTION_ITEM);
        put(m, SignalCategory.RELATIONSHIP, 1, MEETING_OCCURRED, MEETING_DECISION_MADE, MEETING_APPROVAL_GIVEN);
        put(m, SignalCategory.RELATIONSHIP, -1, MEETING_NOSHOW_CLIENT, MEETING_NOSHOW_TEAM,
            MEETING_CONCERN_RAISED, ACTION_ITEM_NOT_TASKED, MEETING_TITLE_URGENT);

        TYPES = Collections.unmodifiableMap(m);
    }

    private static void put(Map<String, TypeInfo> m, SignalCategory category, int valence, String... types) {
        for (String type : types) {
            m.put(type, new TypeInfo(category, valence));
        }
    }

    public static SignalCategory categoryOf(String signalType) {
        TypeInfo info = TYPES.get(signalType);
        return info != null ? info.category() : SignalCategory.PROCESS;
    }

    public static int defaultValenceOf(String signalType) {
        TypeInfo info = TYPES.get(signalType);
        return info != null ? info.defaultValence() : 0;
    }

    public static boolean isKnown(String signalType) {
        return TYPES.containsKey(signalType);
    }

    public static Set<String> all() {
        return TYPES.keySet();
    }

    private SignalTypes() {}
}
