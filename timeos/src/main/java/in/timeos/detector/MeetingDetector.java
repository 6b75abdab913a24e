package in.timeos.detector;

import in.timeos.detector.feed.MeetingFeed;
import in.timeos.detector.feed.MeetingRecord;
import in.timeos.domain.signal.ScopeChain;
import in.timeos.domain.signal.Signal;
import in.timeos.domain.signal.SignalSource;
import in.timeos.domain.signal.SignalTypes;
import in.timeos.repository.ScopeResolver;
import in.timeos.repository.SignalRepository;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Relationship signals from client meetings.
 */
public final class MeetingDetector extends AbstractSignalDetector {
    public static final String ID = "meeting";

    static final List<String> URGENT_TITLE_KEYWORDS = List.of(
        "urgent", "escalation", "critical", "emergency", "crisis", "asap"
    );

    private static final Set<String> TYPES = Set.of(
        SignalTypes.MEETING_OCCURRED,
        SignalTypes.MEETING_NOSHOW_CLIENT,
        SignalTypes.MEETING_TITLE_URGENT
    );

    private final MeetingFeed feed;

    public MeetingDetector(SignalRepository signalRepository, ScopeResolver scopeResolver, MeetingFeed feed) {
        this(signalRepository, scopeResolver, feed, Clock.systemUTC());
    }

    public MeetingDetector(SignalRepository signalRepository, ScopeResolver scopeResolver, MeetingFeed feed,
                           Clock clock) {
        super(signalRepository, scopeResolver, clock);
        this.feed = feed;
    }

    @Override
    public String detectorId() {
        return ID;
    }

    @Override
    public String detectorVersion() {
        return "1.0.0";
    }

    @Override
    public Set<String> signalTypes() {
        return TYPES;
    }

    @Override
    protected void scan(List<Signal> out) {
        for (MeetingRecord meeting : feed.fetchMeetings()) {
            if (meeting.id() == null) {
                continue;
            }
            MeetingRecord.Outcome outcome = meeting.outcome() == null
                ? MeetingRecord.Outcome.SCHEDULED
                : meeting.outcome();

            switch (outcome) {
                case OCCURRED -> meetingSignal(out, SignalTypes.MEETING_OCCURRED, 0.4, meeting);
                case NOSHOW_CLIENT -> meetingSignal(out, SignalTypes.MEETING_NOSHOW_CLIENT, 0.6, meeting);
                case SCHEDULED, CANCELLED -> { }
            }

            if (outcome != MeetingRecord.Outcome.CANCELLED && hasUrgentTitle(meeting.title())) {
                meetingSignal(out, SignalTypes.MEETING_TITLE_URGENT, 0.5, meeting);
            }
        }
    }

    private void meetingSignal(List<Signal> out, String type, double magnitude, MeetingRecord meeting) {
        if (signalExists(type, meeting.id())) {
            return;
        }
        emit(out, draft(type, "meeting", meeting.id(), SignalSource.CALENDAR)
            .magnitude(magnitude)
            .scope(scopeFor(meeting))
            .source(SignalSource.CALENDAR, meeting.id(), null, TaskDetector.truncate(meeting.title()))
            .payload("title", meeting.title())
            .occurredAt(meeting.startTime())
            .detectionConfidence(0.9)
            .attributionConfidence(meeting.projectId() != null ? 0.9 : 0.7));
    }

    private ScopeChain scopeFor(MeetingRecord meeting) {
        ScopeChain known = ScopeChain.ofClient(meeting.clientId());
        if (meeting.projectId() != null) {
            return scopeResolver.forProject(meeting.projectId()).mergeMissing(known);
        }
        return known;
    }

    static boolean hasUrgentTitle(String title) {
        if (title == null) {
            return false;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        return URGENT_TITLE_KEYWORDS.stream().anyMatch(lower::contains);
    }
}
