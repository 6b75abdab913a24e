package in.timeos.detector.feed;

import java.time.Instant;

/**
 * A calendar meeting with its observed outcome.
 */
public record MeetingRecord(
    String id,
    String title,
    String clientId,
    String projectId,
    Instant startTime,
    Instant endTime,
    Outcome outcome
) {
    public enum Outcome {
        SCHEDULED,
        OCCURRED,
        NOSHOW_CLIENT,
        CANCELLED
    }
}
