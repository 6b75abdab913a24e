package in.timeos.detector.feed;

import java.time.LocalDate;

/**
 * A task as synced from the project management tool.
 */
public record TaskRecord(
    String id,
    String name,
    String projectId,
    String assigneeId,
    LocalDate dueOn,
    boolean completed,
    boolean blocked,
    String url
) {}
