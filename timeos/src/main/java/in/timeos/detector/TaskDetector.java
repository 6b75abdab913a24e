package in.timeos.detector;

import in.timeos.detector.feed.TaskFeed;
import in.timeos.detector.feed.TaskRecord;
import in.timeos.domain.signal.ScopeChain;
import in.timeos.domain.signal.Signal;
import in.timeos.domain.signal.SignalSource;
import in.timeos.domain.signal.SignalTypes;
import in.timeos.repository.ScopeResolver;
import in.timeos.repository.SignalRepository;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;

/**
 * Schedule signals from open tasks: overdue, approaching and blocked.
 */
public final class TaskDetector extends AbstractSignalDetector {
    public static final String ID = "task";

    static final int APPROACHING_DAYS = 3;

    private static final Set<String> TYPES = Set.of(
        SignalTypes.TASK_OVERDUE,
        SignalTypes.TASK_APPROACHING,
        SignalTypes.TASK_BLOCKED
    );

    private final TaskFeed feed;

    public TaskDetector(SignalRepository signalRepository, ScopeResolver scopeResolver, TaskFeed feed) {
        this(signalRepository, scopeResolver, feed, Clock.systemUTC());
    }

    public TaskDetector(SignalRepository signalRepository, ScopeResolver scopeResolver, TaskFeed feed, Clock clock) {
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
        for (TaskRecord task : feed.fetchTasks()) {
            if (task.id() == null || task.completed()) {
                continue;
            }
            if (task.dueOn() != null) {
                long daysOverdue = ChronoUnit.DAYS.between(task.dueOn(), today());
                if (daysOverdue > 0) {
                    overdue(out, task, daysOverdue);
                } else if (-daysOverdue <= APPROACHING_DAYS) {
                    approaching(out, task, -daysOverdue);
                }
            }
            if (task.blocked()) {
                blocked(out, task);
            }
        }
    }

    private void overdue(List<Signal> out, TaskRecord task, long daysOverdue) {
        if (signalExists(SignalTypes.TASK_OVERDUE, task.id())) {
            return;
        }
        emit(out, draft(SignalTypes.TASK_OVERDUE, task)
            .magnitude(overdueMagnitude(daysOverdue))
            .payload("days_overdue", daysOverdue)
            .payload("due_on", task.dueOn().toString())
            .occurredAt(task.dueOn().plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant()));
    }

    private void approaching(List<Signal> out, TaskRecord task, long daysUntilDue) {
        if (signalExists(SignalTypes.TASK_APPROACHING, task.id())) {
            return;
        }
        emit(out, draft(SignalTypes.TASK_APPROACHING, task)
            .valence(0)
            .magnitude(0.3)
            .payload("days_until_due", daysUntilDue)
            .payload("due_on", task.dueOn().toString())
            .expiresAt(task.dueOn().plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant()));
    }

    private void blocked(List<Signal> out, TaskRecord task) {
        if (signalExists(SignalTypes.TASK_BLOCKED, task.id())) {
            return;
        }
        emit(out, draft(SignalTypes.TASK_BLOCKED, task).magnitude(0.5));
    }

    private Signal.Builder draft(String type, TaskRecord task) {
        ScopeChain known = new ScopeChain(task.id(), task.projectId(), null, null, null, task.assigneeId());
        ScopeChain scope = scopeResolver.forTask(task.id()).mergeMissing(known);
        return draft(type, "task", task.id(), SignalSource.ASANA)
            .scope(scope)
            .source(SignalSource.ASANA, task.id(), task.url(), truncate(task.name()))
            .detectionConfidence(0.95)
            .attributionConfidence(0.9);
    }

    static String truncate(String text) {
        if (text == null) {
            return null;
        }
        return text.length() <= 200 ? text : text.substring(0, 200);
    }
}
