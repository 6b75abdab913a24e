package in.timeos.service.issue;

import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.issue.Issue;
import in.timeos.domain.issue.IssueSeverity;
import in.timeos.domain.issue.IssueState;
import in.timeos.domain.issue.IssueType;
import in.timeos.domain.issue.RecommendedUrgency;
import in.timeos.domain.issue.Trajectory;
import in.timeos.domain.pattern.IssuePattern;
import in.timeos.domain.pattern.IssuePatternRegistry;
import in.timeos.domain.pattern.SeverityRule;
import in.timeos.domain.signal.Signal;
import in.timeos.domain.signal.SignalStatus;
import in.timeos.domain.signal.SignalTypes;
import in.timeos.infrastructure.metrics.NoOpPipelineMetrics;
import in.timeos.repository.RepositoryException;
import in.timeos.repository.SignalRepository;
import in.timeos.repository.StorageUnavailableException;
import in.timeos.support.InMemoryIssueRepository;
import in.timeos.support.InMemorySignalRepository;
import in.timeos.support.MapScopeResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static in.timeos.support.TestSignals.taskOverdue;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class IssueFormationServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static final IssuePattern OVERDUE_CLUSTER = new IssuePattern(
        IssueType.SCHEDULE_DELIVERY, "overdue_cluster", ScopeLevel.CLIENT,
        List.of(SignalTypes.TASK_OVERDUE), List.of(),
        3, 2.0,
        List.of(),
        "{scope_name}: {overdue_count} overdue",
        "{overdue_count} tasks overdue",
        "Review workload", "pm", RecommendedUrgency.THIS_WEEK);

    private InMemorySignalRepository signals;
    private InMemoryIssueRepository issues;
    private MapScopeResolver resolver;

    @BeforeEach
    void setUp() {
        signals = new InMemorySignalRepository(CLOCK);
        issues = new InMemoryIssueRepository();
        resolver = new MapScopeResolver().name(ScopeLevel.CLIENT, "C1", "Acme");
    }

    private IssueFormationService service(IssuePattern... patterns) {
        return new IssueFormationService(new IssuePatternRegistry(List.of(patterns)), signals, issues, resolver,
            NoOpPipelineMetrics.INSTANCE, CLOCK);
    }

    private void overdue(int count, double magnitude) {
        for (int i = 0; i < count; i++) {
            signals.insert(taskOverdue("T-" + Signal.newId(), magnitude, "C1", NOW));
        }
    }

    @Test
    @DisplayName("Qualifying group creates a surfaced issue and consumes its signals")
    void runFormation_createsSurfacedIssue() {
        // Arrange
        overdue(4, 0.7);
        IssueFormationService service = service(OVERDUE_CLUSTER);

        // Act
        FormationReport report = service.runFormation();

        // Assert
        assertEquals(1, report.created());
        assertTrue(report.errors().isEmpty());

        Issue issue = issues.all().get(0);
        assertEquals(IssueState.SURFACED, issue.state());
        assertEquals(IssueSeverity.MEDIUM, issue.severity());
        assertEquals(102.4, issue.priorityScore(), 1e-9);
        assertEquals("C1", issue.scopeId());
        assertEquals("C1", issue.scopeClientId());
        assertEquals("Acme: 4 overdue", issue.headline());
        assertEquals(4, issue.signalIds().size());
        assertEquals(2.8, issue.balance().negativeMagnitude(), 1e-9);
        assertEquals(List.of(IssueState.DETECTED, IssueState.SURFACED),
            issue.stateHistory().stream().map(h -> h.state()).toList());
        assertEquals(NOW, issue.surfacedAt());

        for (Signal s : signals.all()) {
            assertEquals(SignalStatus.CONSUMED, s.status());
            assertEquals(issue.id(), s.consumedByIssueId());
        }
    }

    @Test
    void rerun_withoutNewSignals_isUnchanged() {
        overdue(4, 0.7);
        IssueFormationService service = service(OVERDUE_CLUSTER);
        service.runFormation();

        FormationReport second = service.runFormation();

        assertEquals(0, second.created());
        assertEquals(0, second.updated());
        assertEquals(1, second.unchanged());
        assertEquals(1, issues.all().size());
    }

    @Test
    @DisplayName("Lighter new wave improves the issue and rescores on the wave alone")
    void lighterWave_updatesIssueAsImproving() {
        // Arrange
        overdue(4, 0.7);
        IssueFormationService service = service(OVERDUE_CLUSTER);
        service.runFormation();
        String issueId = issues.all().get(0).id();
        overdue(3, 0.7);

        // Act
        FormationReport report = service.runFormation();

        // Assert
        assertEquals(1, report.updated());
        Issue issue = issues.require(issueId);
        assertEquals(7, issue.signalIds().size());
        assertEquals(2.1, issue.balance().negativeMagnitude(), 1e-9);
        assertEquals(3, issue.balance().negativeCount());
        assertEquals(Trajectory.IMPROVING, issue.trajectory());
        assertEquals(40 * 2.0 * 1.21, issue.priorityScore(), 1e-9);
        assertEquals("Acme: 3 overdue", issue.headline());
        assertEquals(1, issues.all().size());
        assertTrue(signals.all().stream().allMatch(s -> s.status() == SignalStatus.CONSUMED));
        assertTrue(signals.all().stream().allMatch(s -> issueId.equals(s.consumedByIssueId())));
    }

    @Test
    void heavierWave_updatesIssueAsWorsening() {
        overdue(4, 0.7);
        IssueFormationService service = service(OVERDUE_CLUSTER);
        service.runFormation();
        String issueId = issues.all().get(0).id();
        overdue(5, 0.9);

        service.runFormation();

        Issue issue = issues.require(issueId);
        assertEquals(9, issue.signalIds().size());
        assertEquals(4.5, issue.balance().negativeMagnitude(), 1e-9);
        assertEquals(Trajectory.WORSENING, issue.trajectory());
        assertEquals(40 * 2.0 * 1.45, issue.priorityScore(), 1e-9);
        assertEquals("Acme: 5 overdue", issue.headline());
    }

    @Test
    void comparableWave_keepsTrajectoryStable() {
        overdue(4, 0.7);
        IssueFormationService service = service(OVERDUE_CLUSTER);
        service.runFormation();
        String issueId = issues.all().get(0).id();
        overdue(4, 0.7);

        service.runFormation();

        Issue issue = issues.require(issueId);
        assertEquals(8, issue.signalIds().size());
        assertEquals(Trajectory.STABLE, issue.trajectory());
        assertEquals("Acme: 4 overdue", issue.headline());
    }

    @Test
    void belowThresholds_noIssue() {
        overdue(2, 0.9);

        FormationReport report = service(OVERDUE_CLUSTER).runFormation();

        assertEquals(0, report.created());
        assertTrue(issues.all().isEmpty());
        assertTrue(signals.all().stream().allMatch(Signal::isActive));
    }

    @Test
    void lowPriority_staysDetected() {
        IssuePattern taskLevel = new IssuePattern(
            IssueType.SCHEDULE_DELIVERY, "task_stuck", ScopeLevel.TASK,
            List.of(SignalTypes.TASK_OVERDUE), List.of(),
            1, 0.5,
            List.of(SeverityRule.when(IssueSeverity.LOW)),
            "{scope_name} stuck", null, null, "pm", null);
        signals.insert(taskOverdue("T1", 0.8, "C1", NOW));

        service(taskLevel).runFormation();

        Issue issue = issues.all().get(0);
        assertEquals(IssueState.DETECTED, issue.state());
        assertEquals(20 * 0.5 * 1.08, issue.priorityScore(), 1e-9);
        assertEquals("Unknown stuck", issue.headline());
        assertEquals(1, issue.stateHistory().size());
        assertNull(issue.surfacedAt());
    }

    @Test
    void failingPattern_isRecordedAndOthersContinue() {
        SignalRepository failing = mock(SignalRepository.class);
        when(failing.findForIssueFormation(any(), any(), anyInt(), anyDouble()))
            .thenThrow(new RepositoryException("Failed to load signals for issue formation"));
        IssueFormationService service = new IssueFormationService(
            new IssuePatternRegistry(List.of(OVERDUE_CLUSTER, IssuePatternRegistry.defaults().all().get(0))),
            failing, issues, resolver, NoOpPipelineMetrics.INSTANCE, CLOCK);

        FormationReport report = service.runFormation();

        assertEquals(2, report.errors().size());
        assertEquals("overdue_cluster", report.errors().get(0).unit());
    }

    @Test
    void storageUnavailable_abortsTheSweep() {
        SignalRepository down = mock(SignalRepository.class);
        when(down.findForIssueFormation(any(), any(), anyInt(), anyDouble()))
            .thenThrow(new StorageUnavailableException("Failed", new SQLException("refused", "08001")));
        IssueFormationService service = new IssueFormationService(new IssuePatternRegistry(List.of(OVERDUE_CLUSTER)),
            down, issues, resolver, NoOpPipelineMetrics.INSTANCE, CLOCK);

        assertThrows(StorageUnavailableException.class, service::runFormation);
    }
}
