package in.timeos.service.core;

import in.timeos.service.balance.BalanceReport;
import in.timeos.service.balance.BalanceService;
import in.timeos.service.detection.DetectionOrchestrator;
import in.timeos.service.detection.DetectionReport;
import in.timeos.service.issue.FormationReport;
import in.timeos.service.issue.IssueFormationService;
import in.timeos.service.resolution.RegressionReport;
import in.timeos.service.resolution.ResolutionCheckReport;
import in.timeos.service.resolution.ResolutionService;
import in.timeos.service.signal.SignalService;
import in.timeos.support.InMemoryJobLockRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

    @Mock private DetectionOrchestrator detection;
    @Mock private BalanceService balance;
    @Mock private IssueFormationService formation;
    @Mock private ResolutionService resolution;
    @Mock private SignalService signals;

    private InMemoryJobLockRepository locks;
    private PipelineOrchestrator pipeline;

    @BeforeEach
    void setUp() {
        locks = new InMemoryJobLockRepository();
        pipeline = new PipelineOrchestrator(detection, balance, formation, resolution, signals,
            new LockedJobRunner(locks, "test-holder"));
    }

    @Test
    void runCycle_runsStepsInOrder() {
        // Arrange
        when(detection.runDetection()).thenReturn(new DetectionReport(5, 0, 12, 10, 2, List.of(), Map.of()));
        when(balance.runBalanceCheck()).thenReturn(new BalanceReport(3, 2, 1, 0, List.of()));
        when(formation.runFormation()).thenReturn(FormationReport.of(List.of(), List.of()));
        when(resolution.runResolutionCheck()).thenReturn(new ResolutionCheckReport(1, 0, List.of()));
        when(resolution.checkRegressions()).thenReturn(new RegressionReport(List.of(), 0, List.of()));

        // Act
        PipelineReport report = pipeline.runCycle();

        // Assert
        InOrder order = inOrder(detection, balance, formation, resolution);
        order.verify(detection).runDetection();
        order.verify(balance).runBalanceCheck();
        order.verify(formation).runFormation();
        order.verify(resolution).runResolutionCheck();
        order.verify(resolution).checkRegressions();

        assertEquals(10, report.detection().signalsStored());
        assertEquals(2, report.balance().balanced());
        assertTrue(report.errors().isEmpty());
        assertFalse(locks.isHeld("pipeline"));
    }

    @Test
    void runCycle_whileAnotherCycleRuns_isRefused() {
        locks.tryAcquire("pipeline", "other-process");

        PipelineReport report = pipeline.runCycle();

        assertNull(report.detection());
        assertEquals(1, report.errors().size());
        assertEquals("pipeline", report.errors().get(0).unit());
        verify(detection, never()).runDetection();
    }

    @Test
    void formation_whileLocked_returnsFailedReport() {
        locks.tryAcquire("formation", "other-process");

        FormationReport report = pipeline.runFormation();

        assertEquals(0, report.created());
        assertEquals(1, report.errors().size());
        assertTrue(report.errors().get(0).message().startsWith(LockedJobRunner.LOCK_REFUSED));
        verify(formation, never()).runFormation();
    }

    @Test
    void run_dispatchesExpiryByJob() {
        when(signals.expireOldSignals()).thenReturn(4);

        Object result = pipeline.run(Job.EXPIRY);

        assertEquals(new ExpiryReport(4, List.of()), result);
    }

    @Test
    void runDetector_holdsDetectionLock() {
        when(detection.runDetector("chat_detector")).thenAnswer(inv -> {
            assertTrue(locks.isHeld("detection"));
            return new DetectionReport(1, 0, 2, 2, 0, List.of(), Map.of());
        });

        DetectionReport report = pipeline.runDetector("chat_detector");

        assertEquals(2, report.signalsStored());
        assertFalse(locks.isHeld("detection"));
    }

    @Test
    void runDetector_whileDetectionRuns_isRefused() {
        locks.tryAcquire("detection", "other-process");

        DetectionReport report = pipeline.runDetector("chat_detector");

        assertEquals(0, report.detectorsRun());
        assertTrue(report.errors().get(0).message().startsWith(LockedJobRunner.LOCK_REFUSED));
        verify(detection, never()).runDetector("chat_detector");
    }

    @Test
    void runDetector_unknownId_propagatesAndReleasesLock() {
        when(detection.runDetector("nope")).thenThrow(new IllegalArgumentException("Unknown detector: nope"));

        assertThrows(IllegalArgumentException.class, () -> pipeline.runDetector("nope"));
        assertFalse(locks.isHeld("detection"));
    }
}
