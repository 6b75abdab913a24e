package in.timeos.service.signal;

import in.timeos.domain.common.ScopeLevel;
import in.timeos.domain.signal.CategoryCounts;
import in.timeos.domain.signal.ScopeChain;
import in.timeos.domain.signal.Signal;
import in.timeos.domain.signal.SignalCategory;
import in.timeos.domain.signal.SignalStatus;
import in.timeos.domain.signal.SignalTypes;
import in.timeos.infrastructure.metrics.NoOpPipelineMetrics;
import in.timeos.repository.RepositoryException;
import in.timeos.repository.SignalRepository;
import in.timeos.repository.StorageUnavailableException;
import in.timeos.support.InMemorySignalRepository;
import in.timeos.support.MapScopeResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static in.timeos.support.TestSignals.clientSignal;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class SignalServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private InMemorySignalRepository signals;
    private MapScopeResolver resolver;
    private SignalService service;

    @BeforeEach
    void setUp() {
        signals = new InMemorySignalRepository(Clock.fixed(NOW, ZoneOffset.UTC));
        resolver = new MapScopeResolver()
            .task("T1", "P1", "C1")
            .project("P2", "B2", "C2")
            .invoice("INV-9", "C3");
        service = new SignalService(signals, resolver, NoOpPipelineMetrics.INSTANCE);
    }

    private static Signal.Builder overdue() {
        return Signal.builder()
            .signalType(SignalTypes.TASK_OVERDUE)
            .magnitude(0.5)
            .detectedAt(NOW);
    }

    @Test
    void store_completesScopeFromTask() {
        // Arrange
        Signal signal = overdue().entity("task", "T1").scope(new ScopeChain("T1", null, null, null, null, null)).build();

        // Act
        Signal stored = service.store(signal);

        // Assert
        assertEquals("P1", stored.scope().projectId());
        assertEquals("C1", stored.scope().clientId());
        assertEquals("T1", stored.scope().taskId());
        assertEquals(stored, signals.require(signal.id()));
    }

    @Test
    void store_completesScopeFromProject() {
        Signal signal = overdue().entity("project", "P2").scope(new ScopeChain(null, "P2", null, null, null, null)).build();

        Signal stored = service.store(signal);

        assertEquals("B2", stored.scope().brandId());
        assertEquals("C2", stored.scope().clientId());
    }

    @Test
    void store_fallsBackToEntity() {
        Signal signal = Signal.builder()
            .signalType(SignalTypes.INVOICE_OVERDUE_30)
            .magnitude(0.4)
            .entity("invoice", "INV-9")
            .detectedAt(NOW)
            .build();

        assertEquals("C3", service.store(signal).scope().clientId());
    }

    @Test
    void store_keepsExistingClient() {
        Signal signal = overdue().entity("task", "T1").scope(new ScopeChain("T1", null, null, null, "C9", null)).build();

        Signal stored = service.store(signal);

        assertSame(signal, stored);
        assertNull(stored.scope().projectId());
    }

    @Test
    void store_unknownEntity_storesAsIs() {
        Signal signal = overdue().entity("task", "T404").scope(new ScopeChain("T404", null, null, null, null, null)).build();

        Signal stored = service.store(signal);

        assertNull(stored.scope().clientId());
        assertEquals(1, signals.all().size());
    }

    @Test
    void storeAll_continuesPastFailures() {
        SignalRepository repo = mock(SignalRepository.class);
        Signal bad = overdue().entity("task", "T1").build();
        Signal good = overdue().entity("task", "T2").build();
        doThrow(new RepositoryException("Failed to insert signal"))
            .when(repo).insert(argThat(s -> s.id().equals(bad.id())));
        SignalService failing = new SignalService(repo, resolver, NoOpPipelineMetrics.INSTANCE);

        StoreResult result = failing.storeAll(List.of(bad, good));

        assertEquals(1, result.stored());
        assertEquals(1, result.errors().size());
        assertEquals(bad.id(), result.errors().get(0).unit());
    }

    @Test
    void storeAll_storageDown_propagates() {
        SignalRepository repo = mock(SignalRepository.class);
        doThrow(new StorageUnavailableException("Failed to insert signal", new SQLException("refused", "08001")))
            .when(repo).insert(any());
        SignalService failing = new SignalService(repo, resolver, NoOpPipelineMetrics.INSTANCE);

        assertThrows(StorageUnavailableException.class,
            () -> failing.storeAll(List.of(overdue().entity("task", "T1").build())));
    }

    @Test
    void summary_countsActiveSignalsByCategory() {
        signals.insert(clientSignal(SignalTypes.TASK_OVERDUE, -1, 0.5, "C1", NOW.minus(Duration.ofDays(1))));
        signals.insert(clientSignal(SignalTypes.TASK_OVERDUE, -1, 0.5, "C1", NOW.minus(Duration.ofDays(2))));
        signals.insert(clientSignal(SignalTypes.PAYMENT_RECEIVED_ONTIME, 1, 0.5, "C1", NOW.minus(Duration.ofDays(3))));
        signals.insert(clientSignal(SignalTypes.TASK_OVERDUE, -1, 0.5, "C1", NOW.minus(Duration.ofDays(45))));
        signals.insert(clientSignal(SignalTypes.TASK_OVERDUE, -1, 0.5, "C2", NOW.minus(Duration.ofDays(1))));

        SignalSummary summary = service.summary(ScopeLevel.CLIENT, "C1", 30);

        assertEquals(new CategoryCounts(2, 0, 0), summary.byCategory().get(SignalCategory.SCHEDULE));
        assertEquals(new CategoryCounts(0, 0, 1), summary.byCategory().get(SignalCategory.FINANCIAL));
        assertEquals(3, summary.total());
        assertEquals(-1, summary.netCount());
    }

    @Test
    void forEntity_excludesInactiveUnlessAsked() {
        Signal active = overdue().entity("task", "T1").build();
        Signal expired = overdue().entity("task", "T1").status(SignalStatus.EXPIRED).build();
        signals.insertAll(List.of(active, expired));

        assertEquals(List.of(active.id()), service.forEntity("task", "T1", false).stream().map(Signal::id).toList());
        assertEquals(2, service.forEntity("task", "T1", true).size());
    }

    @Test
    void expireOldSignals_expiresPastDue() {
        Signal due = overdue().entity("task", "T1").expiresAt(NOW.minus(Duration.ofHours(1))).build();
        Signal fresh = overdue().entity("task", "T2").expiresAt(NOW.plus(Duration.ofDays(1))).build();
        signals.insertAll(List.of(due, fresh));

        assertEquals(1, service.expireOldSignals());
        assertEquals(SignalStatus.EXPIRED, signals.require(due.id()).status());
        assertEquals(SignalStatus.ACTIVE, signals.require(fresh.id()).status());
    }
}
