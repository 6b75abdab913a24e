package in.timeos.support;

import in.timeos.domain.signal.ScopeChain;
import in.timeos.domain.signal.Signal;
import in.timeos.domain.signal.SignalTypes;

import java.time.Instant;

/**
 * Signal fixtures.
 */
public final class TestSignals {

    public static Signal clientSignal(String type, int valence, double magnitude, String clientId, Instant detectedAt) {
        return Signal.builder()
            .signalType(type)
            .valence(valence)
            .magnitude(magnitude)
            .entity("task", "t-" + Signal.newId())
            .scope(ScopeChain.ofClient(clientId))
            .detectedAt(detectedAt)
            .build();
    }

    public static Signal taskOverdue(String taskId, double magnitude, String clientId, Instant detectedAt) {
        return Signal.builder()
            .signalType(SignalTypes.TASK_OVERDUE)
            .valence(-1)
            .magnitude(magnitude)
            .entity("task", taskId)
            .scope(new ScopeChain(taskId, null, null, null, clientId, null))
            .detectedAt(detectedAt)
            .build();
    }

    private TestSignals() {}
}
