package in.timeos.domain.signal;

/**
 * Signal lifecycle status.
 *
 * ACTIVE may move to any other status. CONSUMED may still be BALANCED, so an
 * issue's balance can recover. BALANCED and EXPIRED are final.
 */
public enum SignalStatus {
    /**
     * Emitted by a detector, counts towards aggregates and dedup.
     */
    ACTIVE,

    /**
     * Folded into an issue by a formation pass.
     */
    CONSUMED,

    /**
     * Cancelled by an opposite-valence signal on the same entity or scope.
     */
    BALANCED,

    /**
     * Past its expires_at, removed by the expiry sweep.
     */
    EXPIRED;

    public boolean isTerminal() {
        return this == BALANCED || this == EXPIRED;
    }

    public boolean canTransitionTo(SignalStatus next) {
        return switch (this) {
            case ACTIVE -> next != ACTIVE;
            case CONSUMED -> next == BALANCED;
            case BALANCED, EXPIRED -> false;
        };
    }

    /**
     * ACTIVE and CONSUMED signals count towards an issue's balance.
     */
    public boolean isLive() {
        return this == ACTIVE || this == CONSUMED;
    }
}
