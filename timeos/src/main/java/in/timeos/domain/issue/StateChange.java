package in.timeos.domain.issue;

import java.time.Instant;

/**
 * One entry of an issue's state history.
 */
public record StateChange(IssueState state, Instant at, String actor, String note) {

    public static final String SYSTEM = "system";

    public static StateChange system(IssueState state, Instant at, String note) {
        return new StateChange(state, at, SYSTEM, note);
    }
}
