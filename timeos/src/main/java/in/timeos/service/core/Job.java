package in.timeos.service.core;

import java.util.Optional;

/**
 * Named background jobs. The key is the lock name and the HTTP path segment.
 */
public enum Job {
    DETECTION("detection"),
    BALANCE("balance"),
    FORMATION("formation"),
    RESOLUTION("resolution"),
    REGRESSIONS("regressions"),
    EXPIRY("expiry"),
    PIPELINE("pipeline");

    private final String key;

    Job(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<Job> fromKey(String key) {
        for (Job job : values()) {
            if (job.key.equalsIgnoreCase(key)) {
                return Optional.of(job);
            }
        }
        return Optional.empty();
    }
}
