package in.timeos.detector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ActiveSignalIndex - Dedup lookup for one detector run.
 *
 * PURPOSE:
 * A detector must not emit a (signal type, entity) pair that already has an
 * ACTIVE signal in the store. Checking the store per candidate would cost one
 * query per record, so the keys are loaded once per run.
 *
 * STRUCTURE:
 * - Set of dedup keys "signalType:entityId"
 * - Built from the store at the start of each run
 * - Grows as the detector emits, so one batch never repeats a key
 *
 * THREAD-SAFETY:
 * ConcurrentHashMap.newKeySet(); a detector instance may be run by the
 * scheduler and the manual job endpoint at the same time.
 *
 * LIFECYCLE:
 * 1. Rebuild at the start of detect()
 * 2. Add on every emitted signal
 */
public final class ActiveSignalIndex {
    private static final Logger log = LoggerFactory.getLogger(ActiveSignalIndex.class);

    private final Set<String> keys = ConcurrentHashMap.newKeySet();

    /**
     * Replace the index contents with the given active keys.
     */
    public void rebuild(Collection<String> activeKeys) {
        keys.clear();
        keys.addAll(activeKeys);
        log.debug("ActiveSignalIndex rebuilt: {} active keys", keys.size());
    }

    public boolean contains(String key) {
        return keys.contains(key);
    }

    /**
     * @return true if the key was not yet present
     */
    public boolean add(String key) {
        return keys.add(key);
    }

    public int size() {
        return keys.size();
    }
}
