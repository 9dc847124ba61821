package com.quantops.core.progress;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Progress bridge that also caches the latest full domain state, so a
 * cancellation or shutdown checkpoint can be written from outside the
 * execution thread without asking the domain loop for it.
 */
public class CheckpointingProgressBridge extends ProgressBridge {

    private final AtomicReference<Map<String, Object>> checkpointState =
        new AtomicReference<>(Map.of());

    public CheckpointingProgressBridge() {
        super();
    }

    public CheckpointingProgressBridge(Clock clock) {
        super(clock);
    }

    /**
     * Cache the latest checkpointable domain state.
     */
    public void updateCheckpointState(Map<String, Object> state) {
        checkpointState.set(Collections.unmodifiableMap(new LinkedHashMap<>(state)));
    }

    /**
     * Latest cached domain state, empty if none was recorded.
     */
    public Map<String, Object> getCheckpointState() {
        return checkpointState.get();
    }

    /**
     * Progress snapshot merged with the cached domain state.
     */
    public Map<String, Object> getFullState() {
        ProgressSnapshot snapshot = readState();
        Map<String, Object> full = new LinkedHashMap<>(snapshot.fields());
        full.put("percentage", snapshot.percentage());
        full.put("message", snapshot.message());
        full.put("checkpoint_state", getCheckpointState());
        return full;
    }
}
