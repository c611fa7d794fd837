package com.agenteval.experiment.service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.stereotype.Component;

/**
 * In-process cancellation flags for orchestrations currently executing cases.
 */
@Component
public class RunCancellationRegistry {

    private final Map<Long, AtomicBoolean> inFlight = new ConcurrentHashMap<>();

    public void register(long experimentId) {
        inFlight.put(experimentId, new AtomicBoolean(false));
    }

    public void unregister(long experimentId) {
        inFlight.remove(experimentId);
    }

    public boolean isInFlight(long experimentId) {
        return inFlight.containsKey(experimentId);
    }

    /**
     * @return true when a run of this experiment is executing in this process and has been signalled
     */
    public boolean requestCancel(long experimentId) {
        AtomicBoolean flag = inFlight.get(experimentId);
        if (flag == null) {
            return false;
        }
        flag.set(true);
        return true;
    }

    public boolean isCancelled(long experimentId) {
        AtomicBoolean flag = inFlight.get(experimentId);
        return flag != null && flag.get();
    }
}
