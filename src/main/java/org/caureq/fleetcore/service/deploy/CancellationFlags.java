package org.caureq.fleetcore.service.deploy;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Cooperative cancellation requests, polled by runners at step boundaries. */
@Component
public class CancellationFlags {
    private final Set<Long> requested = ConcurrentHashMap.newKeySet();

    public void request(Long taskId) { requested.add(taskId); }

    public boolean isRequested(Long taskId) { return requested.contains(taskId); }

    public void clear(Long taskId) { requested.remove(taskId); }
}
