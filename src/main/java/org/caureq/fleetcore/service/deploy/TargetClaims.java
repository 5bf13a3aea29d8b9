package org.caureq.fleetcore.service.deploy;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Exclusive per-server claims held by INSTALL / MIGRATE / AUTO_SETUP tasks until they finish. */
@Component
public class TargetClaims {
    private final Map<Long, Long> byServer = new ConcurrentHashMap<>();

    public boolean isClaimed(Long serverId) {
        return serverId != null && byServer.containsKey(serverId);
    }

    public void claim(Long serverId, Long taskId) {
        if (serverId != null) byServer.put(serverId, taskId);
    }

    public void release(Long serverId, Long taskId) {
        if (serverId != null) byServer.remove(serverId, taskId);
    }

    public Long holder(Long serverId) {
        return serverId == null ? null : byServer.get(serverId);
    }
}
