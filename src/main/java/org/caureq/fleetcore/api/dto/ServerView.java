package org.caureq.fleetcore.api.dto;

import org.caureq.fleetcore.domain.Server;
import org.caureq.fleetcore.domain.ServerStatus;

import java.time.Instant;
import java.util.List;

/** Public shape of a server. Credentials and auth_ref stay server-side. */
public record ServerView(Long id, String name, String ipAddress, int port, List<String> roles,
                         ServerStatus status, int healthScore, Instant lastHealthCheck,
                         String osType, String osVersion, Integer cpuCores, Integer memoryGb, Integer diskGb,
                         Instant createdAt, Instant updatedAt) {

    public static ServerView from(Server s) {
        return new ServerView(s.getId(), s.getName(), s.getIpAddress(), s.getPort(), List.copyOf(s.getRoles()),
                s.getStatus(), s.getHealthScore(), s.getLastHealthCheck(),
                s.getOsType(), s.getOsVersion(), s.getCpuCores(), s.getMemoryGb(), s.getDiskGb(),
                s.getCreatedAt(), s.getUpdatedAt());
    }
}
