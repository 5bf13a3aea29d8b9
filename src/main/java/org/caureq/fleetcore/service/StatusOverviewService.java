package org.caureq.fleetcore.service;

import lombok.RequiredArgsConstructor;
import org.caureq.fleetcore.domain.AlertSeverity;
import org.caureq.fleetcore.domain.AlertStatus;
import org.caureq.fleetcore.domain.ServerStatus;
import org.caureq.fleetcore.domain.TaskStatus;
import org.caureq.fleetcore.repo.AlertRepo;
import org.caureq.fleetcore.repo.DeploymentTaskRepo;
import org.caureq.fleetcore.repo.DomainMappingRepo;
import org.caureq.fleetcore.repo.ServerRepo;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Dashboard counters, read straight from persisted state. */
@Service
@RequiredArgsConstructor
public class StatusOverviewService {
    private final ServerRepo servers;
    private final DomainMappingRepo domains;
    private final DeploymentTaskRepo tasks;
    private final AlertRepo alerts;

    public Map<String, Object> overview() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("servers", Map.of(
                "total", servers.count(),
                "active", servers.countByStatus(ServerStatus.ACTIVE),
                "unreachable", servers.countByStatus(ServerStatus.UNREACHABLE),
                "disabled", servers.countByStatus(ServerStatus.DISABLED)));
        out.put("domains", Map.of(
                "total", domains.count(),
                "active", domains.countByStatus("active"),
                "ssl_enabled", domains.countBySslEnabledTrue()));
        out.put("deployments", Map.of(
                "recent_24h", tasks.countByCreatedAtAfter(Instant.now().minus(Duration.ofHours(24))),
                "running", tasks.countByStatus(TaskStatus.RUNNING)));
        out.put("alerts", Map.of(
                "active", alerts.countByStatus(AlertStatus.ACTIVE),
                "critical", alerts.countByStatusAndSeverity(AlertStatus.ACTIVE, AlertSeverity.CRITICAL)));
        return out;
    }
}
