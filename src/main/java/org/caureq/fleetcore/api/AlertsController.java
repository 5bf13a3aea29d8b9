package org.caureq.fleetcore.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.caureq.fleetcore.api.dto.ApiResponse;
import org.caureq.fleetcore.api.dto.ResolveRequest;
import org.caureq.fleetcore.domain.AlertSeverity;
import org.caureq.fleetcore.domain.AlertStatus;
import org.caureq.fleetcore.service.AuditService;
import org.caureq.fleetcore.service.alerts.AlertManager;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;
import java.util.Map;

/**
 * Alerts controller: list and filter alerts, acknowledge and resolve them.
 */
@RestController
@RequestMapping("/api/monitoring/alerts")
@RequiredArgsConstructor
public class AlertsController {
    private final AlertManager alerts;
    private final AuditService audit;

    @GetMapping
    public Map<String, Object> list(
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "severity", required = false) String severity,
            @RequestParam(value = "server_id", required = false) Long serverId,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset
    ) {
        int lim = (limit == null ? 50 : limit);
        int off = (offset == null ? 0 : offset);
        var list = alerts.list(parse(AlertStatus.class, status), parse(AlertSeverity.class, severity), serverId, lim, off);
        return Map.of("success", true, "alerts", list);
    }

    @PostMapping("/{id}/acknowledge")
    public ApiResponse acknowledge(@PathVariable String id, HttpServletRequest http) {
        var a = alerts.acknowledge(id);
        audit.log(http, "alert.acknowledge", "alert", id, a.title());
        return ApiResponse.ok("Alert acknowledged", a);
    }

    @PostMapping("/{id}/resolve")
    public ApiResponse resolve(@PathVariable String id, @RequestBody(required = false) ResolveRequest body,
                               HttpServletRequest http) {
        var a = alerts.resolve(id, body == null ? null : body.notes());
        audit.log(http, "alert.resolve", "alert", id, a.resolutionNotes());
        return ApiResponse.ok("Alert resolved", a);
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown " + type.getSimpleName() + ": " + raw);
        }
    }
}
