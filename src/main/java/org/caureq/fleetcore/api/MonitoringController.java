package org.caureq.fleetcore.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.caureq.fleetcore.api.dto.ApiResponse;
import org.caureq.fleetcore.service.AuditService;
import org.caureq.fleetcore.service.monitor.HealthMonitor;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Pause and resume the periodic health sweep; read the last report per server.
 */
@RestController
@RequestMapping("/api/monitoring")
@RequiredArgsConstructor
public class MonitoringController {
    private final HealthMonitor monitor;
    private final AuditService audit;

    @PostMapping("/start")
    public ApiResponse start(HttpServletRequest http) {
        boolean changed = monitor.start();
        audit.log(http, "monitoring.start", "monitor", null, changed ? "started" : "already running");
        return ApiResponse.ok(changed ? "Monitoring started" : "Monitoring already running", state());
    }

    @PostMapping("/stop")
    public ApiResponse stop(HttpServletRequest http) {
        boolean changed = monitor.stop();
        audit.log(http, "monitoring.stop", "monitor", null, changed ? "stopped" : "already stopped");
        return ApiResponse.ok(changed ? "Monitoring stopped" : "Monitoring already stopped", state());
    }

    @GetMapping("/real-time")
    public Map<String, Object> realTime() {
        return Map.of("success", true, "running", monitor.isRunning(), "servers", monitor.latestReports());
    }

    private Map<String, Object> state() {
        return Map.of("running", monitor.isRunning());
    }
}
