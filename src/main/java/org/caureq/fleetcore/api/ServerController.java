package org.caureq.fleetcore.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.fleetcore.api.dto.*;
import org.caureq.fleetcore.domain.ServerStatus;
import org.caureq.fleetcore.service.AuditService;
import org.caureq.fleetcore.service.ServerRegistry;
import org.caureq.fleetcore.service.monitor.HealthMonitor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/servers")
@RequiredArgsConstructor
public class ServerController {
    private final ServerRegistry registry;
    private final HealthMonitor monitor;
    private final AuditService audit;

    @GetMapping("/list")
    public Map<String, Object> list(@RequestParam(value = "status", required = false) String status,
                                    @RequestParam(value = "role", required = false) String role,
                                    @RequestParam(value = "q", required = false) String name) {
        ServerStatus st = null;
        if (status != null && !status.isBlank()) {
            try {
                st = ServerStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown status: " + status);
            }
        }
        List<ServerView> servers = registry.list(new ServerRegistry.Filter(st, role, name)).stream()
                .map(ServerView::from).toList();
        return Map.of("success", true, "servers", servers);
    }

    @GetMapping("/{id}")
    public ServerView one(@PathVariable Long id) {
        return ServerView.from(registry.get(id));
    }

    @PostMapping("/add")
    public ResponseEntity<ApiResponse> add(@RequestBody @Valid AddServerRequest body, HttpServletRequest http) {
        var s = registry.add(body.toNewServer());
        audit.log(http, "server.add", "server", s.getId(), "ip=" + s.getIpAddress() + ";name=" + s.getName());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok("Server " + s.getName() + " added", ServerView.from(s)));
    }

    @PostMapping("/test-connection")
    public ApiResponse testConnection(@RequestBody @Valid TestConnectionRequest body) {
        var r = registry.testConnection(body.toNewServer());
        return ApiResponse.ok("Connection successful", r);
    }

    @PostMapping("/{id}/health-check")
    public ApiResponse healthCheck(@PathVariable Long id) {
        return ApiResponse.ok(null, monitor.healthCheckServer(id));
    }

    @PostMapping("/health-check-all")
    public ApiResponse healthCheckAll() {
        var reports = monitor.healthCheckAll();
        return ApiResponse.ok(reports.size() + " server(s) checked", reports);
    }

    @PatchMapping("/{id}/roles")
    public ApiResponse roles(@PathVariable Long id, @RequestBody @Valid RolesRequest body, HttpServletRequest http) {
        var s = registry.updateRoles(id, body.roles());
        audit.log(http, "server.roles", "server", id, "roles=" + s.getRoles());
        return ApiResponse.ok("Roles updated", ServerView.from(s));
    }

    @PostMapping("/{id}/disable")
    public ApiResponse disable(@PathVariable Long id, HttpServletRequest http) {
        var s = registry.disable(id);
        audit.log(http, "server.disable", "server", id, null);
        return ApiResponse.ok("Server " + s.getName() + " disabled", ServerView.from(s));
    }

    @PostMapping("/{id}/enable")
    public ApiResponse enable(@PathVariable Long id, HttpServletRequest http) {
        var s = registry.enable(id);
        audit.log(http, "server.enable", "server", id, null);
        return ApiResponse.ok("Server " + s.getName() + " enabled", ServerView.from(s));
    }
}
