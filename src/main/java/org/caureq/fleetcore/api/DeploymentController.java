package org.caureq.fleetcore.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.fleetcore.api.dto.ApiResponse;
import org.caureq.fleetcore.api.dto.CreateTaskRequest;
import org.caureq.fleetcore.api.dto.TaskView;
import org.caureq.fleetcore.domain.TaskStatus;
import org.caureq.fleetcore.service.AuditService;
import org.caureq.fleetcore.service.deploy.DeploymentScheduler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/deployments")
@RequiredArgsConstructor
public class DeploymentController {
    private final DeploymentScheduler scheduler;
    private final AuditService audit;

    @GetMapping("/list")
    public Map<String, Object> list(@RequestParam(value = "limit", required = false) Integer limit) {
        return Map.of("success", true, "deployments", scheduler.list(limit).stream().map(TaskView::from).toList());
    }

    @PostMapping("/create")
    public ResponseEntity<ApiResponse> create(@RequestBody @Valid CreateTaskRequest body, HttpServletRequest http) {
        var t = scheduler.create(body.toNewTask());
        audit.log(http, "task.create", "task", t.getId(),
                t.getTaskType() + ";service=" + t.getServiceType() + ";target=" + t.getTargetServerId());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.ok("Task " + t.getId() + " scheduled", TaskView.from(t)));
    }

    @GetMapping("/{id}/logs")
    public Map<String, Object> logs(@PathVariable Long id) {
        var l = scheduler.logs(id);
        var body = new LinkedHashMap<String, Object>();
        body.put("success", true);
        body.put("status", l.status());
        body.put("progress", l.progress());
        body.put("current_step", l.currentStep());
        body.put("log", l.log());
        body.put("error_message", l.errorMessage());
        return body;
    }

    @PostMapping("/{id}/cancel")
    public ApiResponse cancel(@PathVariable Long id, HttpServletRequest http) {
        var status = scheduler.cancel(id);
        audit.log(http, "task.cancel", "task", id, "status=" + status);
        return status == TaskStatus.CANCELLED
                ? ApiResponse.ok("Task cancelled", Map.of("status", status))
                : ApiResponse.ok("Cancellation requested, task stops before its next step", Map.of("status", status));
    }
}
