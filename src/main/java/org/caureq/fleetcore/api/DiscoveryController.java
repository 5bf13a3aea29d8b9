package org.caureq.fleetcore.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.fleetcore.api.dto.ApiResponse;
import org.caureq.fleetcore.api.dto.AutoSetupBatchRequest;
import org.caureq.fleetcore.api.dto.ScanRequest;
import org.caureq.fleetcore.api.dto.TaskView;
import org.caureq.fleetcore.service.AuditService;
import org.caureq.fleetcore.service.discovery.NetworkDiscoveryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/discovery")
@RequiredArgsConstructor
public class DiscoveryController {
    private final NetworkDiscoveryService discovery;
    private final AuditService audit;

    @PostMapping("/scan-network")
    public ResponseEntity<ApiResponse> scan(@RequestBody @Valid ScanRequest body, HttpServletRequest http) {
        var t = discovery.scanNetwork(body.networkRange(), body.credentialSets());
        audit.log(http, "discovery.scan", "task", t.getId(), "range=" + body.networkRange());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.ok("Network scan started", TaskView.from(t)));
    }

    @PostMapping("/auto-setup")
    public ResponseEntity<ApiResponse> autoSetup(@RequestBody NetworkDiscoveryService.AutoSetupRequest body,
                                                 HttpServletRequest http) {
        var t = discovery.autoSetup(body);
        audit.log(http, "discovery.auto_setup", "task", t.getId(), "ip=" + body.ip() + ";roles=" + body.roles());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.ok("Auto-setup scheduled for " + body.ip(), TaskView.from(t)));
    }

    @PostMapping("/auto-setup/batch")
    public ApiResponse autoSetupBatch(@RequestBody @Valid AutoSetupBatchRequest body, HttpServletRequest http) {
        List<NetworkDiscoveryService.BatchResult> results = discovery.autoSetupBatch(body.machines());
        long ok = results.stream().filter(r -> "OK".equals(r.outcome())).count();
        audit.log(http, "discovery.auto_setup_batch", "task", null, ok + "/" + results.size() + " scheduled");
        return new ApiResponse(ok > 0, ok + " of " + results.size() + " auto-setup task(s) scheduled", results);
    }
}
