package org.caureq.fleetcore.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.fleetcore.api.dto.AddDomainRequest;
import org.caureq.fleetcore.api.dto.ApiResponse;
import org.caureq.fleetcore.service.AuditService;
import org.caureq.fleetcore.service.DomainService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/domains")
@RequiredArgsConstructor
public class DomainController {
    private final DomainService domains;
    private final AuditService audit;

    @GetMapping("/list")
    public Map<String, Object> list() {
        return Map.of("success", true, "domains", domains.list());
    }

    @PostMapping("/add")
    public ResponseEntity<ApiResponse> add(@RequestBody @Valid AddDomainRequest body, HttpServletRequest http) {
        var d = domains.add(body.customDomain(), body.targetSubdomain(), Boolean.TRUE.equals(body.sslEnabled()));
        audit.log(http, "domain.add", "domain", d.getId(), d.getCustomDomain() + " -> " + d.getTargetSubdomain());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok("Domain mapping added", d));
    }
}
