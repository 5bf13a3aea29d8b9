package org.caureq.fleetcore.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.RequiredArgsConstructor;
import org.caureq.fleetcore.api.dto.ApiResponse;
import org.caureq.fleetcore.service.alerts.AlertConfigService;
import org.springframework.web.bind.annotation.*;

/** View/update alert thresholds at runtime. */
@RestController
@RequestMapping("/api/monitoring/thresholds")
@RequiredArgsConstructor
public class ThresholdsController {
    private final AlertConfigService cfg;

    @GetMapping
    public AlertConfigService.Thresholds get() {
        return cfg.get();
    }

    public record UpdateReq(
            @DecimalMin("0") @DecimalMax("100") Double cpuWarningPct,
            @DecimalMin("0") @DecimalMax("100") Double cpuCriticalPct,
            @DecimalMin("0") @DecimalMax("100") Double memoryWarningPct,
            @DecimalMin("0") @DecimalMax("100") Double memoryCriticalPct,
            @DecimalMin("0") @DecimalMax("100") Double diskWarningPct,
            @DecimalMin("0") @DecimalMax("100") Double diskCriticalPct) {}

    @PutMapping
    public ApiResponse update(@RequestBody @Valid UpdateReq body) {
        var t = cfg.update(body.cpuWarningPct(), body.cpuCriticalPct(), body.memoryWarningPct(),
                body.memoryCriticalPct(), body.diskWarningPct(), body.diskCriticalPct());
        return ApiResponse.ok("Thresholds updated", t);
    }
}
