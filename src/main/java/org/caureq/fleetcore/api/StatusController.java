package org.caureq.fleetcore.api;

import lombok.RequiredArgsConstructor;
import org.caureq.fleetcore.service.StatusOverviewService;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Dashboard summary. The UI polls this; it only reads persisted state.
 */
@RestController
@RequestMapping("/api/status")
@RequiredArgsConstructor
public class StatusController {
    private final StatusOverviewService overview;

    @GetMapping("/overview")
    public Map<String, Object> overview() {
        return Map.of("success", true, "infrastructure_status", overview.overview());
    }
}
