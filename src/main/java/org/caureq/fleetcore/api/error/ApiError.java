package org.caureq.fleetcore.api.error;

import java.time.Instant;
import java.util.Map;

public record ApiError(
        boolean success,
        Instant timestamp,
        ErrorCode code,
        String message,
        String correlationId,
        Map<String,Object> details
) { }
