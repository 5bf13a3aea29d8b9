package org.caureq.fleetcore.service;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.caureq.fleetcore.domain.ActionLog;
import org.caureq.fleetcore.repo.ActionLogRepo;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Service @RequiredArgsConstructor
public class AuditService {
    private final ActionLogRepo repo;

    public void log(HttpServletRequest req, String action, String targetType, Object targetId, String details) {
        var ip = req == null ? null : req.getRemoteAddr();
        repo.save(ActionLog.builder()
                .userIp(ip).actor("api").action(action)
                .targetType(targetType).targetId(targetId == null ? null : String.valueOf(targetId))
                .details(details)
                .ts(Instant.now())
                .build());
    }
}
