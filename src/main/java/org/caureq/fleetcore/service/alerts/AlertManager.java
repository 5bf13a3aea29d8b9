package org.caureq.fleetcore.service.alerts;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleetcore.domain.AlertRecord;
import org.caureq.fleetcore.domain.AlertSeverity;
import org.caureq.fleetcore.domain.AlertStatus;
import org.caureq.fleetcore.domain.Server;
import org.caureq.fleetcore.repo.AlertRepo;
import org.caureq.fleetcore.repo.ServerRepo;
import org.caureq.fleetcore.service.InvalidTransitionException;
import org.caureq.fleetcore.service.NotFoundException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Persistent alert lifecycle. At most one ACTIVE alert exists per (server, metric); every
 * mutation goes through this class and is serialized on its monitor.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AlertManager {
    static final String AUTO_RESOLVED_NOTE = "Auto-resolved: Condition no longer met";

    public record Alert(String id, AlertSeverity severity, String title, String message,
                        Long serverId, Long domainId, String metricName, Double metricValue,
                        Double thresholdValue, AlertStatus status,
                        Instant firstOccurrence, Instant lastOccurrence,
                        Instant acknowledgedAt, Instant resolvedAt, String resolutionNotes) {}

    private final AlertRepo repo;
    private final ServerRepo servers;

    public Alert raise(Long serverId, String metric, double value, AlertSeverity severity) {
        return raise(serverId, metric, value, severity, null);
    }

    public synchronized Alert raise(Long serverId, String metric, double value, AlertSeverity severity, Double threshold) {
        if (metric == null || metric.isBlank()) throw new IllegalArgumentException("metric is required");
        if (severity == null) throw new IllegalArgumentException("severity is required");
        var now = Instant.now();
        var msg = message(metric, value, threshold);

        // acknowledged alerts stay with the operator; a new breach opens its own ACTIVE alert
        var existing = find(serverId, metric, AlertStatus.ACTIVE);
        if (existing.isPresent()) {
            var r = existing.get();
            if (r.getSeverity() != severity) {
                log.warn("[Alerts] {} on server {} escalated {} -> {}", metric, serverId, r.getSeverity(), severity);
            }
            r.setSeverity(severity);
            r.setMetricValue(value);
            r.setThresholdValue(threshold);
            r.setMessage(msg);
            r.setTitle(title(serverId, metric, severity));
            r.setLastOccurrence(now);
            return toDto(repo.save(r));
        }

        var rec = AlertRecord.builder()
                .severity(severity)
                .title(title(serverId, metric, severity))
                .message(msg)
                .serverId(serverId)
                .metricName(metric)
                .metricValue(value)
                .thresholdValue(threshold)
                .status(AlertStatus.ACTIVE)
                .firstOccurrence(now)
                .lastOccurrence(now)
                .build();
        var saved = repo.save(rec);
        log.warn("[Alerts] raised {} {} on server {} value={}", severity, metric, serverId, value);
        return toDto(saved);
    }

    /** Resolves the ACTIVE alert for the key, if any. Acknowledged alerts are left for the operator. */
    public synchronized Optional<Alert> clearIfActive(Long serverId, String metric) {
        return find(serverId, metric, AlertStatus.ACTIVE).map(r -> {
            var now = Instant.now();
            r.setStatus(AlertStatus.RESOLVED);
            r.setResolvedAt(now);
            r.setResolutionNotes(AUTO_RESOLVED_NOTE);
            log.info("[Alerts] auto-resolved {} on server {}", metric, serverId);
            return toDto(repo.save(r));
        });
    }

    public synchronized Alert acknowledge(String id) {
        var r = repo.findById(id).orElseThrow(() -> new NotFoundException("alert", id));
        if (r.getStatus() != AlertStatus.ACTIVE) {
            throw new InvalidTransitionException("alert " + id + " is " + r.getStatus() + ", only ACTIVE alerts can be acknowledged");
        }
        r.setStatus(AlertStatus.ACKNOWLEDGED);
        r.setAcknowledgedAt(Instant.now());
        return toDto(repo.save(r));
    }

    public synchronized Alert resolve(String id, String notes) {
        var r = repo.findById(id).orElseThrow(() -> new NotFoundException("alert", id));
        if (r.getStatus() == AlertStatus.RESOLVED) {
            throw new InvalidTransitionException("alert " + id + " is already resolved");
        }
        r.setStatus(AlertStatus.RESOLVED);
        r.setResolvedAt(Instant.now());
        r.setResolutionNotes(notes == null || notes.isBlank() ? "Resolved by operator" : notes);
        return toDto(repo.save(r));
    }

    /** Query with optional filters and pagination (offset/limit), newest first. */
    public List<Alert> list(AlertStatus status, AlertSeverity severity, Long serverId, int limit, int offset) {
        int size = Math.max(1, Math.min(limit <= 0 ? 50 : limit, 500));
        int page = Math.max(0, offset / size);
        Pageable p = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "firstOccurrence"));
        Specification<AlertRecord> spec = Specification.where(null);
        if (status != null) spec = spec.and((root, q, cb) -> cb.equal(root.get("status"), status));
        if (severity != null) spec = spec.and((root, q, cb) -> cb.equal(root.get("severity"), severity));
        if (serverId != null) spec = spec.and((root, q, cb) -> cb.equal(root.get("serverId"), serverId));
        return repo.findAll(spec, p).stream().map(this::toDto).toList();
    }

    private Optional<AlertRecord> find(Long serverId, String metric, AlertStatus status) {
        return repo.findFirstByServerIdAndMetricNameAndStatusOrderByFirstOccurrenceDesc(serverId, metric, status);
    }

    private String title(Long serverId, String metric, AlertSeverity severity) {
        String name = serverId == null ? "fleet"
                : servers.findById(serverId).map(Server::getName).orElse("server " + serverId);
        String label = switch (metric) {
            case "cpu_usage" -> "High CPU usage";
            case "memory_usage" -> "High memory usage";
            case "disk_usage" -> "High disk usage";
            case "reachability" -> "Server unreachable";
            default -> metric.replace('_', ' ');
        };
        return (severity == AlertSeverity.CRITICAL ? "Critical: " : "") + label + " on " + name;
    }

    private static String message(String metric, double value, Double threshold) {
        if ("reachability".equals(metric)) return "Health check failed: server did not respond";
        String v = String.format(Locale.ROOT, "%.1f%%", value);
        return threshold == null
                ? metric + " is " + v
                : metric + " is " + v + " (threshold " + String.format(Locale.ROOT, "%.1f%%", threshold) + ")";
    }

    private Alert toDto(AlertRecord r) {
        return new Alert(r.getId(), r.getSeverity(), r.getTitle(), r.getMessage(),
                r.getServerId(), r.getDomainId(), r.getMetricName(), r.getMetricValue(),
                r.getThresholdValue(), r.getStatus(),
                r.getFirstOccurrence(), r.getLastOccurrence(),
                r.getAcknowledgedAt(), r.getResolvedAt(), r.getResolutionNotes());
    }
}
