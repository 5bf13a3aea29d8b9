package org.caureq.fleetcore.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "alerts", indexes = {
        @Index(name = "idx_alert_first", columnList = "firstOccurrence DESC"),
        @Index(name = "idx_alert_key_status", columnList = "serverId, metricName, status")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AlertRecord {
    @Id
    @Column(length = 36)
    private String id; // UUID string

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AlertSeverity severity;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false, length = 1000)
    private String message;

    private Long serverId;
    private Long domainId;

    @Column(length = 64)
    private String metricName;  // cpu_usage, memory_usage, disk_usage, reachability
    private Double metricValue;
    private Double thresholdValue;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AlertStatus status;

    @Column(nullable = false)
    private Instant firstOccurrence;
    private Instant lastOccurrence;
    private Instant acknowledgedAt;
    private Instant resolvedAt;

    @Column(length = 2000)
    private String resolutionNotes;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (firstOccurrence == null) firstOccurrence = Instant.now();
        if (lastOccurrence == null) lastOccurrence = firstOccurrence;
    }
}
