package org.caureq.fleetcore.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Entity
@Table(name = "deployment_tasks", indexes = {
        @Index(name = "idx_task_created", columnList = "createdAt"),
        @Index(name = "idx_task_target_status", columnList = "targetServerId, status")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DeploymentTask {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TaskType taskType;

    @Column(length = 64)
    private String serviceType;

    private Long sourceServerId;
    private Long targetServerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TaskStatus status;

    private int progress;

    @Column(length = 64)
    private String currentStep;

    private int totalSteps;

    @Column(length = 16)
    private String priority;  // low | normal | high (informational)

    @Convert(converter = JsonMapConverter.class)
    @Column(length = 1_000_000)
    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();

    @Column(length = 2000)
    private String errorMessage;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "deployment_task_log", joinColumns = @JoinColumn(name = "task_id"))
    @OrderColumn(name = "line_no")
    @Column(name = "line", length = 2000)
    @Builder.Default
    private List<String> log = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;
    private Instant startedAt;
    private Instant completedAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }
}
