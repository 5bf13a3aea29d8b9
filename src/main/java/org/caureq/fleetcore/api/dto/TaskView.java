package org.caureq.fleetcore.api.dto;

import org.caureq.fleetcore.domain.DeploymentTask;
import org.caureq.fleetcore.domain.TaskStatus;
import org.caureq.fleetcore.domain.TaskType;

import java.time.Instant;
import java.util.Map;

public record TaskView(Long id, TaskType taskType, String serviceType, Long sourceServerId, Long targetServerId,
                       TaskStatus status, int progress, String currentStep, int totalSteps, String priority,
                       Map<String, Object> config, String errorMessage,
                       Instant createdAt, Instant updatedAt, Instant startedAt, Instant completedAt) {

    public static TaskView from(DeploymentTask t) {
        return new TaskView(t.getId(), t.getTaskType(), t.getServiceType(), t.getSourceServerId(), t.getTargetServerId(),
                t.getStatus(), t.getProgress(), t.getCurrentStep(), t.getTotalSteps(), t.getPriority(),
                t.getConfig(), t.getErrorMessage(),
                t.getCreatedAt(), t.getUpdatedAt(), t.getStartedAt(), t.getCompletedAt());
    }
}
