package org.caureq.fleetcore.api.dto;

import jakarta.validation.constraints.NotBlank;
import org.caureq.fleetcore.domain.TaskType;
import org.caureq.fleetcore.service.deploy.DeploymentScheduler;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

public record CreateTaskRequest(
        @NotBlank String taskType,
        String serviceType,
        Long targetServerId,
        Long sourceServerId,
        String priority,
        Map<String, Object> config) {

    public DeploymentScheduler.NewTask toNewTask() {
        TaskType type;
        try {
            type = TaskType.valueOf(taskType.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown task_type: " + taskType
                    + " (expected one of " + Arrays.toString(TaskType.values()) + ")");
        }
        return new DeploymentScheduler.NewTask(type, serviceType, targetServerId, sourceServerId, priority, config);
    }
}
