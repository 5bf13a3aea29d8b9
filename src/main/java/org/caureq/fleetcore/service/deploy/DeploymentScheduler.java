package org.caureq.fleetcore.service.deploy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleetcore.config.FleetProps;
import org.caureq.fleetcore.domain.DeploymentTask;
import org.caureq.fleetcore.domain.Server;
import org.caureq.fleetcore.domain.ServerStatus;
import org.caureq.fleetcore.domain.TaskStatus;
import org.caureq.fleetcore.domain.TaskType;
import org.caureq.fleetcore.repo.DeploymentTaskRepo;
import org.caureq.fleetcore.repo.ServerRepo;
import org.caureq.fleetcore.service.NotFoundException;
import org.caureq.fleetcore.service.TargetBusyException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.regex.Pattern;

/**
 * Creates deployment tasks and hands them to the worker pool. Creation of an exclusive task
 * and the busy check happen under one lock, so a rejected request never leaves a record behind.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeploymentScheduler {
    private static final Set<String> PRIORITIES = Set.of("low", "normal", "high");
    private static final Pattern SAFE_PATH = Pattern.compile("^/[A-Za-z0-9._/-]+$");
    private static final EnumSet<TaskType> EXCLUSIVE = EnumSet.of(TaskType.INSTALL, TaskType.MIGRATE, TaskType.AUTO_SETUP);
    private static final EnumSet<TaskStatus> ACTIVE = EnumSet.of(TaskStatus.PENDING, TaskStatus.RUNNING);

    private final DeploymentTaskRepo repo;
    private final ServerRepo servers;
    private final TaskProgressRecorder recorder;
    private final TargetClaims claims;
    private final CancellationFlags cancels;
    private final TaskRunner runner;
    @Qualifier("deploymentExecutor")
    private final Executor workers;
    private final FleetProps props;

    public record NewTask(TaskType taskType, String serviceType, Long targetServerId, Long sourceServerId,
                          String priority, Map<String, Object> config) {}

    public record TaskLogs(Long id, TaskStatus status, int progress, String currentStep,
                           List<String> log, String errorMessage) {}

    public DeploymentTask create(NewTask req) {
        validate(req);
        DeploymentTask saved;
        synchronized (claims) {
            if (req.taskType().exclusive() && isBusy(req.targetServerId())) {
                throw new TargetBusyException(req.targetServerId());
            }
            saved = repo.save(DeploymentTask.builder()
                    .taskType(req.taskType())
                    .serviceType(req.serviceType() == null ? null : req.serviceType().trim().toLowerCase(Locale.ROOT))
                    .targetServerId(req.targetServerId())
                    .sourceServerId(req.sourceServerId())
                    .status(TaskStatus.PENDING)
                    .progress(0)
                    .priority(priorityOf(req.priority()))
                    .config(req.config() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(req.config()))
                    .log(new ArrayList<>(List.of("Task created")))
                    .build());
            if (req.taskType().exclusive()) claims.claim(req.targetServerId(), saved.getId());
        }
        log.info("[Tasks] created task {} {} service={} target={} source={}", saved.getId(), saved.getTaskType(),
                saved.getServiceType(), saved.getTargetServerId(), saved.getSourceServerId());
        dispatch(saved.getId());
        return saved;
    }

    /** A NETWORK_SCAN record driven by the discovery service rather than the worker pool. */
    public DeploymentTask openScanTask(Map<String, Object> config) {
        return repo.save(DeploymentTask.builder()
                .taskType(TaskType.NETWORK_SCAN)
                .status(TaskStatus.PENDING)
                .progress(0)
                .priority("normal")
                .config(new LinkedHashMap<>(config))
                .log(new ArrayList<>(List.of("Task created")))
                .build());
    }

    /**
     * PENDING tasks are cancelled immediately. RUNNING tasks stop before their next step.
     */
    public TaskStatus cancel(Long id) {
        cancels.request(id);
        try {
            var status = recorder.requestCancel(id);
            if (status == TaskStatus.CANCELLED) cancels.clear(id);
            return status;
        } catch (RuntimeException e) {
            cancels.clear(id);
            throw e;
        }
    }

    public boolean isCancelRequested(Long id) {
        return cancels.isRequested(id);
    }

    public void clearCancel(Long id) {
        cancels.clear(id);
    }

    public DeploymentTask get(Long id) {
        return repo.findById(id).orElseThrow(() -> new NotFoundException("task", id));
    }

    public TaskLogs logs(Long id) {
        var t = get(id);
        return new TaskLogs(t.getId(), t.getStatus(), t.getProgress(), t.getCurrentStep(),
                List.copyOf(t.getLog()), t.getErrorMessage());
    }

    public List<DeploymentTask> list(Integer limit) {
        int dflt = props.deploy().recentLimit() <= 0 ? 50 : props.deploy().recentLimit();
        int size = Math.max(1, Math.min(limit == null || limit <= 0 ? dflt : limit, 500));
        return repo.findAllByOrderByCreatedAtDescIdDesc(PageRequest.of(0, size));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverInterrupted() {
        int n = recorder.failInterrupted();
        if (n > 0) log.warn("[Tasks] marked {} task(s) from a previous run as failed", n);
    }

    private void dispatch(Long id) {
        try {
            workers.execute(() -> runner.run(id));
        } catch (RejectedExecutionException e) {
            log.error("[Tasks] worker pool rejected task {}", id);
            recorder.apply(TaskEvent.failed(id, null, "worker pool saturated, task not started"));
        }
    }

    private boolean isBusy(Long serverId) {
        return claims.isClaimed(serverId)
                || repo.existsByTargetServerIdAndTaskTypeInAndStatusIn(serverId, EXCLUSIVE, ACTIVE);
    }

    private void validate(NewTask req) {
        if (req == null || req.taskType() == null) throw new IllegalArgumentException("task_type is required");
        var type = req.taskType();
        if (type == TaskType.NETWORK_SCAN) {
            throw new IllegalArgumentException("network scans are started through the discovery API");
        }
        if (req.targetServerId() == null) throw new IllegalArgumentException("target_server_id is required for " + type);
        usable(req.targetServerId(), "target");
        switch (type) {
            case INSTALL, BACKUP -> recipe(req, type);
            case MIGRATE -> {
                if (req.sourceServerId() == null) throw new IllegalArgumentException("source_server_id is required for MIGRATE");
                if (req.sourceServerId().equals(req.targetServerId())) {
                    throw new IllegalArgumentException("source and target must be different servers");
                }
                usable(req.sourceServerId(), "source");
                recipe(req, type);
            }
            case AUTO_SETUP -> StepPlanFactory.rolesOf(DeploymentTask.builder().config(req.config()).build());
            default -> { }
        }
        if (req.config() != null && req.config().get("backup_dir") != null
                && !SAFE_PATH.matcher(String.valueOf(req.config().get("backup_dir"))).matches()) {
            throw new IllegalArgumentException("backup_dir must be an absolute path of [A-Za-z0-9._/-]");
        }
        priorityOf(req.priority());
    }

    private static void recipe(NewTask req, TaskType type) {
        if (req.serviceType() == null || req.serviceType().isBlank()) {
            throw new IllegalArgumentException("service_type is required for " + type);
        }
        var r = ServiceRecipe.require(req.serviceType());
        if (type != TaskType.INSTALL) StepPlanFactory.requireBackup(r);
    }

    private Server usable(Long id, String role) {
        var s = servers.findById(id).orElseThrow(() -> new IllegalArgumentException(role + " server " + id + " does not exist"));
        if (s.getStatus() == ServerStatus.DISABLED) {
            throw new IllegalArgumentException(role + " server " + s.getName() + " is disabled");
        }
        return s;
    }

    private static String priorityOf(String p) {
        if (p == null || p.isBlank()) return "normal";
        var v = p.trim().toLowerCase(Locale.ROOT);
        if (!PRIORITIES.contains(v)) throw new IllegalArgumentException("priority must be one of " + PRIORITIES);
        return v;
    }
}
