package org.caureq.fleetcore.service.deploy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleetcore.domain.DeploymentTask;
import org.caureq.fleetcore.domain.TaskStatus;
import org.caureq.fleetcore.repo.DeploymentTaskRepo;
import org.caureq.fleetcore.service.InvalidTransitionException;
import org.caureq.fleetcore.service.NotFoundException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;

/**
 * Sole writer of task state once a task exists. Events for a task that already reached a
 * terminal state are dropped, which is what freezes progress and log after a cancel or failure.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskProgressRecorder {
    private static final int MAX_LOG_LINE = 2000;

    private final DeploymentTaskRepo repo;
    private final TargetClaims claims;

    /** @return false when the event was ignored because the task is gone or already terminal */
    public synchronized boolean apply(TaskEvent e) {
        var t = repo.findById(e.taskId()).orElse(null);
        if (t == null) {
            log.debug("[Tasks] event {} for unknown task {}", e.type(), e.taskId());
            return false;
        }
        if (t.getStatus().terminal()) {
            log.debug("[Tasks] ignoring {} for task {} in {}", e.type(), t.getId(), t.getStatus());
            return false;
        }
        var now = Instant.now();
        switch (e.type()) {
            case STARTED -> {
                if (t.getStatus() != TaskStatus.PENDING) return false;
                t.setStatus(TaskStatus.RUNNING);
                t.setStartedAt(now);
                if (e.progress() != null) t.setTotalSteps(e.progress());
                append(t, "Task started (" + t.getTotalSteps() + " steps)");
                log.info("[Tasks] task {} {} RUNNING", t.getId(), t.getTaskType());
            }
            case STEP_STARTED -> {
                t.setCurrentStep(e.step());
                append(t, "Step " + e.step() + " started");
            }
            case STEP_COMPLETED -> {
                t.setCurrentStep(e.step());
                raise(t, e.progress());
                append(t, "Step " + e.step() + " completed (" + t.getProgress() + "%)");
            }
            case PROGRESS -> {
                raise(t, e.progress());
                if (e.message() != null) append(t, e.message());
            }
            case LOG -> append(t, e.message());
            case CONFIG -> {
                var cfg = t.getConfig() == null ? new LinkedHashMap<String, Object>() : new LinkedHashMap<>(t.getConfig());
                cfg.put(e.configKey(), e.configValue());
                t.setConfig(cfg);
            }
            case COMPLETED -> {
                t.setStatus(TaskStatus.COMPLETED);
                t.setProgress(100);
                t.setCompletedAt(now);
                append(t, "Task completed");
                log.info("[Tasks] task {} {} COMPLETED", t.getId(), t.getTaskType());
            }
            case FAILED -> {
                t.setStatus(TaskStatus.FAILED);
                t.setErrorMessage(truncate(e.message()));
                t.setCompletedAt(now);
                append(t, (e.step() == null ? "Task failed: " : "Step " + e.step() + " failed: ") + e.message());
                log.warn("[Tasks] task {} {} FAILED at {}: {}", t.getId(), t.getTaskType(), e.step(), e.message());
            }
            case CANCELLED -> {
                t.setStatus(TaskStatus.CANCELLED);
                t.setCompletedAt(now);
                append(t, "Task cancelled");
                log.info("[Tasks] task {} {} CANCELLED", t.getId(), t.getTaskType());
            }
        }
        repo.save(t);
        if (t.getStatus().terminal()) claims.release(t.getTargetServerId(), t.getId());
        return true;
    }

    /**
     * PENDING tasks are cancelled on the spot; RUNNING ones are left to the runner.
     * @return the status after the call
     */
    public synchronized TaskStatus requestCancel(Long id) {
        var t = repo.findById(id).orElseThrow(() -> new NotFoundException("task", id));
        switch (t.getStatus()) {
            case PENDING -> {
                t.setStatus(TaskStatus.CANCELLED);
                t.setCompletedAt(Instant.now());
                append(t, "Task cancelled before start");
                repo.save(t);
                claims.release(t.getTargetServerId(), t.getId());
                log.info("[Tasks] task {} cancelled while pending", id);
                return TaskStatus.CANCELLED;
            }
            case RUNNING -> {
                append(t, "Cancellation requested");
                repo.save(t);
                return TaskStatus.RUNNING;
            }
            default -> throw new InvalidTransitionException("task " + id + " is " + t.getStatus() + " and cannot be cancelled");
        }
    }

    /** Marks tasks orphaned by a previous process as failed. */
    public synchronized int failInterrupted() {
        var stale = repo.findByStatusIn(EnumSet.of(TaskStatus.PENDING, TaskStatus.RUNNING));
        for (var t : stale) {
            t.setStatus(TaskStatus.FAILED);
            t.setErrorMessage("interrupted by restart");
            t.setCompletedAt(Instant.now());
            append(t, "Task failed: interrupted by restart");
            repo.save(t);
        }
        return stale.size();
    }

    private static void raise(DeploymentTask t, Integer progress) {
        if (progress == null) return;
        int p = Math.max(0, Math.min(100, progress));
        if (p > t.getProgress()) t.setProgress(p);
    }

    private static void append(DeploymentTask t, String line) {
        if (line == null) return;
        String stamped = "[" + Instant.now() + "] " + line;
        t.getLog().add(truncate(stamped));
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() <= MAX_LOG_LINE ? s : s.substring(0, MAX_LOG_LINE - 3) + "...";
    }
}
