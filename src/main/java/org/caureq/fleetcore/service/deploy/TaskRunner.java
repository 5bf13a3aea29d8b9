package org.caureq.fleetcore.service.deploy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleetcore.config.FleetProps;
import org.caureq.fleetcore.domain.DeploymentTask;
import org.caureq.fleetcore.domain.Server;
import org.caureq.fleetcore.remote.ConnectivityException;
import org.caureq.fleetcore.remote.HostProbe;
import org.caureq.fleetcore.remote.RemoteExecutor;
import org.caureq.fleetcore.repo.DeploymentTaskRepo;
import org.caureq.fleetcore.service.ServerRegistry;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.List;

/**
 * Executes one task's plan on the calling worker thread: steps in order, cancellation checked
 * before each step, connectivity failures retried with exponential backoff.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TaskRunner {
    private final DeploymentTaskRepo tasks;
    private final StepPlanFactory plans;
    private final TaskProgressRecorder recorder;
    private final CancellationFlags cancels;
    private final ServerRegistry registry;
    private final RemoteExecutor remote;
    private final HostProbe probe;
    private final FleetProps props;

    public void run(Long taskId) {
        try {
            execute(taskId);
        } catch (RuntimeException e) {
            log.error("[Tasks] task {} crashed", taskId, e);
            recorder.apply(TaskEvent.failed(taskId, null, describe(e)));
        } finally {
            cancels.clear(taskId);
        }
    }

    private void execute(Long taskId) {
        DeploymentTask task = tasks.findById(taskId).orElse(null);
        if (task == null || task.getStatus().terminal()) return;

        List<DeploymentStep> plan;
        StepContext ctx;
        try {
            plan = plans.planFor(task);
            ctx = context(task);
        } catch (RuntimeException e) {
            recorder.apply(TaskEvent.failed(taskId, null, describe(e)));
            return;
        }

        if (!recorder.apply(TaskEvent.started(taskId, plan.size()))) return;

        int done = 0;
        for (DeploymentStep step : plan) {
            if (cancels.isRequested(taskId)) {
                recorder.apply(TaskEvent.cancelled(taskId));
                return;
            }
            recorder.apply(TaskEvent.stepStarted(taskId, step.name()));
            try {
                runWithRetry(step, ctx);
            } catch (RuntimeException e) {
                recorder.apply(TaskEvent.failed(taskId, step.name(), describe(e)));
                return;
            }
            done++;
            int progress = (int) Math.round(100.0 * done / plan.size());
            recorder.apply(TaskEvent.stepCompleted(taskId, step.name(), progress));
        }
        recorder.apply(TaskEvent.completed(taskId));
    }

    private void runWithRetry(DeploymentStep step, StepContext ctx) {
        Mono.fromRunnable(() -> step.action().run(ctx))
                .retryWhen(Retry.backoff(step.maxRetries(), props.deploy().retryBackoff())
                        .filter(ConnectivityException.class::isInstance)
                        .doBeforeRetry(sig -> {
                            log.warn("[Tasks] task {} step {} retry #{}: {}", ctx.taskId(), step.name(),
                                    sig.totalRetries() + 1, sig.failure().getMessage());
                            ctx.log("Step " + step.name() + " retry " + (sig.totalRetries() + 1) + "/" + step.maxRetries()
                                    + " after: " + sig.failure().getMessage());
                        })
                        .onRetryExhaustedThrow((spec, sig) -> sig.failure()))
                .block();
    }

    private StepContext context(DeploymentTask task) {
        Server target = task.getTargetServerId() == null ? null : registry.get(task.getTargetServerId());
        Server source = task.getSourceServerId() == null ? null : registry.get(task.getSourceServerId());
        return new StepContext(task, target, source,
                target == null ? null : registry.resolveTarget(target),
                source == null ? null : registry.resolveTarget(source),
                remote, probe, registry,
                props.remote().commandTimeout(), props.remote().probeTimeout(),
                recorder::apply);
    }

    private static String describe(Throwable e) {
        if (e instanceof ConnectivityException ce) return ce.kind() + ": " + ce.getMessage();
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
