package org.caureq.fleetcore.service.monitor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleetcore.config.FleetProps;
import org.caureq.fleetcore.domain.AlertSeverity;
import org.caureq.fleetcore.domain.Server;
import org.caureq.fleetcore.domain.ServerStatus;
import org.caureq.fleetcore.remote.ConnectivityException;
import org.caureq.fleetcore.remote.HostProbe;
import org.caureq.fleetcore.remote.RemoteTarget;
import org.caureq.fleetcore.remote.UsageSample;
import org.caureq.fleetcore.service.ServerRegistry;
import org.caureq.fleetcore.service.alerts.AlertConfigService;
import org.caureq.fleetcore.service.alerts.AlertManager;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodic health sweep over every non-disabled server. Probes fan out on the probe pool;
 * health write-back and alert evaluation run sequentially once all probes are back.
 * Ticks and manual checks share one lock: a tick that finds it held is skipped.
 * Periodic ticks can be paused and resumed at runtime; manual checks always run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HealthMonitor {
    static final String REACHABILITY = "reachability";

    private final ServerRegistry registry;
    private final HostProbe probe;
    private final AlertManager alerts;
    private final AlertConfigService thresholds;
    @Qualifier("probeExecutor")
    private final Executor pool;
    private final FleetProps props;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, HealthReport> latest = new ConcurrentHashMap<>();
    // null until start/stop is called; falls back to fleet.monitor.enabled
    private volatile Boolean running;

    public record HealthReport(Long serverId, String name, String ipAddress, boolean reachable,
                               int healthScore, ServerStatus status, UsageSample usage,
                               String error, Instant checkedAt) {}

    @Scheduled(fixedDelayString = "${fleet.monitor.interval-ms:60000}",
            initialDelayString = "${fleet.monitor.initial-delay-ms:30000}")
    public void tick() {
        runTick();
    }

    /** @return false when the monitor is stopped or another check holds the lock */
    boolean runTick() {
        if (!isRunning()) return false;
        if (!lock.tryLock()) {
            log.debug("[Monitor] check already in progress, tick skipped");
            return false;
        }
        try {
            var reports = sweep(registry.monitored());
            long down = reports.stream().filter(r -> !r.reachable()).count();
            log.info("[Monitor] tick: {} server(s) checked, {} unreachable", reports.size(), down);
        } catch (RuntimeException e) {
            log.error("[Monitor] tick failed", e);
        } finally {
            lock.unlock();
        }
        return true;
    }

    /** @return true if the monitor was stopped before this call */
    public boolean start() {
        boolean was = isRunning();
        running = Boolean.TRUE;
        if (!was) log.info("[Monitor] periodic checks started");
        return !was;
    }

    /** @return true if the monitor was running before this call */
    public boolean stop() {
        boolean was = isRunning();
        running = Boolean.FALSE;
        if (was) log.info("[Monitor] periodic checks stopped");
        return was;
    }

    public boolean isRunning() {
        var r = running;
        return r != null ? r : props.monitor().enabled();
    }

    /** Most recent report per server, from ticks and manual checks alike. */
    public List<HealthReport> latestReports() {
        return latest.values().stream()
                .sorted(Comparator.comparing(HealthReport::serverId))
                .toList();
    }

    public HealthReport healthCheckServer(Long id) {
        lock.lock();
        try {
            return sweep(List.of(registry.get(id))).get(0);
        } finally {
            lock.unlock();
        }
    }

    public List<HealthReport> healthCheckAll() {
        lock.lock();
        try {
            return sweep(registry.monitored());
        } finally {
            lock.unlock();
        }
    }

    private List<HealthReport> sweep(List<Server> servers) {
        List<CompletableFuture<HealthReport>> futures = new ArrayList<>(servers.size());
        for (Server s : servers) {
            RemoteTarget target;
            try {
                target = registry.resolveTarget(s);
            } catch (RuntimeException e) {
                futures.add(CompletableFuture.completedFuture(unreachable(s, e.getMessage())));
                continue;
            }
            futures.add(CompletableFuture.supplyAsync(() -> probeOne(s, target), pool)
                    .exceptionally(e -> unreachable(s, e.getMessage())));
        }
        List<HealthReport> reports = new ArrayList<>(futures.size());
        for (var f : futures) reports.add(apply(f.join()));
        return reports;
    }

    private HealthReport probeOne(Server s, RemoteTarget target) {
        try {
            var u = probe.sampleUsage(target, props.remote().probeTimeout());
            int score = score(u);
            log.debug("[Monitor] {} cpu={} mem={} disk={} score={}", s.getName(),
                    u.cpuUsage(), u.memoryUsage(), u.diskUsage(), score);
            return new HealthReport(s.getId(), s.getName(), s.getIpAddress(), true, score,
                    keepDisabled(s, ServerStatus.ACTIVE), u, null, Instant.now());
        } catch (ConnectivityException e) {
            log.warn("[Monitor] {} ({}) unreachable: {} {}", s.getName(), s.getIpAddress(), e.kind(), e.getMessage());
            return unreachable(s, e.kind() + ": " + e.getMessage());
        }
    }

    private HealthReport apply(HealthReport r) {
        registry.updateHealth(r.serverId(), r.healthScore(), r.status());
        latest.put(r.serverId(), r);
        if (!r.reachable()) {
            alerts.raise(r.serverId(), REACHABILITY, 0, AlertSeverity.CRITICAL);
            return r;
        }
        alerts.clearIfActive(r.serverId(), REACHABILITY);
        var u = r.usage();
        evaluate(r.serverId(), "cpu_usage", u.cpuUsage());
        evaluate(r.serverId(), "memory_usage", u.memoryUsage());
        evaluate(r.serverId(), "disk_usage", u.diskUsage());
        return r;
    }

    private void evaluate(Long serverId, String metric, double value) {
        double[] t = thresholds.get().forMetric(metric);
        if (value > t[1]) {
            alerts.raise(serverId, metric, value, AlertSeverity.CRITICAL, t[1]);
        } else if (value > t[0]) {
            alerts.raise(serverId, metric, value, AlertSeverity.WARNING, t[0]);
        } else {
            alerts.clearIfActive(serverId, metric);
        }
    }

    static int score(UsageSample u) {
        return (int) Math.max(0, Math.min(100, Math.round(100 - u.worst())));
    }

    private static HealthReport unreachable(Server s, String error) {
        return new HealthReport(s.getId(), s.getName(), s.getIpAddress(), false, 0,
                keepDisabled(s, ServerStatus.UNREACHABLE), null, error, Instant.now());
    }

    private static ServerStatus keepDisabled(Server s, ServerStatus observed) {
        return s.getStatus() == ServerStatus.DISABLED ? ServerStatus.DISABLED : observed;
    }
}
