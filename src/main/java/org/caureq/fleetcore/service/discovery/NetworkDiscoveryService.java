package org.caureq.fleetcore.service.discovery;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleetcore.config.FleetProps;
import org.caureq.fleetcore.domain.DeploymentTask;
import org.caureq.fleetcore.domain.Server;
import org.caureq.fleetcore.domain.TaskType;
import org.caureq.fleetcore.remote.ConnectivityException;
import org.caureq.fleetcore.remote.HostProbe;
import org.caureq.fleetcore.remote.SystemFacts;
import org.caureq.fleetcore.service.ServerRegistry;
import org.caureq.fleetcore.service.deploy.DeploymentScheduler;
import org.caureq.fleetcore.service.deploy.TaskEvent;
import org.caureq.fleetcore.service.deploy.TaskProgressRecorder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scans an IPv4 range over SSH and registers selected machines for auto-setup. A scan is a
 * NETWORK_SCAN task: hosts are probed on the discovery pool and the task completes once
 * every host has been probed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NetworkDiscoveryService {
    private final HostProbe probe;
    private final ServerRegistry registry;
    private final DeploymentScheduler scheduler;
    private final TaskProgressRecorder recorder;
    @Qualifier("discoveryExecutor")
    private final Executor pool;
    private final FleetProps props;

    public record AutoSetupRequest(@JsonAlias("ip_address") String ip, Integer port, String username, String password,
                                   String privateKey, String name, @JsonAlias("service_roles") List<String> roles,
                                   Boolean enableFirewall, String priority) {}

    public record BatchResult(String ip, String outcome, Long taskId, Long serverId, String error) {}

    public DeploymentTask scanNetwork(String range, List<CredentialSet> credentialSets) {
        var cidr = Ipv4Range.parse(range);
        var hosts = cidr.hosts(props.discovery().maxHosts());
        if (credentialSets == null || credentialSets.isEmpty()) {
            throw new IllegalArgumentException("at least one credential set is required");
        }
        credentialSets.forEach(CredentialSet::validate);
        var creds = List.copyOf(credentialSets);

        Map<String, Object> cfg = new LinkedHashMap<>();
        cfg.put("network_range", cidr.toString());
        cfg.put("host_count", hosts.size());
        var task = scheduler.openScanTask(cfg);
        Long id = task.getId();

        recorder.apply(TaskEvent.started(id, hosts.size()));
        recorder.apply(TaskEvent.log(id, "Scanning " + hosts.size() + " host(s) in " + cidr + " with "
                + creds.size() + " credential set(s)"));
        log.info("[Discovery] scan {} of {} started ({} hosts)", id, cidr, hosts.size());

        var done = new AtomicInteger();
        var lastPct = new AtomicInteger();
        List<CompletableFuture<DiscoveredMachine>> futures = new ArrayList<>(hosts.size());
        try {
            for (String ip : hosts) {
                futures.add(CompletableFuture
                        .supplyAsync(() -> probeHost(id, ip, creds), pool)
                        .whenComplete((m, e) -> tick(id, done.incrementAndGet(), hosts.size(), lastPct)));
            }
        } catch (RejectedExecutionException e) {
            log.error("[Discovery] scan {} rejected by the discovery pool", id);
            recorder.apply(TaskEvent.failed(id, null, "discovery pool saturated, scan aborted"));
            return task;
        }
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                .whenComplete((v, e) -> finish(id, futures));
        return task;
    }

    public DeploymentTask autoSetup(AutoSetupRequest req) {
        if (req == null || req.ip() == null) throw new IllegalArgumentException("ip is required");
        if (req.roles() == null || req.roles().isEmpty()) throw new IllegalArgumentException("at least one role is required");
        var roles = List.copyOf(ServerRegistry.normalizeRoles(req.roles()));

        Server server = registry.findByIp(req.ip().trim()).orElseGet(() -> registry.add(new ServerRegistry.NewServer(
                req.name() == null || req.name().isBlank() ? "auto-" + req.ip().trim() : req.name(),
                req.ip(), req.port(), req.username(), req.password(), req.privateKey(), List.of())));

        Map<String, Object> cfg = new LinkedHashMap<>();
        cfg.put("roles", roles);
        cfg.put("enable_firewall", req.enableFirewall() == null || req.enableFirewall());
        var task = scheduler.create(new DeploymentScheduler.NewTask(
                TaskType.AUTO_SETUP, null, server.getId(), null, req.priority(), cfg));
        log.info("[Discovery] auto-setup task {} for {} roles={}", task.getId(), server.getIpAddress(), roles);
        return task;
    }

    /** One independent auto-setup per machine; a failure on one does not affect the others. */
    public List<BatchResult> autoSetupBatch(List<AutoSetupRequest> machines) {
        if (machines == null || machines.isEmpty()) throw new IllegalArgumentException("machines list is empty");
        List<BatchResult> out = new ArrayList<>();
        for (var m : machines) {
            try {
                var t = autoSetup(m);
                out.add(new BatchResult(m.ip(), "OK", t.getId(), t.getTargetServerId(), null));
            } catch (Exception e) {
                out.add(new BatchResult(m == null ? null : m.ip(), "ERROR", null, null, e.getMessage()));
            }
        }
        return out;
    }

    DiscoveredMachine probeHost(Long scanId, String ip, List<CredentialSet> creds) {
        if (scheduler.isCancelRequested(scanId)) return null;
        boolean reachable = false;
        String error = null;
        for (var c : creds) {
            try {
                var target = c.toTarget(ip);
                SystemFacts f = probe.probeFacts(target, props.remote().probeTimeout());
                log.debug("[Discovery] {} accessible as {}", ip, c.username());
                var roles = recommendRoles(f);
                boolean ready = meetsMinimums(f) && registry.findByIp(ip).isEmpty();
                return new DiscoveredMachine(ip, f.hostname(), f.osType(), f.osVersion(),
                        f.cpuCores(), f.memoryGb(), f.diskGb(),
                        true, true, c.username(), target.port(), roles, ready, null);
            } catch (ConnectivityException e) {
                if (e.kind() == ConnectivityException.Kind.AUTH_FAILED || e.kind() == ConnectivityException.Kind.PROTOCOL) {
                    reachable = true;
                }
                error = e.kind() + ": " + e.getMessage();
                log.debug("[Discovery] {} with {} -> {}", ip, c, error);
            } catch (RuntimeException e) {
                error = e.getMessage();
                log.debug("[Discovery] {} probe error: {}", ip, error);
            }
        }
        return new DiscoveredMachine(ip, null, null, null, null, null, null,
                reachable, false, null, null, List.of(), false, error);
    }

    static List<String> recommendRoles(SystemFacts f) {
        int cores = f.cpuCores() == null ? 0 : f.cpuCores();
        int mem = f.memoryGb() == null ? 0 : f.memoryGb();
        if (cores >= 4 && mem >= 8) return List.of("worker", "postgres", "redis");
        if (cores >= 2 && mem >= 4) return List.of("worker", "nginx");
        return List.of("nginx");
    }

    private boolean meetsMinimums(SystemFacts f) {
        var d = props.discovery();
        return f.cpuCores() != null && f.cpuCores() >= d.minCpuCores()
                && f.memoryGb() != null && f.memoryGb() >= d.minMemoryGb()
                && f.diskGb() != null && f.diskGb() >= d.minDiskGb();
    }

    private void tick(Long id, int done, int total, AtomicInteger lastPct) {
        int pct = Math.min(99, (int) (100L * done / total));
        int prev = lastPct.get();
        if (pct > prev && lastPct.compareAndSet(prev, pct)) {
            recorder.apply(TaskEvent.progress(id, pct, null));
        }
    }

    private void finish(Long id, List<CompletableFuture<DiscoveredMachine>> futures) {
        List<DiscoveredMachine> found = new ArrayList<>();
        for (var f : futures) {
            if (f.isCompletedExceptionally()) continue;
            var m = f.getNow(null);
            if (m != null) found.add(m);
        }
        found.sort(Comparator.comparingLong(m -> Integer.toUnsignedLong(Ipv4Range.toInt(m.ip()))));
        long accessible = found.stream().filter(DiscoveredMachine::sshAccessible).count();
        long ready = found.stream().filter(DiscoveredMachine::autoSetupReady).count();

        recorder.apply(TaskEvent.config(id, "discovered_machines", found.stream().map(DiscoveredMachine::toMap).toList()));
        recorder.apply(TaskEvent.config(id, "summary", Map.of(
                "probed", found.size(), "ssh_accessible", accessible, "auto_setup_ready", ready)));
        recorder.apply(TaskEvent.log(id, "Probed " + found.size() + " host(s): " + accessible
                + " accessible, " + ready + " ready for auto-setup"));
        if (scheduler.isCancelRequested(id)) {
            recorder.apply(TaskEvent.cancelled(id));
            scheduler.clearCancel(id);
        } else {
            recorder.apply(TaskEvent.completed(id));
        }
        log.info("[Discovery] scan {} finished: {} probed, {} accessible", id, found.size(), accessible);
    }
}
