package org.caureq.fleetcore.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleetcore.config.FleetProps;
import org.caureq.fleetcore.domain.Server;
import org.caureq.fleetcore.domain.ServerCredential;
import org.caureq.fleetcore.domain.ServerStatus;
import org.caureq.fleetcore.remote.HostProbe;
import org.caureq.fleetcore.remote.RemoteTarget;
import org.caureq.fleetcore.remote.SystemFacts;
import org.caureq.fleetcore.repo.CredentialRepo;
import org.caureq.fleetcore.repo.ServerRepo;
import org.caureq.fleetcore.service.discovery.Ipv4Range;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Durable record of managed hosts. Credentials live in their own table and are only handed
 * out as a {@link RemoteTarget} to code that talks to the host.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ServerRegistry {
    private static final Pattern ROLE = Pattern.compile("^[a-z][a-z0-9_-]{0,31}$");

    private final ServerRepo repo;
    private final CredentialRepo credentials;
    private final HostProbe probe;
    private final FleetProps props;
    private final TransactionTemplate tx;

    public record NewServer(String name, String ipAddress, Integer port, String username,
                            String password, String privateKey, Collection<String> roles) {}

    public record ConnectionResult(boolean reachable, long latencyMs, SystemFacts facts) {}

    public record Filter(ServerStatus status, String role, String name) {
        public static final Filter NONE = new Filter(null, null, null);
    }

    /**
     * Registers a host. With verify-on-add, a failed connection test persists nothing.
     * The pre-checks give friendly errors; the unique constraints on ip and name decide races.
     */
    public Server add(NewServer spec) {
        validate(spec);
        String ip = spec.ipAddress().trim();
        String name = spec.name().trim();
        if (repo.existsByIpAddress(ip)) throw new DuplicateServerException("a server with IP " + ip + " is already registered");
        if (repo.existsByNameIgnoreCase(name)) throw new DuplicateServerException("a server named " + name + " is already registered");

        SystemFacts facts = null;
        if (props.registry() == null || props.registry().verifyOnAdd()) {
            facts = testConnection(spec).facts();
        }

        final SystemFacts known = facts;
        Server saved;
        try {
            // credential and server commit together; the connection test above stays outside
            saved = tx.execute(status -> {
                var cred = credentials.save(ServerCredential.builder()
                        .username(spec.username().trim())
                        .password(spec.password())
                        .privateKey(spec.privateKey())
                        .build());
                var s = Server.builder()
                        .name(name)
                        .ipAddress(ip)
                        .port(portOf(spec))
                        .authRef(cred.getAuthRef())
                        .roles(normalizeRoles(spec.roles()))
                        .status(ServerStatus.ACTIVE)
                        .healthScore(100)
                        .build();
                applyFacts(s, known);
                return repo.saveAndFlush(s);
            });
        } catch (DataIntegrityViolationException e) {
            log.warn("[Registry] concurrent add for {} ({}) lost the race: {}", name, ip, e.getMostSpecificCause().getMessage());
            throw new DuplicateServerException("a server with IP " + ip + " or name " + name + " is already registered");
        }
        log.info("[Registry] added server {} ({}:{}) roles={}", saved.getName(), ip, saved.getPort(), saved.getRoles());
        return saved;
    }

    /** Connects, runs the facts probe and disconnects. Persists nothing. */
    public ConnectionResult testConnection(NewServer spec) {
        validate(spec);
        var target = new RemoteTarget(spec.ipAddress().trim(), portOf(spec), spec.username().trim(),
                spec.password(), spec.privateKey());
        long t0 = System.currentTimeMillis();
        var facts = probe.probeFacts(target, props.remote().probeTimeout());
        long latency = System.currentTimeMillis() - t0;
        log.debug("[Registry] connection test {} ok in {}ms", target.endpoint(), latency);
        return new ConnectionResult(true, latency, facts);
    }

    public Server get(Long id) {
        return repo.findById(id).orElseThrow(() -> new NotFoundException("server", id));
    }

    public Optional<Server> findByIp(String ip) {
        return repo.findByIpAddress(ip);
    }

    public List<Server> list(Filter f) {
        var filter = f == null ? Filter.NONE : f;
        String role = filter.role() == null ? null : filter.role().trim().toLowerCase(Locale.ROOT);
        String name = filter.name() == null ? null : filter.name().trim().toLowerCase(Locale.ROOT);
        return repo.findAll().stream()
                .filter(s -> filter.status() == null || s.getStatus() == filter.status())
                .filter(s -> role == null || role.isEmpty() || s.getRoles().contains(role))
                .filter(s -> name == null || name.isEmpty() || s.getName().toLowerCase(Locale.ROOT).contains(name))
                .sorted(Comparator.comparing(Server::getId))
                .toList();
    }

    public List<Server> monitored() {
        return repo.findByStatusNot(ServerStatus.DISABLED);
    }

    /** Health write-back from the monitor. A server disabled in the meantime stays DISABLED. */
    @Transactional
    public void updateHealth(Long id, int score, ServerStatus status) {
        repo.findById(id).ifPresent(s -> {
            s.setHealthScore(Math.max(0, Math.min(100, score)));
            s.setLastHealthCheck(Instant.now());
            if (s.getStatus() != ServerStatus.DISABLED) s.setStatus(status);
            repo.save(s);
        });
    }

    @Transactional
    public Server updateRoles(Long id, Collection<String> roles) {
        var s = get(id);
        s.setRoles(normalizeRoles(roles));
        return repo.save(s);
    }

    @Transactional
    public Server mergeRoles(Long id, Collection<String> roles) {
        var s = get(id);
        var merged = new LinkedHashSet<>(s.getRoles());
        merged.addAll(normalizeRoles(roles));
        s.setRoles(merged);
        return repo.save(s);
    }

    @Transactional
    public Server disable(Long id) {
        var s = get(id);
        s.setStatus(ServerStatus.DISABLED);
        log.info("[Registry] disabled server {}", s.getName());
        return repo.save(s);
    }

    /** Re-enables a server; its real state is learnt on the next health check. */
    @Transactional
    public Server enable(Long id) {
        var s = get(id);
        if (s.getStatus() == ServerStatus.DISABLED) {
            s.setStatus(ServerStatus.ACTIVE);
            log.info("[Registry] enabled server {}", s.getName());
        }
        return repo.save(s);
    }

    @Transactional
    public Server markActive(Long id) {
        var s = get(id);
        if (s.getStatus() != ServerStatus.DISABLED) s.setStatus(ServerStatus.ACTIVE);
        return repo.save(s);
    }

    @Transactional
    public void applyFacts(Long id, SystemFacts facts) {
        repo.findById(id).ifPresent(s -> {
            applyFacts(s, facts);
            repo.save(s);
        });
    }

    public RemoteTarget resolveTarget(Server s) {
        var c = credentials.findById(s.getAuthRef())
                .orElseThrow(() -> new NotFoundException("credentials for server", s.getName()));
        return new RemoteTarget(s.getIpAddress(), s.getPort(), c.getUsername(), c.getPassword(), c.getPrivateKey());
    }

    public static Set<String> normalizeRoles(Collection<String> roles) {
        Set<String> out = new LinkedHashSet<>();
        if (roles == null) return out;
        for (var r : roles) {
            if (r == null || r.isBlank()) continue;
            var tag = r.trim().toLowerCase(Locale.ROOT);
            if (!ROLE.matcher(tag).matches()) throw new IllegalArgumentException("invalid role tag: " + r);
            out.add(tag);
        }
        return out;
    }

    private static void applyFacts(Server s, SystemFacts f) {
        if (f == null) return;
        if (f.osType() != null) s.setOsType(f.osType());
        if (f.osVersion() != null) s.setOsVersion(f.osVersion());
        if (f.cpuCores() != null) s.setCpuCores(f.cpuCores());
        if (f.memoryGb() != null) s.setMemoryGb(f.memoryGb());
        if (f.diskGb() != null) s.setDiskGb(f.diskGb());
    }

    private static int portOf(NewServer spec) {
        return spec.port() == null ? 22 : spec.port();
    }

    private static void validate(NewServer spec) {
        if (spec == null) throw new IllegalArgumentException("server details are required");
        if (spec.name() == null || spec.name().isBlank()) throw new IllegalArgumentException("name is required");
        if (spec.name().trim().length() > 100) throw new IllegalArgumentException("name is too long (max 100)");
        if (!Ipv4Range.isAddress(spec.ipAddress())) throw new IllegalArgumentException("invalid IPv4 address: " + spec.ipAddress());
        int port = portOf(spec);
        if (port < 1 || port > 65535) throw new IllegalArgumentException("port must be in 1..65535");
        if (spec.username() == null || spec.username().isBlank()) throw new IllegalArgumentException("username is required");
        boolean hasPwd = spec.password() != null && !spec.password().isEmpty();
        boolean hasKey = spec.privateKey() != null && !spec.privateKey().isBlank();
        if (!hasPwd && !hasKey) throw new IllegalArgumentException("a password or a private key is required");
    }
}
