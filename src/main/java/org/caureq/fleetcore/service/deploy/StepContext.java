package org.caureq.fleetcore.service.deploy;

import org.caureq.fleetcore.domain.DeploymentTask;
import org.caureq.fleetcore.domain.Server;
import org.caureq.fleetcore.remote.ExecResult;
import org.caureq.fleetcore.remote.HostProbe;
import org.caureq.fleetcore.remote.RemoteExecutor;
import org.caureq.fleetcore.remote.RemoteTarget;
import org.caureq.fleetcore.service.ServerRegistry;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

/** Everything a step needs to talk to its hosts and report back. One instance per task run. */
public class StepContext {
    private static final int MAX_ECHO = 200;

    private final DeploymentTask task;
    private final Server target;
    private final Server source;
    private final RemoteTarget targetHost;
    private final RemoteTarget sourceHost;
    private final RemoteExecutor remote;
    private final HostProbe probe;
    private final ServerRegistry registry;
    private final Duration commandTimeout;
    private final Duration probeTimeout;
    private final Consumer<TaskEvent> events;
    private final Map<String, Object> scratch = new HashMap<>();

    public StepContext(DeploymentTask task, Server target, Server source,
                       RemoteTarget targetHost, RemoteTarget sourceHost,
                       RemoteExecutor remote, HostProbe probe, ServerRegistry registry,
                       Duration commandTimeout, Duration probeTimeout, Consumer<TaskEvent> events) {
        this.task = task;
        this.target = target;
        this.source = source;
        this.targetHost = targetHost;
        this.sourceHost = sourceHost;
        this.remote = remote;
        this.probe = probe;
        this.registry = registry;
        this.commandTimeout = commandTimeout;
        this.probeTimeout = probeTimeout;
        this.events = events;
    }

    public Long taskId() { return task.getId(); }
    public DeploymentTask task() { return task; }
    public Server target() { return target; }
    public Server source() { return source; }
    public RemoteTarget targetHost() { return targetHost; }
    public RemoteTarget sourceHost() { return sourceHost; }
    public RemoteExecutor remote() { return remote; }
    public HostProbe probe() { return probe; }
    public ServerRegistry registry() { return registry; }
    public Duration probeTimeout() { return probeTimeout; }
    public Duration commandTimeout() { return commandTimeout; }

    public Object option(String key, Object dflt) {
        var cfg = task.getConfig();
        return cfg == null || cfg.get(key) == null ? dflt : cfg.get(key);
    }

    public Map<String, Object> scratch() { return scratch; }

    public void log(String line) {
        events.accept(TaskEvent.log(taskId(), line));
    }

    /** Stores a value in the persisted task config (visible to readers). */
    public void publish(String key, Object value) {
        events.accept(TaskEvent.config(taskId(), key, value));
    }

    /** Runs a command and fails the step on a non-zero exit. */
    public ExecResult run(RemoteTarget host, String command) {
        log("$ " + echo(command) + "  @" + host.host());
        ExecResult r = remote.exec(host, command, commandTimeout);
        if (!r.ok()) {
            throw new StepFailedException("command failed on " + host.host() + " (exit " + r.exitCode() + "): "
                    + echo(command) + " -> " + r.tail());
        }
        return r;
    }

    private static String echo(String command) {
        return command.length() <= MAX_ECHO ? command : command.substring(0, MAX_ECHO) + "...";
    }
}
