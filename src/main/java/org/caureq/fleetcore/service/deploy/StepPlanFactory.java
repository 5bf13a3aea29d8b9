package org.caureq.fleetcore.service.deploy;

import lombok.extern.slf4j.Slf4j;
import org.caureq.fleetcore.config.FleetProps;
import org.caureq.fleetcore.domain.DeploymentTask;
import org.caureq.fleetcore.remote.RemoteTarget;
import org.caureq.fleetcore.remote.UsageSample;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Ordered step plans per task type. Steps are built to be re-runnable since a connectivity
 * failure retries the whole step.
 */
@Component
@Slf4j
public class StepPlanFactory {
    static final String DEFAULT_BACKUP_DIR = "/var/backups/fleet";
    static final List<String> BASE_PACKAGES = List.of("curl", "wget", "git", "htop", "net-tools", "ufw");
    static final double MIGRATION_MAX_TARGET_LOAD = 80.0;
    static final int MIGRATION_MIN_TARGET_HEALTH = 70;

    private final int retries;

    public StepPlanFactory(FleetProps props) {
        this.retries = Math.max(0, props.deploy().stepRetries());
    }

    public List<DeploymentStep> planFor(DeploymentTask task) {
        return switch (task.getTaskType()) {
            case INSTALL -> install(ServiceRecipe.require(task.getServiceType()));
            case AUTO_SETUP -> autoSetup(rolesOf(task));
            case MIGRATE -> migrate(ServiceRecipe.require(task.getServiceType()));
            case BACKUP -> backup(ServiceRecipe.require(task.getServiceType()));
            case NETWORK_SCAN -> throw new IllegalArgumentException("network scans are not step-planned");
        };
    }

    List<DeploymentStep> install(ServiceRecipe r) {
        return List.of(
                step("provision", ctx -> runAll(ctx, ctx.targetHost(), r.install())),
                step("configure", ctx -> runAll(ctx, ctx.targetHost(), r.configure())),
                step("start", ctx -> runAll(ctx, ctx.targetHost(), r.start())),
                step("verify", ctx -> {
                    ctx.run(ctx.targetHost(), r.verify());
                    ctx.registry().mergeRoles(ctx.target().getId(), List.of(r.tag()));
                }));
    }

    List<DeploymentStep> autoSetup(List<String> roles) {
        List<ServiceRecipe> recipes = roles.stream().map(ServiceRecipe::of)
                .flatMap(Optional::stream).distinct().toList();
        return List.of(
                step("prepare", ctx -> {
                    ctx.run(ctx.targetHost(), "sudo apt-get update");
                    ctx.run(ctx.targetHost(), "DEBIAN_FRONTEND=noninteractive sudo apt-get install -y "
                            + String.join(" ", BASE_PACKAGES));
                }),
                step("provision", ctx -> {
                    for (var role : roles) {
                        if (ServiceRecipe.of(role).isEmpty()) ctx.log("Role " + role + " has no install recipe, tag only");
                    }
                    for (var r : recipes) runAll(ctx, ctx.targetHost(), r.install());
                }),
                step("configure", ctx -> {
                    for (var r : recipes) runAll(ctx, ctx.targetHost(), r.configure());
                    if (Boolean.parseBoolean(String.valueOf(ctx.option("enable_firewall", true)))) {
                        runAll(ctx, ctx.targetHost(), firewall(recipes));
                    } else {
                        ctx.log("Firewall configuration skipped");
                    }
                }),
                step("start", ctx -> {
                    for (var r : recipes) runAll(ctx, ctx.targetHost(), r.start());
                }),
                step("verify", ctx -> {
                    for (var r : recipes) ctx.run(ctx.targetHost(), r.verify());
                    var facts = ctx.probe().probeFacts(ctx.targetHost(), ctx.probeTimeout());
                    ctx.registry().applyFacts(ctx.target().getId(), facts);
                }),
                step("activate", ctx -> {
                    ctx.registry().mergeRoles(ctx.target().getId(), roles);
                    ctx.registry().markActive(ctx.target().getId());
                    ctx.log("Server " + ctx.target().getName() + " is active with roles " + roles);
                }));
    }

    List<DeploymentStep> migrate(ServiceRecipe r) {
        requireBackup(r);
        return List.of(
                step("preflight", ctx -> {
                    if (ctx.target().getHealthScore() < MIGRATION_MIN_TARGET_HEALTH) {
                        throw new StepFailedException("target health " + ctx.target().getHealthScore()
                                + " is below " + MIGRATION_MIN_TARGET_HEALTH);
                    }
                    UsageSample u = ctx.probe().sampleUsage(ctx.targetHost(), ctx.probeTimeout());
                    if (u.cpuUsage() > MIGRATION_MAX_TARGET_LOAD || u.memoryUsage() > MIGRATION_MAX_TARGET_LOAD) {
                        throw new StepFailedException(String.format(Locale.ROOT,
                                "target too busy for migration (cpu %.1f%%, memory %.1f%%)", u.cpuUsage(), u.memoryUsage()));
                    }
                    ctx.run(ctx.sourceHost(), r.verify());
                }),
                step("backup_source", ctx -> dump(ctx, ctx.sourceHost(), r)),
                step("provision_target", ctx -> {
                    runAll(ctx, ctx.targetHost(), r.install());
                    runAll(ctx, ctx.targetHost(), r.configure());
                    runAll(ctx, ctx.targetHost(), r.start());
                }),
                step("restore", ctx -> {
                    String path = backupPath(ctx, r);
                    copy(ctx, ctx.sourceHost(), ctx.targetHost(), path);
                    runAll(ctx, ctx.targetHost(), r.restore(path));
                }),
                step("verify", ctx -> {
                    ctx.run(ctx.targetHost(), r.verify());
                    ctx.registry().mergeRoles(ctx.target().getId(), List.of(r.tag()));
                }),
                step("stop_source", ctx -> ctx.run(ctx.sourceHost(), r.stop())));
    }

    List<DeploymentStep> backup(ServiceRecipe r) {
        requireBackup(r);
        return List.of(
                step("prepare", ctx -> {
                    ctx.run(ctx.targetHost(), r.verify());
                    ctx.run(ctx.targetHost(), "sudo mkdir -p " + backupDir(ctx));
                }),
                step("dump", ctx -> dump(ctx, ctx.targetHost(), r)),
                step("verify", ctx -> {
                    String path = backupPath(ctx, r);
                    ctx.run(ctx.targetHost(), "sudo test -s " + path);
                    ctx.publish("backup_path", path);
                }));
    }

    static void requireBackup(ServiceRecipe r) {
        if (!r.supportsBackup()) throw new IllegalArgumentException("backup is not supported for " + r.tag());
    }

    static List<String> rolesOf(DeploymentTask task) {
        Object raw = task.getConfig() == null ? null : task.getConfig().get("roles");
        if (!(raw instanceof Collection<?> c) || c.isEmpty()) {
            throw new IllegalArgumentException("auto-setup requires at least one role");
        }
        return c.stream().map(String::valueOf).map(s -> s.trim().toLowerCase(Locale.ROOT)).distinct().toList();
    }

    static List<String> firewall(List<ServiceRecipe> recipes) {
        List<String> cmds = new ArrayList<>(List.of(
                "sudo ufw allow ssh", "sudo ufw allow 80/tcp", "sudo ufw allow 443/tcp"));
        for (var r : recipes) {
            if (r.firewallPort() > 0 && r.firewallPort() != 443) cmds.add("sudo ufw allow " + r.firewallPort() + "/tcp");
        }
        cmds.add("sudo ufw --force enable");
        return cmds;
    }

    private static void dump(StepContext ctx, RemoteTarget host, ServiceRecipe r) {
        String path = backupPath(ctx, r);
        ctx.run(host, "sudo mkdir -p " + backupDir(ctx) + " && sudo chmod 755 " + backupDir(ctx));
        ctx.run(host, r.backup(path));
        ctx.run(host, "sudo test -s " + path);
        ctx.log("Backup written to " + path + " on " + host.host());
    }

    /** Streams the archive through this process: base64 out of the source, upload to the target. */
    private static void copy(StepContext ctx, RemoteTarget from, RemoteTarget to, String path) {
        var out = ctx.run(from, "sudo base64 -w0 " + path);
        byte[] data = Base64.getDecoder().decode(out.stdout().trim().getBytes(StandardCharsets.US_ASCII));
        String staging = "/tmp/fleet-restore-" + ctx.taskId();
        ctx.remote().upload(to, data, staging, ctx.commandTimeout());
        ctx.run(to, "sudo mkdir -p " + backupDir(ctx) + " && sudo mv " + staging + " " + path);
        ctx.log("Copied " + data.length + " bytes from " + from.host() + " to " + to.host());
    }

    private static String backupDir(StepContext ctx) {
        return String.valueOf(ctx.option("backup_dir", DEFAULT_BACKUP_DIR));
    }

    private static String backupPath(StepContext ctx, ServiceRecipe r) {
        return backupDir(ctx) + "/task" + ctx.taskId() + "_" + r.backupFile();
    }

    private static void runAll(StepContext ctx, RemoteTarget host, List<String> commands) {
        for (var c : commands) ctx.run(host, c);
    }

    private DeploymentStep step(String name, DeploymentStep.Action action) {
        return new DeploymentStep(name, retries, action);
    }
}
