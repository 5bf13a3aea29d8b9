package org.caureq.fleetcore.service.deploy;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Shell recipes per supported service. Commands run non-interactively with sudo on
 * Debian/Ubuntu hosts. {@code %s} in backup/restore commands is the archive path.
 */
public enum ServiceRecipe {
    DOCKER("docker", "docker",
            List.of("sudo apt-get update",
                    "DEBIAN_FRONTEND=noninteractive sudo apt-get install -y docker.io"),
            List.of("sudo usermod -aG docker $(whoami) || true"),
            "docker info --format '{{.ServerVersion}}'",
            null, null, List.of(), 0),
    NGINX("nginx", "nginx",
            List.of("sudo apt-get update",
                    "DEBIAN_FRONTEND=noninteractive sudo apt-get install -y nginx"),
            List.of("sudo nginx -t"),
            "systemctl is-active nginx",
            "nginx_config.tar.gz", "sudo tar -czf %s /etc/nginx/",
            List.of("sudo systemctl stop nginx", "sudo tar -xzf %s -C /", "sudo systemctl start nginx"), 443),
    POSTGRES("postgres", "postgresql",
            List.of("sudo apt-get update",
                    "DEBIAN_FRONTEND=noninteractive sudo apt-get install -y postgresql postgresql-contrib"),
            List.of("sudo -u postgres psql -c 'SELECT 1' >/dev/null"),
            "systemctl is-active postgresql",
            "postgres_backup.sql", "sudo -u postgres pg_dumpall > %s",
            List.of("sudo -u postgres psql -f %s postgres"), 5432),
    REDIS("redis", "redis-server",
            List.of("sudo apt-get update",
                    "DEBIAN_FRONTEND=noninteractive sudo apt-get install -y redis-server"),
            List.of("redis-cli --version"),
            "redis-cli ping | grep -q PONG",
            "redis_backup.rdb", "sudo redis-cli save >/dev/null && sudo cp /var/lib/redis/dump.rdb %s",
            List.of("sudo systemctl stop redis-server", "sudo cp %s /var/lib/redis/dump.rdb",
                    "sudo chown redis:redis /var/lib/redis/dump.rdb", "sudo systemctl start redis-server"), 6379);

    private final String tag;
    private final String unit;
    private final List<String> install;
    private final List<String> configure;
    private final String verify;
    private final String backupFile;
    private final String backupCommand;
    private final List<String> restore;
    private final int firewallPort;

    ServiceRecipe(String tag, String unit, List<String> install, List<String> configure, String verify,
                  String backupFile, String backupCommand, List<String> restore, int firewallPort) {
        this.tag = tag;
        this.unit = unit;
        this.install = install;
        this.configure = configure;
        this.verify = verify;
        this.backupFile = backupFile;
        this.backupCommand = backupCommand;
        this.restore = restore;
        this.firewallPort = firewallPort;
    }

    public static Optional<ServiceRecipe> of(String tag) {
        if (tag == null) return Optional.empty();
        var t = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(r -> r.tag.equals(t)).findFirst();
    }

    public static ServiceRecipe require(String tag) {
        return of(tag).orElseThrow(() -> new IllegalArgumentException("unknown service type: " + tag
                + " (supported: " + Arrays.stream(values()).map(ServiceRecipe::tag).toList() + ")"));
    }

    public String tag() { return tag; }
    public List<String> install() { return install; }
    public List<String> configure() { return configure; }
    public String verify() { return verify; }
    public int firewallPort() { return firewallPort; }

    public List<String> start() {
        return List.of("sudo systemctl enable " + unit + " || true", "sudo systemctl start " + unit);
    }

    public String stop() { return "sudo systemctl stop " + unit; }

    public boolean supportsBackup() { return backupCommand != null; }

    public String backupFile() { return backupFile; }

    public String backup(String path) { return String.format(backupCommand, path); }

    public List<String> restore(String path) {
        return restore.stream().map(c -> c.contains("%s") ? String.format(c, path) : c).toList();
    }
}
