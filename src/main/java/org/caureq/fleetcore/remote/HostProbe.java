package org.caureq.fleetcore.remote;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Gathers facts and utilisation from a host with a single round trip each. The scripts print
 * {@code key=value} lines so that a missing tool on the host leaves a blank value instead of
 * failing the whole probe.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HostProbe {
    static final String FACTS_SCRIPT = String.join("; ",
            "echo hostname=$(hostname)",
            "echo os_type=$(grep '^ID=' /etc/os-release 2>/dev/null | cut -d= -f2 | tr -d '\"')",
            "echo os_version=$(grep '^VERSION_ID=' /etc/os-release 2>/dev/null | cut -d= -f2 | tr -d '\"')",
            "echo cpu_cores=$(nproc 2>/dev/null)",
            "echo memory_gb=$(free -g | awk '/^Mem:/{print $2}')",
            "echo disk_gb=$(df -BG / | awk 'NR==2{gsub(/G/,\"\"); print $2}')");

    static final String USAGE_SCRIPT = String.join("; ",
            "echo cpu_usage=$(top -bn1 | grep 'Cpu(s)' | awk '{print $2}' | cut -d'%' -f1)",
            "echo memory_usage=$(free | grep Mem | awk '{printf \"%.1f\", $3/$2 * 100.0}')",
            "echo disk_usage=$(df / | tail -1 | awk '{print $5}' | cut -d'%' -f1)",
            "echo load_average=$(cut -d' ' -f1 /proc/loadavg 2>/dev/null)");

    private final RemoteExecutor remote;

    public SystemFacts probeFacts(RemoteTarget target, Duration timeout) {
        var kv = run(target, FACTS_SCRIPT, timeout);
        return new SystemFacts(
                blankToNull(kv.get("hostname")),
                blankToNull(kv.get("os_type")),
                blankToNull(kv.get("os_version")),
                toInt(kv.get("cpu_cores")),
                toInt(kv.get("memory_gb")),
                toInt(kv.get("disk_gb")));
    }

    public UsageSample sampleUsage(RemoteTarget target, Duration timeout) {
        var kv = run(target, USAGE_SCRIPT, timeout);
        return new UsageSample(
                pct(kv.get("cpu_usage")),
                pct(kv.get("memory_usage")),
                pct(kv.get("disk_usage")),
                toDbl(kv.get("load_average")));
    }

    private Map<String, String> run(RemoteTarget target, String script, Duration timeout) {
        ExecResult r = remote.exec(target, script, timeout);
        if (!r.ok()) {
            throw new ConnectivityException(ConnectivityException.Kind.PROTOCOL, target.host(),
                    "probe script failed on " + target.endpoint() + " (exit " + r.exitCode() + "): " + r.tail());
        }
        return parse(r.stdout());
    }

    static Map<String, String> parse(String stdout) {
        Map<String, String> out = new HashMap<>();
        if (stdout == null) return out;
        for (String line : stdout.split("\\R")) {
            int eq = line.indexOf('=');
            if (eq <= 0) continue;
            out.put(line.substring(0, eq).trim(), line.substring(eq + 1).trim());
        }
        return out;
    }

    private static String blankToNull(String s) { return s == null || s.isBlank() ? null : s; }

    private static Integer toInt(String s) {
        try { return s == null || s.isBlank() ? null : Integer.parseInt(s.trim()); } catch (NumberFormatException e) { return null; }
    }

    private static double toDbl(String s) {
        try { return s == null || s.isBlank() ? 0.0 : Double.parseDouble(s.trim().replace(',', '.')); } catch (NumberFormatException e) { return 0.0; }
    }

    private static double pct(String s) {
        return Math.max(0.0, Math.min(100.0, toDbl(s)));
    }
}
