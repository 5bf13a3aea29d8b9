package org.caureq.fleetcore.service.alerts;

import lombok.extern.slf4j.Slf4j;
import org.caureq.fleetcore.config.FleetProps;
import org.springframework.stereotype.Service;

/**
 * Runtime alert thresholds. Initialized from configuration and updateable via the thresholds API.
 */
@Service
@Slf4j
public class AlertConfigService {

    public record Thresholds(double cpuWarningPct, double cpuCriticalPct,
                             double memoryWarningPct, double memoryCriticalPct,
                             double diskWarningPct, double diskCriticalPct) {

        /** Warning and critical levels for a metric name, or null when the metric has no thresholds. */
        public double[] forMetric(String metric) {
            return switch (metric) {
                case "cpu_usage" -> new double[]{cpuWarningPct, cpuCriticalPct};
                case "memory_usage" -> new double[]{memoryWarningPct, memoryCriticalPct};
                case "disk_usage" -> new double[]{diskWarningPct, diskCriticalPct};
                default -> null;
            };
        }
    }

    private volatile Thresholds current = new Thresholds(80, 95, 80, 95, 85, 95);

    public AlertConfigService(FleetProps props) {
        var a = props.alerts();
        if (a != null) {
            current = new Thresholds(
                    nvl(a.cpuWarningPct(), current.cpuWarningPct()), nvl(a.cpuCriticalPct(), current.cpuCriticalPct()),
                    nvl(a.memoryWarningPct(), current.memoryWarningPct()), nvl(a.memoryCriticalPct(), current.memoryCriticalPct()),
                    nvl(a.diskWarningPct(), current.diskWarningPct()), nvl(a.diskCriticalPct(), current.diskCriticalPct()));
        }
        validate(current);
        log.info("[Alerts] thresholds {}", current);
    }

    public Thresholds get() { return current; }

    public synchronized Thresholds update(Double cpuWarn, Double cpuCrit, Double memWarn, Double memCrit,
                                          Double diskWarn, Double diskCrit) {
        var c = current;
        var next = new Thresholds(
                nvl(cpuWarn, c.cpuWarningPct()), nvl(cpuCrit, c.cpuCriticalPct()),
                nvl(memWarn, c.memoryWarningPct()), nvl(memCrit, c.memoryCriticalPct()),
                nvl(diskWarn, c.diskWarningPct()), nvl(diskCrit, c.diskCriticalPct()));
        validate(next);
        current = next;
        log.info("[Alerts] thresholds updated {}", next);
        return next;
    }

    private static void validate(Thresholds t) {
        check("cpu", t.cpuWarningPct(), t.cpuCriticalPct());
        check("memory", t.memoryWarningPct(), t.memoryCriticalPct());
        check("disk", t.diskWarningPct(), t.diskCriticalPct());
    }

    private static void check(String metric, double warn, double crit) {
        if (warn < 0 || crit > 100 || warn > crit) {
            throw new IllegalArgumentException(metric + " thresholds must satisfy 0 <= warning <= critical <= 100");
        }
    }

    private static double nvl(Double v, double dflt) { return v == null ? dflt : v; }
}
