package org.caureq.fleetcore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "fleet")
public record FleetProps(String apiKey, RemoteProps remote, RegistryProps registry, DeployProps deploy,
                         DiscoveryProps discovery, MonitorProps monitor, AlertsProps alerts) {

    /** Timeouts for every RemoteExecutor call; connect and per-command budgets are distinct. */
    public record RemoteProps(Duration connectTimeout, Duration commandTimeout, Duration probeTimeout) {}

    public record RegistryProps(boolean verifyOnAdd) {}

    /** Worker pool width and the connectivity retry policy applied to deployment steps. */
    public record DeployProps(int workers, int stepRetries, Duration retryBackoff, int recentLimit) {}

    public record DiscoveryProps(int parallelism, int maxHosts,
                                 int minCpuCores, int minMemoryGb, int minDiskGb) {}

    public record MonitorProps(boolean enabled, long intervalMs, long initialDelayMs, int parallelism) {}

    /** Initial alert thresholds (percent); runtime changes go through AlertConfigService. */
    public record AlertsProps(Double cpuWarningPct, Double cpuCriticalPct,
                              Double memoryWarningPct, Double memoryCriticalPct,
                              Double diskWarningPct, Double diskCriticalPct) {}
}
