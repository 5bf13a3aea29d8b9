package org.caureq.fleetcore.remote;

/** Point-in-time utilisation, percentages in 0..100. */
public record UsageSample(double cpuUsage, double memoryUsage, double diskUsage, double loadAverage) {

    public double worst() {
        return Math.max(cpuUsage, Math.max(memoryUsage, diskUsage));
    }
}
