package org.caureq.fleetcore.service.discovery;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record DiscoveredMachine(String ip, String hostname, String osType, String osVersion,
                                Integer cpuCores, Integer memoryGb, Integer diskGb,
                                boolean reachable, boolean sshAccessible, String username, Integer port,
                                List<String> recommendedRoles, boolean autoSetupReady, String error) {

    /** Shape stored under {@code config.discovered_machines}. */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ip", ip);
        m.put("hostname", hostname);
        m.put("os_type", osType);
        m.put("os_version", osVersion);
        m.put("cpu_cores", cpuCores);
        m.put("memory_gb", memoryGb);
        m.put("disk_gb", diskGb);
        m.put("reachable", reachable);
        m.put("ssh_accessible", sshAccessible);
        m.put("username", username);
        m.put("port", port);
        m.put("recommended_roles", recommendedRoles);
        m.put("auto_setup_ready", autoSetupReady);
        if (error != null) m.put("error", error);
        return m;
    }
}
