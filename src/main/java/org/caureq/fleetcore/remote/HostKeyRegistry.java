package org.caureq.fleetcore.remote;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Trust-on-first-use host key store. The first fingerprint seen for an endpoint is pinned
 * for the lifetime of the process; a different key afterwards is rejected.
 */
@Component
@Slf4j
public class HostKeyRegistry {
    private final Map<String, String> pinned = new ConcurrentHashMap<>();

    public boolean verify(String host, int port, String fingerprint) {
        String endpoint = host + ":" + port;
        String known = pinned.putIfAbsent(endpoint, fingerprint);
        if (known == null) {
            log.info("[SSH] pinned host key for {} ({})", endpoint, fingerprint);
            return true;
        }
        if (known.equals(fingerprint)) return true;
        log.error("[SSH] host key changed for {}: expected {} got {}", endpoint, known, fingerprint);
        return false;
    }

    public void forget(String host, int port) {
        pinned.remove(host + ":" + port);
    }
}
