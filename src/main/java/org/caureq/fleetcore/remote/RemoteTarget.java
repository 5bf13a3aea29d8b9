package org.caureq.fleetcore.remote;

/**
 * Where and how to reach a host. Exactly one of {@code password} / {@code privateKey} is normally set;
 * when both are present the key is tried first.
 */
public record RemoteTarget(String host, int port, String username, String password, String privateKey) {

    public RemoteTarget {
        if (host == null || host.isBlank()) throw new IllegalArgumentException("host is required");
        if (port <= 0) port = 22;
    }

    public boolean hasKey() { return privateKey != null && !privateKey.isBlank(); }

    public boolean hasPassword() { return password != null && !password.isEmpty(); }

    public String endpoint() { return host + ":" + port; }

    @Override
    public String toString() {
        return "RemoteTarget[" + username + "@" + endpoint() + "]";
    }
}
