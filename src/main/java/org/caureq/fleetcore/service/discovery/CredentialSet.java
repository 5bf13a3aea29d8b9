package org.caureq.fleetcore.service.discovery;

import org.caureq.fleetcore.remote.RemoteTarget;

/** Candidate login tried against every scanned host. Held in memory for the scan only. */
public record CredentialSet(String username, String password, String privateKey, Integer port) {

    public RemoteTarget toTarget(String ip) {
        return new RemoteTarget(ip, port == null ? 22 : port, username, password, privateKey);
    }

    public void validate() {
        if (username == null || username.isBlank()) throw new IllegalArgumentException("credential set username is required");
        boolean hasPwd = password != null && !password.isEmpty();
        boolean hasKey = privateKey != null && !privateKey.isBlank();
        if (!hasPwd && !hasKey) throw new IllegalArgumentException("credential set for " + username + " needs a password or a private key");
        if (port != null && (port < 1 || port > 65535)) throw new IllegalArgumentException("port must be in 1..65535");
    }

    @Override
    public String toString() {
        return "CredentialSet[" + username + ":" + (port == null ? 22 : port) + "]";
    }
}
