package org.caureq.fleetcore.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.caureq.fleetcore.service.discovery.CredentialSet;

import java.util.List;

/** {@code {network_range, ssh_credentials: {credentials: [...]}}} */
public record ScanRequest(@NotBlank String networkRange, @NotNull @Valid SshCredentials sshCredentials) {

    public record SshCredentials(@NotEmpty List<CredentialSet> credentials) {}

    public List<CredentialSet> credentialSets() {
        return sshCredentials.credentials();
    }
}
