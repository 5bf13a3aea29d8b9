package org.caureq.fleetcore.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.caureq.fleetcore.service.ServerRegistry;

import java.util.List;

public record TestConnectionRequest(
        @NotBlank String ipAddress,
        @Min(1) @Max(65535) Integer port,
        @NotBlank String username,
        String password,
        String privateKey) {

    public ServerRegistry.NewServer toNewServer() {
        return new ServerRegistry.NewServer("connection-test", ipAddress, port, username, password, privateKey, List.of());
    }
}
