package org.caureq.fleetcore.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.caureq.fleetcore.service.ServerRegistry;

import java.util.List;

public record AddServerRequest(
        @NotBlank @Size(max = 100) String name,
        @NotBlank String ipAddress,
        @Min(1) @Max(65535) Integer port,
        @NotBlank String username,
        String password,
        String privateKey,
        @JsonAlias("service_roles") List<String> roles) {

    public ServerRegistry.NewServer toNewServer() {
        return new ServerRegistry.NewServer(name, ipAddress, port, username, password, privateKey, roles);
    }
}
