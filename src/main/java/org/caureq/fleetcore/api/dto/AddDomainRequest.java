package org.caureq.fleetcore.api.dto;

import jakarta.validation.constraints.NotBlank;

public record AddDomainRequest(@NotBlank String customDomain, @NotBlank String targetSubdomain, Boolean sslEnabled) {}
