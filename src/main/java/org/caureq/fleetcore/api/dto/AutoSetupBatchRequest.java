package org.caureq.fleetcore.api.dto;

import jakarta.validation.constraints.NotEmpty;
import org.caureq.fleetcore.service.discovery.NetworkDiscoveryService;

import java.util.List;

public record AutoSetupBatchRequest(@NotEmpty List<NetworkDiscoveryService.AutoSetupRequest> machines) {}
