package org.caureq.fleetcore.api.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record RolesRequest(@NotNull List<String> roles) {}
