package org.caureq.fleetcore.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

public record ResolveRequest(@JsonAlias("resolution_notes") String notes) {}
