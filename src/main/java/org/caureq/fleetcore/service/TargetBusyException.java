package org.caureq.fleetcore.service;

import lombok.Getter;

/** An exclusive task is already pending or running against the target server. */
@Getter
public class TargetBusyException extends RuntimeException {
    private final Long serverId;

    public TargetBusyException(Long serverId) {
        super("server " + serverId + " already has an active deployment task");
        this.serverId = serverId;
    }
}
