package org.caureq.fleetcore.domain;

public enum TaskType {
    INSTALL(true), MIGRATE(true), BACKUP(false), NETWORK_SCAN(false), AUTO_SETUP(true);

    private final boolean exclusive;

    TaskType(boolean exclusive) { this.exclusive = exclusive; }

    /** Exclusive types hold the target for the whole run; at most one may be active per server. */
    public boolean exclusive() { return exclusive; }
}
