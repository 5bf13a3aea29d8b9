package org.caureq.fleetcore.domain;

public enum AlertStatus { ACTIVE, ACKNOWLEDGED, RESOLVED }
