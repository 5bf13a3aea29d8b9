package org.caureq.fleetcore.domain;

public enum ServerStatus { ACTIVE, UNREACHABLE, DISABLED }
