package org.caureq.fleetcore.domain;

public enum AlertSeverity { CRITICAL, WARNING, INFO }
