package org.caureq.fleetcore.remote;

public record SystemFacts(String hostname, String osType, String osVersion,
                          Integer cpuCores, Integer memoryGb, Integer diskGb) {
}
