package org.caureq.fleetcore.api.error;
public enum ErrorCode {
    BAD_REQUEST, NOT_FOUND, DUPLICATE_SERVER, TARGET_BUSY, INVALID_TRANSITION,
    UNREACHABLE, AUTH_FAILED, TIMEOUT, PROTOCOL, AUTH_REQUIRED, INTERNAL_ERROR
}
