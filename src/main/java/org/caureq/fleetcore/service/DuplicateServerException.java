package org.caureq.fleetcore.service;

public class DuplicateServerException extends RuntimeException {
    public DuplicateServerException(String message) {
        super(message);
    }
}
