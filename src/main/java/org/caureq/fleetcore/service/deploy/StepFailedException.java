package org.caureq.fleetcore.service.deploy;

/** A step ran but did not succeed (non-zero exit, failed check). Not retried. */
public class StepFailedException extends RuntimeException {
    public StepFailedException(String message) {
        super(message);
    }
}
