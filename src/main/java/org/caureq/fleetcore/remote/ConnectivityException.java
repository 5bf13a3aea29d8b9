package org.caureq.fleetcore.remote;

/** A host could not be reached or talked to. Retryable by the deployment step policy. */
public class ConnectivityException extends RuntimeException {

    public enum Kind { UNREACHABLE, AUTH_FAILED, TIMEOUT, PROTOCOL }

    private final Kind kind;
    private final String host;

    public ConnectivityException(Kind kind, String host, String message) {
        super(message);
        this.kind = kind;
        this.host = host;
    }

    public ConnectivityException(Kind kind, String host, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.host = host;
    }

    public Kind kind() { return kind; }
    public String host() { return host; }
}
