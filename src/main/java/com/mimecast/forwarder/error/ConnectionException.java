package com.mimecast.forwarder.error;

/**
 * Session establishment or liveness failure on either endpoint.
 */
public class ConnectionException extends ForwardingException {
    private final Endpoint endpoint;

    /**
     * Constructs a new ConnectionException instance.
     *
     * @param endpoint Endpoint that failed.
     * @param message  Message.
     */
    public ConnectionException(Endpoint endpoint, String message) {
        super(message);
        this.endpoint = endpoint;
    }

    /**
     * Constructs a new ConnectionException instance with cause.
     *
     * @param endpoint Endpoint that failed.
     * @param message  Message.
     * @param cause    Cause.
     */
    public ConnectionException(Endpoint endpoint, String message, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
    }

    /**
     * Gets the endpoint that failed.
     *
     * @return Endpoint.
     */
    public Endpoint getEndpoint() {
        return endpoint;
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.CONNECTION;
    }

    @Override
    public Endpoint getResetEndpoint() {
        return endpoint;
    }
}
