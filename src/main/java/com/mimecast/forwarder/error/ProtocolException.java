package com.mimecast.forwarder.error;

/**
 * A live mailbox session rejected a command or returned an unusable response.
 *
 * <p>Timeouts and dropped connections in the middle of a fetch also surface here.
 */
public class ProtocolException extends ForwardingException {

    /**
     * Constructs a new ProtocolException instance.
     *
     * @param message Message.
     */
    public ProtocolException(String message) {
        super(message);
    }

    /**
     * Constructs a new ProtocolException instance with cause.
     *
     * @param message Message.
     * @param cause   Cause.
     */
    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.PROTOCOL;
    }

    @Override
    public Endpoint getResetEndpoint() {
        return Endpoint.MAILBOX;
    }
}
