package com.mimecast.forwarder.error;

/**
 * Source bytes could not be turned into a structured message.
 */
public class CompositionException extends ForwardingException {

    /**
     * Constructs a new CompositionException instance.
     *
     * @param message Message.
     */
    public CompositionException(String message) {
        super(message);
    }

    /**
     * Constructs a new CompositionException instance with cause.
     *
     * @param message Message.
     * @param cause   Cause.
     */
    public CompositionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.COMPOSITION;
    }

    @Override
    public Endpoint getResetEndpoint() {
        return null;
    }
}
