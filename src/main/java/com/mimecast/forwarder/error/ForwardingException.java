package com.mimecast.forwarder.error;

/**
 * Base of the recoverable forwarding failures.
 *
 * <p>Each subclass reports its {@link FailureKind} so callers can branch on the kind
 * rather than on the exception class.
 *
 * @see ConnectionException
 * @see ProtocolException
 * @see DeliveryException
 * @see CompositionException
 */
public abstract class ForwardingException extends Exception {

    /**
     * Constructs a new ForwardingException instance.
     *
     * @param message Message.
     */
    protected ForwardingException(String message) {
        super(message);
    }

    /**
     * Constructs a new ForwardingException instance with cause.
     *
     * @param message Message.
     * @param cause   Cause.
     */
    protected ForwardingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Gets the failure kind.
     *
     * @return FailureKind.
     */
    public abstract FailureKind getKind();

    /**
     * Gets the endpoint whose session should be re-established before retrying, if any.
     *
     * @return Endpoint or null when no session needs resetting.
     */
    public abstract Endpoint getResetEndpoint();
}
