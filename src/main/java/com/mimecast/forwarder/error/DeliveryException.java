package com.mimecast.forwarder.error;

/**
 * The outbound transport refused the message.
 *
 * <p>Covers authentication failure, recipient or message refusal and size rejection.
 */
public class DeliveryException extends ForwardingException {

    /**
     * Constructs a new DeliveryException instance.
     *
     * @param message Message.
     */
    public DeliveryException(String message) {
        super(message);
    }

    /**
     * Constructs a new DeliveryException instance with cause.
     *
     * @param message Message.
     * @param cause   Cause.
     */
    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.DELIVERY;
    }

    @Override
    public Endpoint getResetEndpoint() {
        return Endpoint.RELAY;
    }
}
