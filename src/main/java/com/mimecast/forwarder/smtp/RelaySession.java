package com.mimecast.forwarder.smtp;

import com.mimecast.forwarder.error.DeliveryException;
import jakarta.mail.internet.MimeMessage;

/**
 * Authenticated session on the outbound relay.
 */
public interface RelaySession extends AutoCloseable {

    /**
     * Sends a message to its recipients.
     *
     * @param message Message to send.
     * @throws DeliveryException Authentication failure, refusal, size rejection or transport loss.
     */
    void send(MimeMessage message) throws DeliveryException;

    /**
     * Is session still connected.
     *
     * @return Boolean.
     */
    boolean isConnected();

    /**
     * Closes the transport.
     */
    @Override
    void close();
}
