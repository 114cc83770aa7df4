package com.mimecast.forwarder.smtp;

import com.mimecast.forwarder.error.ConnectionException;
import com.mimecast.forwarder.error.DeliveryException;
import com.mimecast.forwarder.mime.ComposedMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Outbound relay.
 */
public class RelaySink {
    private static final Logger log = LogManager.getLogger(RelaySink.class);

    private final RelayConnector connector;

    /**
     * Constructs a new RelaySink instance.
     *
     * @param connector Session connector.
     */
    public RelaySink(RelayConnector connector) {
        this.connector = connector;
    }

    /**
     * Opens a fresh session.
     *
     * @return RelaySession instance.
     * @throws ConnectionException Unable to connect.
     */
    public RelaySession connect() throws ConnectionException {
        return connector.connect();
    }

    /**
     * Sends a composed message.
     *
     * @param session  Relay session.
     * @param composed Composed message.
     * @throws DeliveryException Relay refused the message.
     */
    public void send(RelaySession session, ComposedMessage composed) throws DeliveryException {
        session.send(composed.getMessage());
        log.debug("Relayed {} message: {}", composed.getFidelity(), composed.getOriginalSubject());
    }

    /**
     * Is session usable.
     *
     * @param session Relay session, may be null.
     * @return Boolean.
     */
    public boolean isConnected(RelaySession session) {
        return session != null && session.isConnected();
    }
}
