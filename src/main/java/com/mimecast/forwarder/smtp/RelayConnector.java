package com.mimecast.forwarder.smtp;

import com.mimecast.forwarder.error.ConnectionException;

/**
 * Opens fresh relay sessions.
 */
@FunctionalInterface
public interface RelayConnector {

    /**
     * Connects and authenticates to the relay.
     *
     * @return RelaySession instance.
     * @throws ConnectionException Unable to connect or authenticate.
     */
    RelaySession connect() throws ConnectionException;
}
