package com.mimecast.forwarder.imap;

import com.mimecast.forwarder.error.ConnectionException;

/**
 * Opens fresh mailbox sessions.
 */
@FunctionalInterface
public interface MailboxConnector {

    /**
     * Authenticates and opens the configured folder read-write.
     *
     * @return MailboxSession instance.
     * @throws ConnectionException Unable to connect, authenticate or open the folder.
     */
    MailboxSession connect() throws ConnectionException;
}
