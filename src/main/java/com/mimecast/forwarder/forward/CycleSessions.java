package com.mimecast.forwarder.forward;

import com.mimecast.forwarder.error.Endpoint;
import com.mimecast.forwarder.imap.MailboxSession;
import com.mimecast.forwarder.smtp.RelaySession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumSet;
import java.util.Set;

/**
 * Sessions owned by one cycle.
 *
 * <p>Either session may be replaced after a reconnect.
 * <br>Endpoints flagged after a failure are reconnected before the next attempt.
 */
class CycleSessions implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(CycleSessions.class);

    private MailboxSession mailbox;
    private RelaySession relay;
    private final Set<Endpoint> flagged = EnumSet.noneOf(Endpoint.class);

    MailboxSession getMailbox() {
        return mailbox;
    }

    /**
     * Sets the mailbox session, closing the one it replaces.
     *
     * @param session Mailbox session.
     */
    void replaceMailbox(MailboxSession session) {
        closeMailbox();
        mailbox = session;
        flagged.remove(Endpoint.MAILBOX);
    }

    RelaySession getRelay() {
        return relay;
    }

    /**
     * Sets the relay session, closing the one it replaces.
     *
     * @param session Relay session.
     */
    void replaceRelay(RelaySession session) {
        closeRelay();
        relay = session;
        flagged.remove(Endpoint.RELAY);
    }

    /**
     * Flags an endpoint for reconnect.
     *
     * @param endpoint Endpoint, null is ignored.
     */
    void flag(Endpoint endpoint) {
        if (endpoint != null) {
            flagged.add(endpoint);
        }
    }

    boolean isFlagged(Endpoint endpoint) {
        return flagged.contains(endpoint);
    }

    /**
     * Closes both sessions, best effort.
     */
    @Override
    public void close() {
        closeMailbox();
        closeRelay();
    }

    private void closeMailbox() {
        if (mailbox != null) {
            try {
                mailbox.close();
            } catch (RuntimeException e) {
                log.debug("Error closing mailbox session: {}", e.getMessage());
            }
            mailbox = null;
        }
    }

    private void closeRelay() {
        if (relay != null) {
            try {
                relay.close();
            } catch (RuntimeException e) {
                log.debug("Error closing relay session: {}", e.getMessage());
            }
            relay = null;
        }
    }
}
