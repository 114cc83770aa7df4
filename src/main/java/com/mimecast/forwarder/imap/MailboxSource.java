package com.mimecast.forwarder.imap;

import com.mimecast.forwarder.error.ConnectionException;
import com.mimecast.forwarder.error.ProtocolException;
import com.mimecast.forwarder.mime.RawMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Source of candidate messages.
 *
 * <p>Layers listing, fetch and resolution on top of {@link MailboxSession} primitives.
 * <br>Sessions are handed in by the caller so reconnecting is the caller's decision.
 */
public class MailboxSource {
    private static final Logger log = LogManager.getLogger(MailboxSource.class);

    private final MailboxConnector connector;
    private final ChunkedFetcher fetcher;

    /**
     * Constructs a new MailboxSource instance.
     *
     * @param connector Session connector.
     * @param fetcher   Chunked fetcher.
     */
    public MailboxSource(MailboxConnector connector, ChunkedFetcher fetcher) {
        this.connector = connector;
        this.fetcher = fetcher;
    }

    /**
     * Opens a fresh session.
     * <p>The caller closes any session it replaces.
     *
     * @return MailboxSession instance.
     * @throws ConnectionException Unable to connect.
     */
    public MailboxSession connect() throws ConnectionException {
        return connector.connect();
    }

    /**
     * Lists unseen UIDs in server order without duplicates.
     *
     * @param session Mailbox session.
     * @return List of UIDs.
     * @throws ConnectionException Session lost.
     * @throws ProtocolException   Search rejected.
     */
    public List<Long> listUnseen(MailboxSession session) throws ConnectionException, ProtocolException {
        List<Long> found = session.searchUnseen();
        List<Long> uids = new ArrayList<>(new LinkedHashSet<>(found));

        if (uids.size() != found.size()) {
            log.debug("Dropped {} duplicate UID(s) from listing", found.size() - uids.size());
        }
        return uids;
    }

    /**
     * Fetches the complete message in chunks.
     *
     * @param session Mailbox session.
     * @param uid     Message UID.
     * @return Full RawMessage.
     * @throws ConnectionException Session lost.
     * @throws ProtocolException   Fetch failed.
     */
    public RawMessage fetchFull(MailboxSession session, long uid) throws ConnectionException, ProtocolException {
        return fetcher.fetch(session, uid);
    }

    /**
     * Fetches header block and body text in a single request.
     *
     * @param session Mailbox session.
     * @param uid     Message UID.
     * @return Split RawMessage.
     * @throws ConnectionException Session lost.
     * @throws ProtocolException   Fetch failed.
     */
    public RawMessage fetchHeaderAndText(MailboxSession session, long uid) throws ConnectionException, ProtocolException {
        return session.fetchHeaderAndText(uid);
    }

    /**
     * Marks a message as seen once it has been sent.
     *
     * @param session Mailbox session.
     * @param uid     Message UID.
     * @throws ConnectionException Session lost.
     * @throws ProtocolException   Store rejected.
     */
    public void markResolved(MailboxSession session, long uid) throws ConnectionException, ProtocolException {
        session.markSeen(uid);
    }

    /**
     * Probes a session.
     *
     * @param session Mailbox session, may be null.
     * @return Boolean.
     */
    public boolean isAlive(MailboxSession session) {
        return session != null && session.isAlive();
    }
}
