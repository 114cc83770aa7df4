package com.mimecast.forwarder.imap;

import com.mimecast.forwarder.error.ConnectionException;
import com.mimecast.forwarder.error.ProtocolException;
import com.mimecast.forwarder.mime.RawMessage;

import java.util.List;

/**
 * Authenticated session on the source folder.
 *
 * <p>Primitive IMAP operations addressed by UID.
 * <br>All fetches are peeks and must never set the seen flag.
 * <br>Transport loss surfaces as {@link ConnectionException}, a rejected command as {@link ProtocolException}.
 */
public interface MailboxSession extends AutoCloseable {

    /**
     * Searches the folder for messages without the seen flag.
     *
     * @return UIDs in server order.
     * @throws ConnectionException Session lost.
     * @throws ProtocolException   Search rejected.
     */
    List<Long> searchUnseen() throws ConnectionException, ProtocolException;

    /**
     * Gets the reported RFC822.SIZE of a message.
     *
     * @param uid Message UID.
     * @return Size in bytes or -1 if the server did not report one.
     * @throws ConnectionException Session lost.
     * @throws ProtocolException   Fetch rejected.
     */
    long fetchSize(long uid) throws ConnectionException, ProtocolException;

    /**
     * Fetches a byte range of the full message.
     *
     * @param uid    Message UID.
     * @param offset Offset of the first byte.
     * @param length Maximum number of bytes.
     * @return Bytes returned by the server, possibly fewer than requested.
     * @throws ConnectionException Session lost.
     * @throws ProtocolException   Fetch rejected.
     */
    byte[] fetchRange(long uid, long offset, int length) throws ConnectionException, ProtocolException;

    /**
     * Fetches the full message in one unbounded request.
     *
     * @param uid Message UID.
     * @return Message bytes.
     * @throws ConnectionException Session lost.
     * @throws ProtocolException   Fetch rejected.
     */
    byte[] fetchWhole(long uid) throws ConnectionException, ProtocolException;

    /**
     * Fetches the header block and body text of a message in one request.
     *
     * @param uid Message UID.
     * @return Split RawMessage.
     * @throws ConnectionException Session lost.
     * @throws ProtocolException   Fetch rejected.
     */
    RawMessage fetchHeaderAndText(long uid) throws ConnectionException, ProtocolException;

    /**
     * Sets the seen flag.
     *
     * @param uid Message UID.
     * @throws ConnectionException Session lost.
     * @throws ProtocolException   Store rejected.
     */
    void markSeen(long uid) throws ConnectionException, ProtocolException;

    /**
     * Probes the session with a no-op round trip.
     *
     * @return Boolean.
     */
    boolean isAlive();

    /**
     * Closes folder and store.
     */
    @Override
    void close();
}
