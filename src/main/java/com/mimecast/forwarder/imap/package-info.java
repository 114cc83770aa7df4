/**
 * IMAP source mailbox.
 *
 * <p>{@link com.mimecast.forwarder.imap.MailboxSession} is the primitive contract and
 * {@link com.mimecast.forwarder.imap.ImapMailboxSession} implements it with Jakarta Mail.
 * <br>{@link com.mimecast.forwarder.imap.MailboxSource} lists candidates, fetches them and marks them seen.
 * <br>{@link com.mimecast.forwarder.imap.ChunkedFetcher} transfers large messages as bounded byte ranges.
 *
 * <p>Every fetch is a peek. A message is only ever marked seen after it was relayed.
 */
package com.mimecast.forwarder.imap;
