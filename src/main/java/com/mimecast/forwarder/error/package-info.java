/**
 * Recoverable failure taxonomy of the forwarding pipeline.
 *
 * <p>Four checked exceptions share {@link com.mimecast.forwarder.error.ForwardingException}:
 * <ul>
 *     <li><b>ConnectionException</b> - a session could not be established or went stale.</li>
 *     <li><b>ProtocolException</b> - the mailbox rejected a command.</li>
 *     <li><b>DeliveryException</b> - the relay refused to send.</li>
 *     <li><b>CompositionException</b> - the source bytes could not be parsed.</li>
 * </ul>
 *
 * <p>All of them are retried per message. Configuration problems are not part of this
 * taxonomy and are fatal at startup.
 */
package com.mimecast.forwarder.error;
