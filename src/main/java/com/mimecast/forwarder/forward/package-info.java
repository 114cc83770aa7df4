/**
 * Forwarding cycle.
 *
 * <p>{@link com.mimecast.forwarder.forward.ForwardingOrchestrator} drives one cycle:
 * list unseen candidates, then fetch, compose and relay each of them with retries.
 *
 * <p>Per candidate:
 * <ul>
 *     <li>Attempts before the last fetch the complete message in chunks and keep attachments.</li>
 *     <li>The last attempt fetches header and text only and omits attachments.</li>
 *     <li>A failure flags the session it points at for reconnect and sleeps the backoff.</li>
 *     <li>Forwarded or skipped, the watermark is raised to the candidate UID.</li>
 * </ul>
 *
 * <p>All pauses go through {@link com.mimecast.forwarder.forward.Sleeper}.
 */
package com.mimecast.forwarder.forward;
