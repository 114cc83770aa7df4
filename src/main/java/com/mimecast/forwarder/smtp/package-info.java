/**
 * SMTP relay.
 *
 * <p>{@link com.mimecast.forwarder.smtp.RelaySession} is the primitive contract and
 * {@link com.mimecast.forwarder.smtp.SmtpRelaySession} implements it with Jakarta Mail transports.
 * <br>{@link com.mimecast.forwarder.smtp.RelaySink} is what the orchestrator talks to.
 */
package com.mimecast.forwarder.smtp;
