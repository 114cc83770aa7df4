/**
 * Composition of outbound forwards.
 *
 * <p>Source messages arrive as {@link com.mimecast.forwarder.mime.RawMessage} bytes, either complete
 * or split into header block and body text.
 * <br>{@link com.mimecast.forwarder.mime.MessageComposer} turns them into a ready to send
 * {@link com.mimecast.forwarder.mime.ComposedMessage} at one of two {@link com.mimecast.forwarder.mime.Fidelity} levels.
 * <br>{@link com.mimecast.forwarder.mime.HeaderDecoder} decodes RFC 2047 encoded words in subjects,
 * senders and attachment file names.
 */
package com.mimecast.forwarder.mime;
