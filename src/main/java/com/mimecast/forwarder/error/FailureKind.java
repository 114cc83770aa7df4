package com.mimecast.forwarder.error;

/**
 * Kinds of recoverable failure a forwarding attempt can end with.
 *
 * <p>The orchestrator branches on these to decide whether to reconnect a session
 * before the next attempt.
 */
public enum FailureKind {
    CONNECTION,
    PROTOCOL,
    DELIVERY,
    COMPOSITION
}
