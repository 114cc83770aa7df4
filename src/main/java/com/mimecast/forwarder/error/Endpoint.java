package com.mimecast.forwarder.error;

/**
 * The two remote sessions a cycle holds.
 */
public enum Endpoint {
    MAILBOX,
    RELAY
}
