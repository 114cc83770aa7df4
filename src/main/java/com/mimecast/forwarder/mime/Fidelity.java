package com.mimecast.forwarder.mime;

/**
 * Composition mode of a forwarded message.
 */
public enum Fidelity {
    /**
     * Body plus every named attachment.
     */
    FULL,

    /**
     * Body text only, attachments dropped with a notice.
     */
    DEGRADED
}
