package com.mimecast.forwarder.mime;

import java.util.Arrays;

/**
 * Source message bytes as fetched for one attempt.
 *
 * <p>Either the complete message or, in degraded mode, the header block and the body text
 * fetched separately. Instances are never reused across attempts.
 */
public final class RawMessage {
    private final byte[] bytes;
    private final byte[] header;
    private final byte[] bodyText;

    private RawMessage(byte[] bytes, byte[] header, byte[] bodyText) {
        this.bytes = bytes;
        this.header = header;
        this.bodyText = bodyText;
    }

    /**
     * Complete message.
     *
     * @param bytes Message bytes.
     * @return RawMessage instance.
     */
    public static RawMessage full(byte[] bytes) {
        return new RawMessage(bytes.clone(), null, null);
    }

    /**
     * Header block and body text pair.
     *
     * @param header   Header bytes.
     * @param bodyText Body text bytes.
     * @return RawMessage instance.
     */
    public static RawMessage split(byte[] header, byte[] bodyText) {
        return new RawMessage(null, header.clone(), bodyText.clone());
    }

    /**
     * Checks if this is a header/text pair.
     *
     * @return Boolean.
     */
    public boolean isSplit() {
        return bytes == null;
    }

    /**
     * Gets complete message bytes.
     *
     * @return Byte array copy.
     * @throws IllegalStateException Called on a split message.
     */
    public byte[] getBytes() {
        if (isSplit()) {
            throw new IllegalStateException("Split message has no complete bytes");
        }
        return bytes.clone();
    }

    /**
     * Gets header bytes.
     *
     * @return Byte array copy.
     * @throws IllegalStateException Called on a complete message.
     */
    public byte[] getHeader() {
        if (!isSplit()) {
            throw new IllegalStateException("Complete message is not split");
        }
        return header.clone();
    }

    /**
     * Gets body text bytes.
     *
     * @return Byte array copy.
     * @throws IllegalStateException Called on a complete message.
     */
    public byte[] getBodyText() {
        if (!isSplit()) {
            throw new IllegalStateException("Complete message is not split");
        }
        return bodyText.clone();
    }

    /**
     * Gets total size in bytes.
     *
     * @return Size.
     */
    public int size() {
        return isSplit() ? header.length + bodyText.length : bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawMessage)) return false;
        RawMessage that = (RawMessage) o;
        return Arrays.equals(bytes, that.bytes) && Arrays.equals(header, that.header) && Arrays.equals(bodyText, that.bodyText);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(bytes);
        result = 31 * result + Arrays.hashCode(header);
        result = 31 * result + Arrays.hashCode(bodyText);
        return result;
    }
}
