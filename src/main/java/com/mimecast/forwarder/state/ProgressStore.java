package com.mimecast.forwarder.state;

import java.io.IOException;
import java.util.OptionalLong;

/**
 * Persists one watermark per progress key.
 *
 * <p>Implementations must never lower a stored watermark.
 */
public interface ProgressStore {

    /**
     * Gets the stored watermark.
     *
     * @param key Progress key.
     * @return Watermark or empty if nothing was resolved yet.
     * @throws IOException Unable to read the store.
     */
    OptionalLong getWatermark(ProgressKey key) throws IOException;

    /**
     * Raises the watermark to the given identifier if it is higher than the stored one.
     * <p>The change is durable when this method returns.
     *
     * @param key Progress key.
     * @param uid Resolved identifier.
     * @return Watermark after the call.
     * @throws IOException Unable to write the store.
     */
    long advance(ProgressKey key, long uid) throws IOException;
}
