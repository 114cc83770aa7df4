package com.mimecast.forwarder.forward;

import java.util.OptionalLong;

/**
 * Counts and watermark of one forwarding cycle.
 */
public class CycleResult {
    private final int listed;
    private final int forwarded;
    private final int degraded;
    private final int skipped;
    private final OptionalLong watermark;

    /**
     * Constructs a new CycleResult instance.
     *
     * @param listed    Candidates listed.
     * @param forwarded Candidates relayed, degraded ones included.
     * @param degraded  Candidates relayed without attachments.
     * @param skipped   Candidates skipped after exhausting attempts.
     * @param watermark Watermark after the cycle.
     */
    public CycleResult(int listed, int forwarded, int degraded, int skipped, OptionalLong watermark) {
        this.listed = listed;
        this.forwarded = forwarded;
        this.degraded = degraded;
        this.skipped = skipped;
        this.watermark = watermark;
    }

    public int getListed() {
        return listed;
    }

    /**
     * Gets number of messages relayed in this cycle.
     *
     * @return Integer.
     */
    public int getForwarded() {
        return forwarded;
    }

    public int getDegraded() {
        return degraded;
    }

    public int getSkipped() {
        return skipped;
    }

    public OptionalLong getWatermark() {
        return watermark;
    }

    @Override
    public String toString() {
        return "CycleResult{listed=" + listed +
                ", forwarded=" + forwarded +
                ", degraded=" + degraded +
                ", skipped=" + skipped +
                ", watermark=" + (watermark.isPresent() ? String.valueOf(watermark.getAsLong()) : "none") +
                "}";
    }
}
