package com.mimecast.forwarder.forward;

import com.mimecast.forwarder.error.ForwardingException;
import com.mimecast.forwarder.mime.Fidelity;

/**
 * Retry state of one candidate.
 *
 * <p>The attempt counter starts at 1. Attempts before the last one are full fidelity,
 * the last one is degraded. The state is exhausted once the counter passes the maximum.
 */
public class AttemptState {
    private final long uid;
    private final int maxAttempts;
    private int attempt = 1;
    private ForwardingException lastFailure;

    /**
     * Constructs a new AttemptState instance.
     *
     * @param uid         Candidate UID.
     * @param maxAttempts Maximum attempts, at least 1.
     */
    public AttemptState(long uid, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1: " + maxAttempts);
        }
        this.uid = uid;
        this.maxAttempts = maxAttempts;
    }

    public long getUid() {
        return uid;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Gets current attempt number.
     *
     * @return Integer starting at 1.
     */
    public int getAttempt() {
        return attempt;
    }

    /**
     * Gets fidelity of the current attempt.
     *
     * @return DEGRADED on the last attempt, otherwise FULL.
     */
    public Fidelity getFidelity() {
        return attempt >= maxAttempts ? Fidelity.DEGRADED : Fidelity.FULL;
    }

    /**
     * Gets the failure of the previous attempt.
     *
     * @return ForwardingException or null.
     */
    public ForwardingException getLastFailure() {
        return lastFailure;
    }

    /**
     * Records a failure and moves to the next attempt.
     *
     * @param failure Failure.
     * @return Self.
     */
    public AttemptState recordFailure(ForwardingException failure) {
        this.lastFailure = failure;
        attempt++;
        return this;
    }

    /**
     * Are all attempts used up.
     *
     * @return Boolean.
     */
    public boolean isExhausted() {
        return attempt > maxAttempts;
    }
}
