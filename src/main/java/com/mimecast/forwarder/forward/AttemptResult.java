package com.mimecast.forwarder.forward;

import com.mimecast.forwarder.error.FailureKind;
import com.mimecast.forwarder.error.ForwardingException;
import com.mimecast.forwarder.mime.Fidelity;

/**
 * Outcome of one forwarding attempt.
 * <p>Either a success at a given fidelity or a failure carrying its typed exception.
 */
public class AttemptResult {
    private final int attempt;
    private final Fidelity fidelity;
    private final ForwardingException failure;

    private AttemptResult(int attempt, Fidelity fidelity, ForwardingException failure) {
        this.attempt = attempt;
        this.fidelity = fidelity;
        this.failure = failure;
    }

    /**
     * Successful attempt.
     *
     * @param attempt  Attempt number.
     * @param fidelity Fidelity used.
     * @return AttemptResult instance.
     */
    public static AttemptResult success(int attempt, Fidelity fidelity) {
        return new AttemptResult(attempt, fidelity, null);
    }

    /**
     * Failed attempt.
     *
     * @param attempt  Attempt number.
     * @param fidelity Fidelity used.
     * @param failure  Failure.
     * @return AttemptResult instance.
     */
    public static AttemptResult failure(int attempt, Fidelity fidelity, ForwardingException failure) {
        return new AttemptResult(attempt, fidelity, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public int getAttempt() {
        return attempt;
    }

    public Fidelity getFidelity() {
        return fidelity;
    }

    /**
     * Gets failure.
     *
     * @return ForwardingException or null on success.
     */
    public ForwardingException getFailure() {
        return failure;
    }

    /**
     * Gets failure kind.
     *
     * @return FailureKind or null on success.
     */
    public FailureKind getKind() {
        return failure != null ? failure.getKind() : null;
    }
}
