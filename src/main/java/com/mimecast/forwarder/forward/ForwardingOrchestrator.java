package com.mimecast.forwarder.forward;

import com.mimecast.forwarder.error.ConnectionException;
import com.mimecast.forwarder.error.Endpoint;
import com.mimecast.forwarder.error.ForwardingException;
import com.mimecast.forwarder.error.ProtocolException;
import com.mimecast.forwarder.imap.MailboxSource;
import com.mimecast.forwarder.metrics.ForwarderMetrics;
import com.mimecast.forwarder.mime.ComposedMessage;
import com.mimecast.forwarder.mime.Fidelity;
import com.mimecast.forwarder.mime.MessageComposer;
import com.mimecast.forwarder.mime.RawMessage;
import com.mimecast.forwarder.smtp.RelaySink;
import com.mimecast.forwarder.state.ProgressKey;
import com.mimecast.forwarder.state.ProgressStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;
import java.util.OptionalLong;
import java.util.function.BooleanSupplier;

/**
 * ForwardingOrchestrator runs forwarding cycles.
 * <p>One cycle:
 * <ul>
 *   <li>Loads the watermark and lists unseen candidates</li>
 *   <li>Connects the relay only when there is something to send</li>
 *   <li>Tries every candidate up to the maximum attempts, the last one degraded</li>
 *   <li>Reconnects whichever session a failure points at before the next attempt</li>
 *   <li>Raises the watermark after every resolution, forwarded or skipped</li>
 * </ul>
 * <p>One candidate running out of attempts never aborts the cycle.
 * <br>Connecting, listing or writing the watermark failing outside the candidate loop does.
 * <p>A message sent but not marked seen may be sent again next cycle.
 */
public class ForwardingOrchestrator {
    private static final Logger log = LogManager.getLogger(ForwardingOrchestrator.class);

    private final MailboxSource source;
    private final MessageComposer composer;
    private final RelaySink sink;
    private final ProgressStore store;
    private final ProgressKey key;

    private int maxAttempts = 3;
    private long retryBackoffSeconds = 2;
    private long messageDelaySeconds = 3;
    private Sleeper sleeper = Sleeper.SYSTEM;
    private BooleanSupplier stopSignal = () -> false;

    /**
     * Constructs a new ForwardingOrchestrator instance.
     *
     * @param source   Mailbox source.
     * @param composer Message composer.
     * @param sink     Relay sink.
     * @param store    Progress store.
     * @param key      Progress key.
     */
    public ForwardingOrchestrator(MailboxSource source, MessageComposer composer, RelaySink sink, ProgressStore store, ProgressKey key) {
        this.source = source;
        this.composer = composer;
        this.sink = sink;
        this.store = store;
        this.key = key;
    }

    /**
     * Sets attempts per candidate.
     *
     * @param maxAttempts Attempts, at least 1.
     * @return Self.
     */
    public ForwardingOrchestrator setMaxAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        return this;
    }

    /**
     * Sets sleep after a failed attempt.
     *
     * @param retryBackoffSeconds Seconds.
     * @return Self.
     */
    public ForwardingOrchestrator setRetryBackoffSeconds(long retryBackoffSeconds) {
        this.retryBackoffSeconds = retryBackoffSeconds;
        return this;
    }

    /**
     * Sets sleep between candidates.
     *
     * @param messageDelaySeconds Seconds.
     * @return Self.
     */
    public ForwardingOrchestrator setMessageDelaySeconds(long messageDelaySeconds) {
        this.messageDelaySeconds = messageDelaySeconds;
        return this;
    }

    /**
     * Sets sleeper.
     *
     * @param sleeper Sleeper.
     * @return Self.
     */
    public ForwardingOrchestrator setSleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
        return this;
    }

    /**
     * Sets stop signal, checked between candidates.
     *
     * @param stopSignal Returns true when the cycle should end.
     * @return Self.
     */
    public ForwardingOrchestrator setStopSignal(BooleanSupplier stopSignal) {
        this.stopSignal = stopSignal;
        return this;
    }

    /**
     * Runs one cycle.
     *
     * @return CycleResult instance.
     * @throws ForwardingException Initial connect or listing failed.
     * @throws IOException         Unable to read or write the watermark.
     */
    public CycleResult runCycle() throws ForwardingException, IOException {
        try {
            CycleResult result = cycle();
            ForwarderMetrics.incrementCycle(true);
            return result;
        } catch (ForwardingException | IOException | RuntimeException e) {
            ForwarderMetrics.incrementCycle(false);
            throw e;
        }
    }

    private CycleResult cycle() throws ForwardingException, IOException {
        OptionalLong watermark = store.getWatermark(key);
        log.info("Cycle start: key={}, watermark={}", key, watermark.isPresent() ? watermark.getAsLong() : "none");

        try (CycleSessions sessions = new CycleSessions()) {
            sessions.replaceMailbox(source.connect());

            List<Long> uids = source.listUnseen(sessions.getMailbox());
            if (uids.isEmpty()) {
                log.info("No unseen messages");
                return new CycleResult(0, 0, 0, 0, watermark);
            }
            log.info("Found {} unseen message(s)", uids.size());

            sessions.replaceRelay(sink.connect());

            int forwarded = 0;
            int degraded = 0;
            int skipped = 0;

            try {
                for (int i = 0; i < uids.size(); i++) {
                    if (i > 0) {
                        if (stopSignal.getAsBoolean()) {
                            log.info("Stop requested, ending cycle after {} of {} candidate(s)", i, uids.size());
                            break;
                        }
                        sleeper.sleep(messageDelaySeconds);
                    }

                    long uid = uids.get(i);
                    AttemptResult result = forward(sessions, uid);
                    watermark = OptionalLong.of(store.advance(key, uid));

                    if (result.isSuccess()) {
                        forwarded++;
                        if (result.getFidelity() == Fidelity.DEGRADED) {
                            degraded++;
                        }
                        ForwarderMetrics.incrementForwarded(result.getFidelity() == Fidelity.DEGRADED);
                        log.info("Forwarded UID {} on attempt {} ({})", uid, result.getAttempt(), result.getFidelity());
                    } else {
                        skipped++;
                        ForwarderMetrics.incrementSkipped();
                        log.info("Skipped UID {} after {} attempt(s), last failure {}: {}",
                                uid, result.getAttempt(), result.getKind(), result.getFailure().getMessage());
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Interrupted, ending cycle");
            }

            CycleResult result = new CycleResult(uids.size(), forwarded, degraded, skipped, watermark);
            log.info("Cycle finished: {}", result);
            return result;
        }
    }

    /**
     * Runs the attempt loop of one candidate until it is forwarded or out of attempts.
     *
     * @param sessions Cycle sessions.
     * @param uid      Candidate UID.
     * @return Successful result or the last failed one.
     * @throws InterruptedException Interrupted during backoff.
     */
    AttemptResult forward(CycleSessions sessions, long uid) throws InterruptedException {
        AttemptState state = new AttemptState(uid, maxAttempts);
        AttemptResult result;

        do {
            result = attempt(sessions, state);
            if (result.isSuccess()) {
                return result;
            }

            ForwardingException failure = result.getFailure();
            log.warn("Attempt {}/{} for UID {} failed: fidelity={}, kind={}, error={}",
                    state.getAttempt(), maxAttempts, uid, result.getFidelity(), failure.getKind(), failure.getMessage());
            ForwarderMetrics.incrementAttemptFailed(failure.getKind());

            sessions.flag(failure.getResetEndpoint());
            state.recordFailure(failure);
            sleeper.sleep(retryBackoffSeconds);
        } while (!state.isExhausted());

        return result;
    }

    /**
     * Single attempt at the state's current fidelity.
     */
    private AttemptResult attempt(CycleSessions sessions, AttemptState state) {
        long uid = state.getUid();
        Fidelity fidelity = state.getFidelity();

        try {
            ensureSessions(sessions);

            ComposedMessage composed;
            if (fidelity == Fidelity.FULL) {
                RawMessage raw = source.fetchFull(sessions.getMailbox(), uid);
                composed = composer.composeFull(raw);
            } else {
                RawMessage raw = source.fetchHeaderAndText(sessions.getMailbox(), uid);
                composed = composer.composeDegraded(raw.getHeader(), raw.getBodyText());
            }

            sink.send(sessions.getRelay(), composed);

        } catch (ForwardingException e) {
            return AttemptResult.failure(state.getAttempt(), fidelity, e);
        }

        try {
            source.markResolved(sessions.getMailbox(), uid);
        } catch (ConnectionException | ProtocolException e) {
            log.warn("UID {} was sent but could not be marked seen, it may be forwarded again: {}", uid, e.getMessage());
            sessions.flag(Endpoint.MAILBOX);
        }

        return AttemptResult.success(state.getAttempt(), fidelity);
    }

    /**
     * Reconnects sessions that are flagged or no longer usable.
     */
    private void ensureSessions(CycleSessions sessions) throws ConnectionException {
        if (sessions.isFlagged(Endpoint.MAILBOX) || !source.isAlive(sessions.getMailbox())) {
            log.info("Reconnecting mailbox session");
            sessions.replaceMailbox(null);
            sessions.replaceMailbox(source.connect());
        }

        if (sessions.isFlagged(Endpoint.RELAY) || !sink.isConnected(sessions.getRelay())) {
            log.info("Reconnecting relay session");
            sessions.replaceRelay(null);
            sessions.replaceRelay(sink.connect());
        }
    }
}
