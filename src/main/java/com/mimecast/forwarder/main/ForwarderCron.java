package com.mimecast.forwarder.main;

import com.mimecast.forwarder.error.ForwardingException;
import com.mimecast.forwarder.forward.CycleResult;
import com.mimecast.forwarder.forward.ForwardingOrchestrator;
import com.mimecast.forwarder.metrics.ForwarderMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Forwarder cron job.
 * <p>Runs forwarding cycles one after another with the poll interval between the end of
 * one cycle and the start of the next.
 * <p>A failing cycle is logged and the next one runs as scheduled.
 * <p>Stopping lets the current candidate resolve before the cycle ends.
 */
public class ForwarderCron {
    private static final Logger log = LogManager.getLogger(ForwarderCron.class);

    private final ForwardingOrchestrator orchestrator;
    private final long intervalSeconds;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicLong cycles = new AtomicLong();

    private volatile ScheduledExecutorService scheduler;

    /**
     * Constructs a new ForwarderCron instance.
     *
     * @param orchestrator    Orchestrator.
     * @param intervalSeconds Delay between cycles.
     */
    public ForwarderCron(ForwardingOrchestrator orchestrator, long intervalSeconds) {
        this.orchestrator = orchestrator.setStopSignal(stopped::get);
        this.intervalSeconds = intervalSeconds;
    }

    /**
     * Runs a single cycle.
     *
     * @return CycleResult instance.
     * @throws ForwardingException Cycle aborted on a session failure.
     * @throws IOException         Cycle aborted on a state failure.
     */
    public CycleResult runOnce() throws ForwardingException, IOException {
        try {
            return orchestrator.runCycle();
        } finally {
            cycles.incrementAndGet();
            logTotals();
        }
    }

    /**
     * Starts the schedule.
     * <p>The first cycle runs at once.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return; // Already running.
        }

        scheduler = Executors.newSingleThreadScheduledExecutor();

        Runnable task = () -> {
            if (stopped.get()) {
                return;
            }

            try {
                runOnce();
            } catch (Exception e) {
                log.error("ForwarderCron cycle aborted: {}", e.getMessage(), e);
            }
        };

        scheduler.scheduleWithFixedDelay(task, 0, intervalSeconds, TimeUnit.SECONDS);
        log.info("ForwarderCron scheduled: intervalSeconds={}", intervalSeconds);
    }

    /**
     * Runs until stopped.
     * <p>A JVM shutdown hook stops the schedule and waits for the running cycle.
     *
     * @throws InterruptedException Calling thread interrupted while waiting.
     */
    public void runForever() throws InterruptedException {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("ForwarderCron shutdown initiated");
            stop();
            try {
                awaitTermination(intervalSeconds + 60, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));

        start();
        while (!awaitTermination(1, TimeUnit.HOURS)) {
            log.trace("ForwarderCron still running");
        }
    }

    /**
     * Signals the running cycle to end and shuts the schedule down.
     */
    public void stop() {
        stopped.set(true);
        if (scheduler != null) {
            scheduler.shutdown();
            log.debug("Scheduler shutdown requested");
        }
    }

    /**
     * Waits for the schedule to terminate after {@link #stop()}.
     *
     * @param timeout Timeout.
     * @param unit    Unit.
     * @return True if terminated.
     * @throws InterruptedException Interrupted while waiting.
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        ScheduledExecutorService executor = scheduler;
        return executor == null || executor.awaitTermination(timeout, unit);
    }

    /**
     * Is stop requested.
     *
     * @return Boolean.
     */
    public boolean isStopped() {
        return stopped.get();
    }

    /**
     * Gets number of cycles run so far, aborted ones included.
     *
     * @return Long.
     */
    public long getCycles() {
        return cycles.get();
    }

    private void logTotals() {
        log.info("Totals: cycles={}, forwarded={}, degraded={}, skipped={}, failedAttempts={}",
                cycles.get(),
                (long) ForwarderMetrics.total(ForwarderMetrics.FORWARDED),
                (long) ForwarderMetrics.total(ForwarderMetrics.DEGRADED),
                (long) ForwarderMetrics.total(ForwarderMetrics.SKIPPED),
                (long) ForwarderMetrics.total(ForwarderMetrics.ATTEMPTS_FAILED));
    }
}
