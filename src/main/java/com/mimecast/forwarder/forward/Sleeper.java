package com.mimecast.forwarder.forward;

import java.util.concurrent.TimeUnit;

/**
 * Blocking pause between attempts and candidates.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeps on the calling thread.
     */
    Sleeper SYSTEM = seconds -> {
        if (seconds > 0) {
            TimeUnit.SECONDS.sleep(seconds);
        }
    };

    /**
     * Pause for the given number of seconds.
     *
     * @param seconds Seconds, zero or less returns at once.
     * @throws InterruptedException Thread interrupted while sleeping.
     */
    void sleep(long seconds) throws InterruptedException;
}
