package io.caldera.core.loop;

import io.caldera.core.exception.LoopException;
import io.caldera.core.exception.LoopTimeoutException;
import java.time.Duration;
import java.util.logging.Logger;

/// Base of the loops that wait for data to arrive.
///
/// Each wait polls at a fixed interval until the subclass reports the data
/// ready or the timeout elapses. A sleep never overshoots the remaining time,
/// so a wait ends within one interval of its timeout.
abstract class PollingLoop implements DataLoop {

    private static final Logger logger = Logger.getLogger(PollingLoop.class.getName());

    protected final DataDirectory data;
    private final Duration pollInterval;
    private final Duration timeout;

    protected PollingLoop(DataDirectory data, Duration pollInterval, Duration timeout) {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("poll interval must be positive: " + pollInterval);
        }
        this.data = data;
        this.pollInterval = pollInterval;
        this.timeout = timeout;
    }

    /// Starts a wait. Call {@link Wait#pause()} between checks.
    protected Wait startWait(String target) {
        logger.info("Checking for next data file: " + target);
        return new Wait(target, System.nanoTime());
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /// One wait for one observation.
    protected final class Wait {
        private final String target;
        private final long started;

        private Wait(String target, long started) {
            this.target = target;
            this.started = started;
        }

        /// Sleeps for one poll interval, or less when the timeout is closer.
        ///
        /// @throws LoopTimeoutException if the timeout has elapsed
        /// @throws LoopException if the thread is interrupted; the interrupt flag is kept
        void pause() throws LoopException {
            long remaining = timeout.toNanos() - (System.nanoTime() - started);
            if (remaining <= 0) {
                throw timedOut();
            }
            long sleep = Math.min(pollInterval.toNanos(), remaining);
            try {
                Thread.sleep(sleep / 1_000_000L, (int) (sleep % 1_000_000L));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LoopException("Interrupted while waiting for " + target, e);
            }
            if (System.nanoTime() - started >= timeout.toNanos()) {
                throw timedOut();
            }
        }

        private LoopTimeoutException timedOut() {
            Duration waited = Duration.ofNanos(System.nanoTime() - started);
            return new LoopTimeoutException("Timeout whilst waiting for next data file: " + target, waited);
        }
    }
}
