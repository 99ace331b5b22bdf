package io.dhtprobe.runtime;

import io.dhtprobe.error.SettleTimeoutException;
import io.dhtprobe.network.ProbeSession;
import io.dhtprobe.network.RecordHandle;
import io.dhtprobe.network.SubkeyRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Polls propagation status of a freshly written record until no subkey is
 * reported offline, giving up after a fixed number of polls.
 */
public final class SettleWaiter {
    private static final Logger LOG = LoggerFactory.getLogger(SettleWaiter.class);

    private final Duration pollInterval;
    private final int maxAttempts;
    private final Clock clock;
    private final Sleeper sleeper;

    public SettleWaiter(Duration pollInterval, int maxAttempts, Clock clock) {
        this(pollInterval, maxAttempts, clock, duration -> Thread.sleep(duration.toMillis()));
    }

    SettleWaiter(Duration pollInterval, int maxAttempts, Clock clock, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        this.pollInterval = pollInterval.isNegative() ? Duration.ZERO : pollInterval;
        this.maxAttempts = maxAttempts;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * @return seconds elapsed until the record reported zero offline subkeys
     * @throws SettleTimeoutException when the record is still offline after the last poll
     */
    public double awaitSettled(ProbeSession session, RecordHandle handle) {
        double started = Unixtime.now(clock);
        long offline = -1L;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            List<SubkeyRange> ranges = session.inspectPropagation(handle);
            offline = SubkeyRange.totalCount(ranges);
            if (offline == 0L) {
                double elapsed = Unixtime.now(clock) - started;
                LOG.debug("Record {} settled after {} polls ({}s)", handle.recordKey(), attempt, elapsed);
                return elapsed;
            }
            if (attempt < maxAttempts && !pollInterval.isZero()) {
                try {
                    sleeper.sleep(pollInterval);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SettleTimeoutException(handle.recordKey(), attempt, e);
                }
            }
        }
        throw new SettleTimeoutException(handle.recordKey(), maxAttempts, offline);
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
