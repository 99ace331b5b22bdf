package io.dhtprobe.runtime;

import io.dhtprobe.error.SettleTimeoutException;
import io.dhtprobe.network.InMemoryNetworkProbeClient;
import io.dhtprobe.network.ProbeSession;
import io.dhtprobe.network.RecordHandle;
import io.dhtprobe.network.SubkeyRange;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

final class SettleWaiterTest {

    @Test
    void returnsOnceNoSubkeyIsOffline() {
        MutableClock clock = MutableClock.atEpochSecond(1_700_000_000L);
        List<Duration> sleeps = new ArrayList<>();
        SettleWaiter waiter = new SettleWaiter(Duration.ofSeconds(1), 10, clock, d -> {
            sleeps.add(d);
            clock.advance(d);
        });
        InMemoryNetworkProbeClient network = new InMemoryNetworkProbeClient().settleAfterPolls(3);

        double elapsed;
        try (ProbeSession session = network.connect()) {
            RecordHandle handle = session.createRecord(1);
            elapsed = waiter.awaitSettled(session, handle);
        }

        Assertions.assertEquals(4, network.inspections.get());
        Assertions.assertEquals(3, sleeps.size());
        Assertions.assertEquals(3.0d, elapsed);
    }

    @Test
    void givesUpAfterMaxAttempts() {
        MutableClock clock = MutableClock.atEpochSecond(1_700_000_000L);
        SettleWaiter waiter = new SettleWaiter(Duration.ofMillis(1), 5, clock, clock::advance);
        InMemoryNetworkProbeClient network = new InMemoryNetworkProbeClient().settleAfterPolls(-1);

        try (ProbeSession session = network.connect()) {
            RecordHandle handle = session.createRecord(1);
            SettleTimeoutException e = Assertions.assertThrows(
                    SettleTimeoutException.class,
                    () -> waiter.awaitSettled(session, handle)
            );
            Assertions.assertEquals(5, e.attempts());
            Assertions.assertEquals(handle.recordKey(), e.recordKey());
        }
        Assertions.assertEquals(5, network.inspections.get());
    }

    @Test
    void interruptedWaitSurfacesAsTimeoutAndKeepsInterruptFlag() {
        MutableClock clock = MutableClock.atEpochSecond(1_700_000_000L);
        SettleWaiter waiter = new SettleWaiter(Duration.ofSeconds(1), 5, clock, d -> {
            throw new InterruptedException("stop");
        });
        InMemoryNetworkProbeClient network = new InMemoryNetworkProbeClient().settleAfterPolls(-1);

        try (ProbeSession session = network.connect()) {
            RecordHandle handle = session.createRecord(1);
            SettleTimeoutException e = Assertions.assertThrows(
                    SettleTimeoutException.class,
                    () -> waiter.awaitSettled(session, handle)
            );
            Assertions.assertEquals(1, e.attempts());
            Assertions.assertTrue(Thread.interrupted());
        }
    }

    @Test
    void offlineCountSumsInclusiveRanges() {
        long total = SubkeyRange.totalCount(List.of(new SubkeyRange(0, 0), new SubkeyRange(3, 7)));
        Assertions.assertEquals(6L, total);
    }
}
