package io.dhtprobe.runtime;

import java.time.Clock;
import java.time.Instant;

final class Unixtime {
    private Unixtime() {
    }

    static double now(Clock clock) {
        return of(clock.instant());
    }

    static double of(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0d;
    }
}
