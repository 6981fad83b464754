package io.pulse4j.core;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Runtime configuration of the default scheduler.
 *
 * @param defaultZone         zone used by jobs that do not name one
 * @param workerThreads       size of the pool job bodies run on
 * @param shutdownGracePeriod how long shutdown waits for in-flight runs
 */
public record SchedulerOptions(
        ZoneId defaultZone,
        int workerThreads,
        Duration shutdownGracePeriod
) {
    public SchedulerOptions {
        Objects.requireNonNull(defaultZone, "defaultZone must not be null");
        Objects.requireNonNull(shutdownGracePeriod, "shutdownGracePeriod must not be null");
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive");
        }
        if (shutdownGracePeriod.isNegative()) {
            throw new IllegalArgumentException("shutdownGracePeriod must not be negative");
        }
    }

    public static SchedulerOptions defaults() {
        return new SchedulerOptions(ZoneId.of("America/New_York"), 4, Duration.ofSeconds(30));
    }

    public SchedulerOptions withDefaultZone(ZoneId zone) {
        return new SchedulerOptions(zone, workerThreads, shutdownGracePeriod);
    }
}
