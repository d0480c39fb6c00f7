package io.runnermock.state;

import io.runnermock.model.RegisteredRunner;
import io.runnermock.model.RunnerListing;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Random;

/**
 * Mutable state of one mock service instance: the runner registry, the
 * request counter and the start time. All reads and writes are serialized
 * on this object's monitor, so dispatching on several threads never exposes
 * a half-applied mutation.
 */
public final class ServiceState {
    private final MockRegistry registry;
    private final Clock clock;
    private final Instant startTime;
    private long requestCount;

    public ServiceState(MockRegistry registry, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startTime = clock.instant();
    }

    public static ServiceState create(Clock clock) {
        return new ServiceState(new MockRegistry(new Random(), clock), clock);
    }

    public synchronized long recordRequest() {
        return ++requestCount;
    }

    public synchronized RegisteredRunner register(String name, String labelsCsv) {
        return registry.register(name, labelsCsv);
    }

    public synchronized RunnerListing list() {
        return registry.list();
    }

    /** Drops every runner and zeroes the request counter. Safe to repeat. */
    public synchronized void reset() {
        registry.clear();
        requestCount = 0;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(requestCount, registry.size(), Duration.between(startTime, clock.instant()));
    }

    public record Snapshot(long requestCount, int registeredRunners, Duration uptime) {
    }
}
