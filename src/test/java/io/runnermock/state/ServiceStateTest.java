package io.runnermock.state;

import io.runnermock.model.RegisteredRunner;
import io.runnermock.model.RunnerListing;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class ServiceStateTest {
    private static final Instant START = Instant.parse("2026-05-04T08:00:00Z");

    @Test
    void registerBuildsOnlineIdleRunner() {
        TestClock clock = new TestClock(START);
        ServiceState state = new ServiceState(new MockRegistry(new Random(7), clock), clock);

        RegisteredRunner runner = state.register("build-01", "self-hosted,linux,docker");

        assertEquals("build-01", runner.name());
        assertEquals(MockRegistry.MOCK_OS, runner.os());
        assertEquals("online", runner.status());
        assertFalse(runner.busy());
        assertEquals(List.of("self-hosted", "linux", "docker"), runner.labels());
        assertEquals("2026-05-04T08:00:00Z", runner.createdAt());
        assertTrue(runner.id() >= MockRegistry.MIN_RUNNER_ID && runner.id() <= MockRegistry.MAX_RUNNER_ID);
    }

    @Test
    void listKeepsRegistrationOrderAndAllowsDuplicateNames() {
        ServiceState state = ServiceState.create(Clock.systemUTC());
        state.register("a", "x");
        state.register("b", "y");
        state.register("a", "z");

        RunnerListing listing = state.list();

        assertEquals(3, listing.totalCount());
        assertEquals(List.of("a", "b", "a"), listing.runners().stream().map(RegisteredRunner::name).toList());
        assertEquals(List.of("z"), listing.runners().get(2).labels());
    }

    @Test
    void labelsAreSplitOnCommasWithoutTrimming() {
        assertEquals(List.of("self-hosted", " linux"), MockRegistry.splitLabels("self-hosted, linux"));
        assertEquals(List.of("a", "", "b"), MockRegistry.splitLabels("a,,b"));
        assertEquals(List.of(), MockRegistry.splitLabels(""));
        assertEquals(List.of(), MockRegistry.splitLabels(null));
    }

    @Test
    void listingIsASnapshot() {
        ServiceState state = ServiceState.create(Clock.systemUTC());
        state.register("a", "x");
        RunnerListing before = state.list();
        state.register("b", "y");

        assertEquals(1, before.runners().size());
        assertEquals(2, state.list().totalCount());
    }

    @Test
    void resetClearsRunnersAndCounterAndIsIdempotent() {
        ServiceState state = ServiceState.create(Clock.systemUTC());
        state.recordRequest();
        state.recordRequest();
        state.register("a", "x");

        state.reset();
        state.reset();

        ServiceState.Snapshot snapshot = state.snapshot();
        assertEquals(0, snapshot.requestCount());
        assertEquals(0, snapshot.registeredRunners());
        assertEquals(0, state.list().totalCount());
    }

    @Test
    void snapshotReportsUptimeFromStartTime() {
        TestClock clock = new TestClock(START);
        ServiceState state = new ServiceState(new MockRegistry(new Random(1), clock), clock);
        clock.advance(Duration.ofSeconds(95));

        assertEquals(Duration.ofSeconds(95), state.snapshot().uptime());
    }

    @Test
    void concurrentRegistrationsAreAllRecorded() throws Exception {
        ServiceState state = ServiceState.create(Clock.systemUTC());
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<RegisteredRunner>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String name = "runner-" + i;
                futures.add(pool.submit(() -> {
                    state.recordRequest();
                    return state.register(name, "self-hosted");
                }));
            }
            for (Future<RegisteredRunner> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(200, state.list().totalCount());
        assertEquals(200, state.snapshot().requestCount());
    }

    private static final class TestClock extends Clock {
        private Instant now;

        private TestClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
