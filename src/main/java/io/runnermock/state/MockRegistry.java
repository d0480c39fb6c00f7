package io.runnermock.state;

import io.runnermock.model.RegisteredRunner;
import io.runnermock.model.RunnerListing;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Ordered list of mock runner records. Not thread-safe on its own; callers go
 * through {@link ServiceState}, which owns the lock.
 *
 * <p>Names are not unique and registrations are not partitioned by org or
 * repository: every scope shares this one list.
 */
public final class MockRegistry {
    public static final String MOCK_OS = "Linux";
    public static final String STATUS_ONLINE = "online";
    public static final int MIN_RUNNER_ID = 1_000;
    public static final int MAX_RUNNER_ID = 99_999;

    private final List<RegisteredRunner> runners = new ArrayList<>();
    private final RandomGenerator ids;
    private final Clock clock;

    public MockRegistry(RandomGenerator ids, Clock clock) {
        this.ids = Objects.requireNonNull(ids, "ids");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RegisteredRunner register(String name, String labelsCsv) {
        RegisteredRunner runner = new RegisteredRunner(
                ids.nextInt(MIN_RUNNER_ID, MAX_RUNNER_ID + 1),
                name,
                MOCK_OS,
                STATUS_ONLINE,
                splitLabels(labelsCsv),
                false,
                clock.instant().truncatedTo(ChronoUnit.SECONDS).toString()
        );
        runners.add(runner);
        return runner;
    }

    public RunnerListing list() {
        return new RunnerListing(runners.size(), runners);
    }

    public int size() {
        return runners.size();
    }

    public void clear() {
        runners.clear();
    }

    static List<String> splitLabels(String labelsCsv) {
        if (labelsCsv == null || labelsCsv.isBlank()) {
            return List.of();
        }
        return List.of(labelsCsv.split(",", -1));
    }
}
