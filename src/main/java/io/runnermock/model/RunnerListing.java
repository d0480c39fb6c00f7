package io.runnermock.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RunnerListing(
        @JsonProperty("total_count") int totalCount,
        List<RegisteredRunner> runners
) {
    public RunnerListing {
        runners = runners == null ? List.of() : List.copyOf(runners);
    }
}
