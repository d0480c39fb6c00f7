package io.runnermock.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthReport(
        String status,
        String uptime,
        @JsonProperty("uptime_seconds") long uptimeSeconds,
        @JsonProperty("request_count") long requestCount,
        @JsonProperty("registered_runners") int registeredRunners,
        @JsonProperty("auth_enabled") boolean authEnabled
) {
}
