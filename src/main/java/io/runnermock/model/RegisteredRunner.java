package io.runnermock.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RegisteredRunner(
        int id,
        String name,
        String os,
        String status,
        List<String> labels,
        boolean busy,
        @JsonProperty("created_at") String createdAt
) {
    public RegisteredRunner {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }
}
