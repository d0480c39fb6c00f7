package io.runnermock.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RegistrationToken(
        String token,
        @JsonProperty("expires_at") String expiresAt
) {
}
