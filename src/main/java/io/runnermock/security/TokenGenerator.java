package io.runnermock.security;

import io.runnermock.model.RegistrationToken;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Objects;

/**
 * Issues opaque registration tokens. Tokens carry the {@link #TOKEN_PREFIX} so
 * they can never be mistaken for a real access token, and nothing about them
 * is remembered after issuance.
 */
public final class TokenGenerator {
    public static final String TOKEN_PREFIX = "MOCK_REG_";
    public static final Duration TOKEN_TTL = Duration.ofHours(1);
    public static final DateTimeFormatter EXPIRY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private static final int TOKEN_BYTES = 32;

    private final SecureRandom secureRandom;
    private final Clock clock;

    public TokenGenerator(SecureRandom secureRandom, Clock clock) {
        this.secureRandom = Objects.requireNonNull(secureRandom, "secureRandom");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static TokenGenerator create(Clock clock) {
        return new TokenGenerator(new SecureRandom(), clock);
    }

    /**
     * Builds a generator on a named {@link SecureRandom} algorithm. An unknown
     * algorithm is a startup error; there is no fallback to a weaker source.
     */
    public static TokenGenerator withAlgorithm(String algorithm, Clock clock) {
        try {
            return new TokenGenerator(SecureRandom.getInstance(algorithm), clock);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Secure random source unavailable: " + algorithm, e);
        }
    }

    public RegistrationToken newToken() {
        byte[] random = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(random);
        String token = TOKEN_PREFIX + Base64.getEncoder().encodeToString(random);
        Instant expiresAt = clock.instant().truncatedTo(ChronoUnit.SECONDS).plus(TOKEN_TTL);
        return new RegistrationToken(token, EXPIRY_FORMAT.format(expiresAt));
    }
}
