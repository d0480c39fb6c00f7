package io.runnermock.security;

import java.util.regex.Pattern;

/**
 * Format-only checks on {@code Authorization} headers. No signature,
 * scope or revocation lookup happens here.
 */
public final class BearerTokenValidator {
    private static final Pattern ACCESS_TOKEN = Pattern.compile("^Bearer (ghp_|github_pat_)");
    private static final Pattern REGISTRATION_TOKEN =
            Pattern.compile("^Bearer " + Pattern.quote(TokenGenerator.TOKEN_PREFIX));

    private final boolean enabled;

    public BearerTokenValidator(boolean enabled) {
        this.enabled = enabled;
    }

    /** Accepts personal-access ({@code ghp_}) and fine-grained ({@code github_pat_}) tokens. */
    public boolean isAuthorized(String header) {
        return matches(ACCESS_TOKEN, header);
    }

    /** Accepts tokens issued by the registration-token endpoint. */
    public boolean isRegistrationAuthorized(String header) {
        return matches(REGISTRATION_TOKEN, header);
    }

    private boolean matches(Pattern pattern, String header) {
        if (!enabled) {
            return true;
        }
        if (header == null || header.isEmpty()) {
            return false;
        }
        return pattern.matcher(header).find();
    }
}
