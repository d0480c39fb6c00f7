package io.runnermock.security;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BearerTokenValidatorTest {
    private final BearerTokenValidator validator = new BearerTokenValidator(true);

    @Test
    void acceptsClassicAndFineGrainedAccessTokens() {
        assertTrue(validator.isAuthorized("Bearer ghp_test123"));
        assertTrue(validator.isAuthorized("Bearer ghp_"));
        assertTrue(validator.isAuthorized("Bearer github_pat_11ABCDEFG_xyz"));
    }

    @Test
    void rejectsMissingAndMalformedHeaders() {
        List<String> rejected = List.of(
                "",
                "ghp_test123",
                "Bearer",
                "Bearer ",
                "bearer ghp_test123",
                "Bearer  ghp_test123",
                "Token ghp_test123",
                "Bearer gho_oauth",
                "Bearer MOCK_REG_abc",
                " Bearer ghp_test123"
        );
        assertFalse(validator.isAuthorized(null));
        for (String header : rejected) {
            assertFalse(validator.isAuthorized(header), header);
        }
    }

    @Test
    void registrationTokensAreCheckedSeparately() {
        assertTrue(validator.isRegistrationAuthorized("Bearer MOCK_REG_abc"));
        assertFalse(validator.isRegistrationAuthorized("Bearer ghp_test123"));
        assertFalse(validator.isRegistrationAuthorized(null));
    }

    @Test
    void disabledValidatorAcceptsEverything() {
        BearerTokenValidator open = new BearerTokenValidator(false);
        assertTrue(open.isAuthorized(null));
        assertTrue(open.isAuthorized(""));
        assertTrue(open.isAuthorized("Basic dXNlcjpwYXNz"));
        assertTrue(open.isRegistrationAuthorized(null));
    }
}
