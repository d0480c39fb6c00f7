package io.runnermock.server;

import io.runnermock.model.HealthReport;
import io.runnermock.model.RegisteredRunner;
import io.runnermock.model.RegistrationToken;
import io.runnermock.model.RunnerRelease;
import io.runnermock.security.TokenGenerator;
import io.runnermock.server.Route.Access;
import io.runnermock.state.ServiceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Handlers for the mocked control-plane API and the table that routes to them.
 */
public final class MockEndpoints {
    private static final Logger LOG = LoggerFactory.getLogger(MockEndpoints.class);
    private static final String SEGMENT = "([^/]+)";

    private final ServiceState state;
    private final TokenGenerator tokens;
    private final RunnerRelease release;
    private final boolean authEnabled;

    public MockEndpoints(ServiceState state, TokenGenerator tokens, String runnerVersion, boolean authEnabled) {
        this.state = Objects.requireNonNull(state, "state");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.release = RunnerRelease.forVersion(runnerVersion);
        this.authEnabled = authEnabled;
    }

    /** Routes in match priority order; the first match wins. */
    public List<Route> routes() {
        return List.of(
                Route.of("latest-release", "GET", "/repos/actions/runner/releases/latest",
                        Access.PUBLIC, call -> latestRelease()),
                Route.of("org-registration-token", "POST", "/orgs/" + SEGMENT + "/actions/runners/registration-token",
                        Access.ACCESS_TOKEN, call -> registrationToken(scope(call))),
                Route.of("repo-registration-token", "POST",
                        "/repos/" + SEGMENT + "/" + SEGMENT + "/actions/runners/registration-token",
                        Access.ACCESS_TOKEN, call -> registrationToken(scope(call))),
                Route.of("org-runners", "GET", "/orgs/" + SEGMENT + "/actions/runners",
                        Access.ACCESS_TOKEN, call -> listRunners(scope(call))),
                Route.of("repo-runners", "GET", "/repos/" + SEGMENT + "/" + SEGMENT + "/actions/runners",
                        Access.ACCESS_TOKEN, call -> listRunners(scope(call))),
                Route.of("health", "GET", "/health", Access.PUBLIC, call -> health()),
                Route.of("reset", "POST", "/reset", Access.PUBLIC, call -> reset()),
                Route.of("register-runner", "POST", "/mock/runners",
                        Access.REGISTRATION_TOKEN, this::registerRunner)
        );
    }

    ApiResponse latestRelease() {
        return ApiResponse.ok(release);
    }

    ApiResponse registrationToken(String scope) {
        RegistrationToken token = tokens.newToken();
        LOG.debug("Issued registration token for {} expiring {}", scope, token.expiresAt());
        return ApiResponse.ok(token);
    }

    ApiResponse listRunners(String scope) {
        LOG.debug("Listing runners for {}", scope);
        return ApiResponse.ok(state.list());
    }

    ApiResponse health() {
        ServiceState.Snapshot snapshot = state.snapshot();
        return ApiResponse.ok(new HealthReport(
                "healthy",
                formatUptime(snapshot.uptime()),
                snapshot.uptime().toSeconds(),
                snapshot.requestCount(),
                snapshot.registeredRunners(),
                authEnabled
        ));
    }

    ApiResponse reset() {
        state.reset();
        LOG.info("Mock data reset");
        return ApiResponse.message(200, "Mock data reset successfully");
    }

    ApiResponse registerRunner(Route.Call call) {
        String name = call.query().get("name");
        if (name == null || name.isBlank()) {
            return ApiResponse.message(422, "Validation Failed");
        }
        RegisteredRunner runner = state.register(name, call.query().get("labels"));
        LOG.info("Registered runner {} (id={}, labels={})", runner.name(), runner.id(), runner.labels());
        return ApiResponse.json(201, runner);
    }

    /** Decoded {@code org} or {@code owner/repo}; a malformed escape fails the request. */
    static String scope(Route.Call call) {
        StringBuilder sb = new StringBuilder();
        for (String raw : call.pathParams()) {
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(URLDecoder.decode(raw, StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    static String formatUptime(Duration uptime) {
        long seconds = Math.max(0L, uptime.toSeconds());
        return String.format("%02d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
