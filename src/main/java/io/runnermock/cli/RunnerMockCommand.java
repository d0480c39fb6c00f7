package io.runnermock.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.runnermock.config.InvalidConfigException;
import io.runnermock.config.MockServerConfig;
import io.runnermock.observability.RequestLogFile;
import io.runnermock.server.MockHttpServer;
import io.runnermock.server.MockServerException;
import io.runnermock.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

@Command(
        name = "runner-mock",
        mixinStandardHelpOptions = true,
        description = "Mock runner-registration service for CI runner scripts",
        subcommands = {
                RunnerMockCommand.ServeCommand.class,
                RunnerMockCommand.RegisterCommand.class,
                RunnerMockCommand.HealthCommand.class
        }
)
public final class RunnerMockCommand implements Runnable {
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIG = 2;

    private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(10);
    private static final Pattern ACCESS_TOKEN = Pattern.compile("^(ghp_|github_pat_)");

    @Override
    public void run() {
        System.out.println("Use subcommands: serve | register | health");
    }

    @Command(name = "serve", description = "Run the mock service until interrupted")
    static final class ServeCommand implements Callable<Integer> {
        @Option(names = {"--port"}, description = "Loopback port to bind (default 8080, 0 picks a free port)")
        Integer port;

        @Option(names = {"--no-auth"}, defaultValue = "false", description = "Accept any Authorization header on protected routes")
        boolean noAuth;

        @Option(names = {"--log-file"}, description = "Append request log lines to this file")
        String logFile;

        @Option(names = {"--workers"}, description = "Worker threads (0 handles requests one at a time)")
        Integer workers;

        @Option(names = {"--poll-interval-ms"}, description = "Stop-flag poll interval, clamped to 100..250")
        Long pollIntervalMs;

        @Option(names = {"--runner-version"}, description = "Runner version advertised by the release endpoint")
        String runnerVersion;

        @Option(names = {"--secure-random-algorithm"}, description = "SecureRandom algorithm for registration tokens")
        String secureRandomAlgorithm;

        @Option(names = {"--settings"}, description = "Optional JSON settings file")
        Path settingsFile;

        @Override
        public Integer call() throws Exception {
            MockServerConfig config;
            try {
                config = MockServerConfig.resolve(
                        new MockServerConfig.Settings(
                                port,
                                noAuth ? Boolean.FALSE : null,
                                logFile,
                                workers,
                                pollIntervalMs,
                                runnerVersion,
                                secureRandomAlgorithm
                        ),
                        MockServerConfig.loadSettings(settingsFile)
                );
            } catch (InvalidConfigException e) {
                System.err.println("Invalid configuration: " + e.getMessage());
                return EXIT_CONFIG;
            }
            MockHttpServer mockServer;
            RequestLogFile logSink = null;
            try {
                mockServer = new MockHttpServer(config, Clock.systemUTC());
                if (config.logFile() != null) {
                    logSink = RequestLogFile.attach(config.logFile());
                }
            } catch (IllegalStateException e) {
                System.err.println(e.getMessage());
                return EXIT_CONFIG;
            }
            try (RequestLogFile ignored = logSink; MockHttpServer server = mockServer) {
                try {
                    server.start();
                } catch (MockServerException e) {
                    System.err.println(e.getMessage());
                    return EXIT_FAILURE;
                }
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    server.requestStop();
                    try {
                        server.awaitTermination(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }, "runner-mock-shutdown"));
                System.out.println("Mock runner service listening on http://127.0.0.1:" + server.port());
                server.run();
            }
            return 0;
        }
    }

    @Command(name = "register", description = "Request a registration token and register a runner against a running mock")
    static final class RegisterCommand implements Callable<Integer> {
        @Option(names = {"--url"}, defaultValue = "http://127.0.0.1:8080", description = "Mock service base URL")
        String url;

        @Option(names = {"--org-or-repo"}, required = true, description = "Organization name or owner/repo")
        String orgOrRepo;

        @Option(names = {"--is-org"}, defaultValue = "false", description = "Register at organization scope")
        boolean isOrg;

        @Option(names = {"--token"}, required = true, description = "Personal access token (ghp_ or github_pat_)")
        String token;

        @Option(names = {"--name"}, required = true, description = "Runner name")
        String name;

        @Option(names = {"--labels"}, defaultValue = "self-hosted,linux", description = "Comma-separated labels")
        String labels;

        @Override
        public Integer call() throws Exception {
            if (!ACCESS_TOKEN.matcher(token).find()) {
                System.err.println("Invalid token format. Token should start with 'ghp_' or 'github_pat_'");
                return EXIT_FAILURE;
            }
            HttpClient client = HttpClient.newBuilder().connectTimeout(HTTP_TIMEOUT).build();
            try {
                return register(client, trimSlash(url));
            } catch (IllegalArgumentException e) {
                System.err.println("Invalid registration target: " + e.getMessage());
                return EXIT_FAILURE;
            } catch (IOException e) {
                System.err.println("Registration against " + url + " failed: " + e.getMessage());
                return EXIT_FAILURE;
            }
        }

        private int register(HttpClient client, String base) throws IOException, InterruptedException {
            HttpResponse<String> tokenResponse = send(client, HttpRequest.newBuilder(URI.create(
                            base + scopePath(orgOrRepo, isOrg) + "/actions/runners/registration-token"))
                    .header("Authorization", "Bearer " + token)
                    .POST(HttpRequest.BodyPublishers.noBody()));
            if (tokenResponse.statusCode() / 100 != 2) {
                System.err.println("Failed to get registration token (HTTP " + tokenResponse.statusCode() + "): "
                        + tokenResponse.body());
                return EXIT_FAILURE;
            }
            JsonNode issued = Jsons.readTree(tokenResponse.body());
            String registrationToken = issued.path("token").asText("");
            if (registrationToken.isBlank()) {
                System.err.println("Registration token missing from response: " + tokenResponse.body());
                return EXIT_FAILURE;
            }
            HttpResponse<String> registered = send(client, HttpRequest.newBuilder(URI.create(base + "/mock/runners?name="
                            + encode(name) + "&labels=" + encode(labels)))
                    .header("Authorization", "Bearer " + registrationToken)
                    .POST(HttpRequest.BodyPublishers.noBody()));
            if (registered.statusCode() / 100 != 2) {
                System.err.println("Runner registration failed (HTTP " + registered.statusCode() + "): " + registered.body());
                return EXIT_FAILURE;
            }
            System.out.println(Jsons.pretty(registered.body()));
            return 0;
        }
    }

    @Command(name = "health", description = "Print the health report of a running mock")
    static final class HealthCommand implements Callable<Integer> {
        @Option(names = {"--url"}, defaultValue = "http://127.0.0.1:8080", description = "Mock service base URL")
        String url;

        @Override
        public Integer call() throws Exception {
            HttpClient client = HttpClient.newBuilder().connectTimeout(HTTP_TIMEOUT).build();
            HttpResponse<String> response;
            try {
                response = send(client, HttpRequest.newBuilder(URI.create(trimSlash(url) + "/health")).GET());
            } catch (IOException e) {
                System.err.println("Mock service unreachable at " + url + ": " + e.getMessage());
                return EXIT_FAILURE;
            }
            System.out.println(Jsons.pretty(response.body()));
            return response.statusCode() == 200 ? 0 : EXIT_FAILURE;
        }
    }

    private static HttpResponse<String> send(HttpClient client, HttpRequest.Builder request)
            throws IOException, InterruptedException {
        return client.send(request
                        .timeout(HTTP_TIMEOUT)
                        .header("Accept", "application/vnd.github+json")
                        .header("X-GitHub-Api-Version", MockHttpServer.API_VERSION)
                        .build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    static String scopePath(String orgOrRepo, boolean isOrg) {
        String trimmed = orgOrRepo.trim();
        if (isOrg) {
            return "/orgs/" + encode(trimmed);
        }
        int slash = trimmed.indexOf('/');
        if (slash <= 0 || slash == trimmed.length() - 1) {
            throw new IllegalArgumentException("Repository scope must be owner/repo: " + orgOrRepo);
        }
        return "/repos/" + encode(trimmed.substring(0, slash)) + "/" + encode(trimmed.substring(slash + 1));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String trimSlash(String value) {
        String out = value.trim();
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
