package io.runnermock.observability;

import io.runnermock.security.BearerTokenValidator;
import io.runnermock.security.TokenGenerator;
import io.runnermock.server.MockApiDispatcher;
import io.runnermock.server.MockEndpoints;
import io.runnermock.server.MockHttpServer;
import io.runnermock.state.ServiceState;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class RequestLogFileTest {

    @Test
    void everyDispatchedRequestWritesOneLeveledLine() throws Exception {
        Path root = Files.createTempDirectory("runner-mock-log-test-");
        Path logFile = root.resolve("logs").resolve("requests.log");
        try {
            ServiceState state = ServiceState.create(Clock.systemUTC());
            MockEndpoints endpoints = new MockEndpoints(state, TokenGenerator.create(Clock.systemUTC()), "2.311.0", true);
            MockApiDispatcher dispatcher = new MockApiDispatcher(endpoints.routes(), state, new BearerTokenValidator(true));

            try (RequestLogFile ignored = RequestLogFile.attach(logFile)) {
                dispatcher.dispatch("GET", "/health", null);
                dispatcher.dispatch("GET", "/orgs/acme/actions/runners", null);
                dispatcher.dispatch("GET", "/nonexistent", null);
            }

            List<String> lines = Files.readAllLines(logFile, StandardCharsets.UTF_8).stream()
                    .filter(line -> line.contains(" -> "))
                    .toList();
            assertEquals(3, lines.size());
            assertTrue(lines.get(0).contains("[INFO]") && lines.get(0).contains("GET /health -> 200"));
            assertTrue(lines.get(1).contains("[WARN]") && lines.get(1).contains("GET /orgs/acme/actions/runners -> 401"));
            assertTrue(lines.get(2).contains("[INFO]") && lines.get(2).contains("GET /nonexistent -> 404"));
            assertTrue(lines.get(0).matches("^\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}\\.\\d{3} .*"));
            assertTrue(lines.get(0).contains("bytes)"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reattachingAppendsToTheSameFile() throws Exception {
        Path root = Files.createTempDirectory("runner-mock-log-append-");
        Path logFile = root.resolve("requests.log");
        try {
            Files.writeString(logFile, "existing line" + System.lineSeparator(), StandardCharsets.UTF_8);
            try (RequestLogFile ignored = RequestLogFile.attach(logFile)) {
                LoggerFactory.getLogger(RequestLogFile.REQUEST_LOGGER).info("appended line");
            }
            List<String> lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
            assertEquals("existing line", lines.get(0));
            assertTrue(lines.get(lines.size() - 1).endsWith("appended line"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lifecycleLinesStayOutOfTheRequestLog() throws Exception {
        Path root = Files.createTempDirectory("runner-mock-log-scope-");
        Path logFile = root.resolve("requests.log");
        try {
            try (RequestLogFile ignored = RequestLogFile.attach(logFile)) {
                LoggerFactory.getLogger(MockHttpServer.class).info("lifecycle line");
                LoggerFactory.getLogger(RequestLogFile.REQUEST_LOGGER).info("GET /health -> 200 (10 bytes)");
            }
            String content = Files.readString(logFile, StandardCharsets.UTF_8);
            assertFalse(content.contains("lifecycle line"));
            assertTrue(content.contains("GET /health -> 200"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws Exception {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
