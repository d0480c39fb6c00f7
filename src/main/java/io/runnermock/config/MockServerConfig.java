package io.runnermock.config;

import io.runnermock.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Startup configuration of the mock service. Values come from CLI options
 * first, then an optional JSON settings file, then the defaults below.
 */
public final class MockServerConfig {
    public static final int DEFAULT_PORT = 8080;
    public static final boolean DEFAULT_AUTH_ENABLED = true;
    public static final int DEFAULT_WORKERS = 0;
    public static final long DEFAULT_POLL_INTERVAL_MS = 200L;
    public static final long MIN_POLL_INTERVAL_MS = 100L;
    public static final long MAX_POLL_INTERVAL_MS = 250L;
    public static final String DEFAULT_RUNNER_VERSION = "2.311.0";

    private final int port;
    private final boolean authEnabled;
    private final Path logFile;
    private final int workers;
    private final long pollIntervalMs;
    private final String runnerVersion;
    private final String secureRandomAlgorithm;

    public MockServerConfig(
            int port,
            boolean authEnabled,
            Path logFile,
            int workers,
            long pollIntervalMs,
            String runnerVersion,
            String secureRandomAlgorithm
    ) {
        if (port < 0 || port > 65_535) {
            throw new InvalidConfigException("port must be between 0 and 65535: " + port);
        }
        if (workers < 0) {
            throw new InvalidConfigException("workers must not be negative: " + workers);
        }
        if (runnerVersion == null || runnerVersion.isBlank()) {
            throw new InvalidConfigException("runnerVersion must not be blank");
        }
        this.port = port;
        this.authEnabled = authEnabled;
        this.logFile = logFile;
        this.workers = workers;
        this.pollIntervalMs = Math.max(MIN_POLL_INTERVAL_MS, Math.min(MAX_POLL_INTERVAL_MS, pollIntervalMs));
        this.runnerVersion = runnerVersion.trim();
        this.secureRandomAlgorithm = secureRandomAlgorithm == null || secureRandomAlgorithm.isBlank()
                ? null
                : secureRandomAlgorithm.trim();
    }

    public static MockServerConfig defaults() {
        return resolve(Settings.EMPTY, Settings.EMPTY);
    }

    /** Merges two layers; any non-null value in {@code cli} wins over {@code file}. */
    public static MockServerConfig resolve(Settings cli, Settings file) {
        Settings a = cli == null ? Settings.EMPTY : cli;
        Settings b = file == null ? Settings.EMPTY : file;
        String logFile = first(a.logFile(), b.logFile(), null);
        return new MockServerConfig(
                first(a.port(), b.port(), DEFAULT_PORT),
                first(a.authEnabled(), b.authEnabled(), DEFAULT_AUTH_ENABLED),
                logFile == null || logFile.isBlank() ? null : Paths.get(logFile),
                first(a.workers(), b.workers(), DEFAULT_WORKERS),
                first(a.pollIntervalMs(), b.pollIntervalMs(), DEFAULT_POLL_INTERVAL_MS),
                first(a.runnerVersion(), b.runnerVersion(), DEFAULT_RUNNER_VERSION),
                first(a.secureRandomAlgorithm(), b.secureRandomAlgorithm(), null)
        );
    }

    public static Settings loadSettings(Path file) {
        if (file == null) {
            return Settings.EMPTY;
        }
        if (!Files.isRegularFile(file)) {
            throw new InvalidConfigException("Settings file not found: " + file);
        }
        try {
            Settings settings = Jsons.mapper().readValue(file.toFile(), Settings.class);
            return settings == null ? Settings.EMPTY : settings;
        } catch (IOException e) {
            throw new InvalidConfigException("Failed to read settings file " + file + ": " + e.getMessage(), e);
        }
    }

    private static <T> T first(T preferred, T fallback, T defaultValue) {
        if (preferred != null) {
            return preferred;
        }
        return fallback != null ? fallback : defaultValue;
    }

    public int port() {
        return port;
    }

    public boolean authEnabled() {
        return authEnabled;
    }

    public Path logFile() {
        return logFile;
    }

    public int workers() {
        return workers;
    }

    public long pollIntervalMs() {
        return pollIntervalMs;
    }

    public String runnerVersion() {
        return runnerVersion;
    }

    /** Named {@link java.security.SecureRandom} algorithm for tokens, or null for the platform default. */
    public String secureRandomAlgorithm() {
        return secureRandomAlgorithm;
    }

    @Override
    public String toString() {
        return "MockServerConfig{port=" + port
                + ", authEnabled=" + authEnabled
                + ", logFile=" + logFile
                + ", workers=" + workers
                + ", pollIntervalMs=" + pollIntervalMs
                + ", runnerVersion=" + runnerVersion
                + ", secureRandomAlgorithm=" + secureRandomAlgorithm + "}";
    }

    /** One configuration layer; null means "not set here". */
    public record Settings(
            Integer port,
            Boolean authEnabled,
            String logFile,
            Integer workers,
            Long pollIntervalMs,
            String runnerVersion,
            String secureRandomAlgorithm
    ) {
        public static final Settings EMPTY = new Settings(null, null, null, null, null, null, null);
    }
}
