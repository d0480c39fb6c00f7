package io.runnermock.observability;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Append-only request log file, attached to the {@link #REQUEST_LOGGER}
 * logger at startup when a log file path is configured. Lifecycle lines stay
 * on the console.
 */
public final class RequestLogFile implements AutoCloseable {
    public static final String REQUEST_LOGGER = "io.runnermock.requests";
    public static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%level] %logger{0} - %msg%n";
    private static final String APPENDER_NAME = "RUNNER_MOCK_FILE";

    private final Logger target;
    private final FileAppender<ILoggingEvent> appender;

    private RequestLogFile(Logger target, FileAppender<ILoggingEvent> appender) {
        this.target = target;
        this.appender = appender;
    }

    public static RequestLogFile attach(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        try {
            if (absolute.getParent() != null) {
                Files.createDirectories(absolute.getParent());
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create log directory for " + absolute, e);
        }
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(PATTERN);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setFile(absolute.toString());
        appender.setAppend(true);
        appender.setEncoder(encoder);
        appender.start();
        if (!appender.isStarted()) {
            throw new IllegalStateException("Failed to open log file " + absolute);
        }

        Logger target = context.getLogger(REQUEST_LOGGER);
        target.addAppender(appender);
        return new RequestLogFile(target, appender);
    }

    @Override
    public void close() {
        target.detachAppender(appender);
        appender.stop();
    }
}
