package io.runnermock.server;

/**
 * Raised when the service cannot acquire its listening socket.
 */
public final class MockServerException extends RuntimeException {
    public MockServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
