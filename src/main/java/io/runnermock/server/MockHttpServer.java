package io.runnermock.server;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.runnermock.config.MockServerConfig;
import io.runnermock.security.BearerTokenValidator;
import io.runnermock.security.TokenGenerator;
import io.runnermock.state.ServiceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Loopback HTTP listener for the mock API.
 *
 * <p>With {@code workers == 0} every exchange runs on the server's single
 * dispatcher thread, one request at a time. A positive worker count hands
 * exchanges to a fixed pool; {@link ServiceState} serializes state access
 * either way.
 *
 * <p>{@link #run()} blocks and checks a stop flag once per poll interval.
 * {@link #requestStop()} sets the flag; the listener then stops accepting and
 * lets in-flight exchanges finish before returning.
 */
public final class MockHttpServer implements AutoCloseable {
    public static final String API_VERSION = "2022-11-28";
    public static final String CONTENT_TYPE = "application/json; charset=utf-8";
    static final int STOP_GRACE_SECONDS = 1;

    private static final Logger LOG = LoggerFactory.getLogger(MockHttpServer.class);

    private final MockServerConfig config;
    private final ServiceState state;
    private final MockApiDispatcher dispatcher;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile HttpServer server;
    private ExecutorService workerPool;

    public MockHttpServer(MockServerConfig config, Clock clock) {
        this.config = config;
        this.state = ServiceState.create(clock);
        BearerTokenValidator validator = new BearerTokenValidator(config.authEnabled());
        MockEndpoints endpoints = new MockEndpoints(
                state,
                tokenGenerator(config, clock),
                config.runnerVersion(),
                config.authEnabled()
        );
        this.dispatcher = new MockApiDispatcher(endpoints.routes(), state, validator);
    }

    private static TokenGenerator tokenGenerator(MockServerConfig config, Clock clock) {
        String algorithm = config.secureRandomAlgorithm();
        return algorithm == null ? TokenGenerator.create(clock) : TokenGenerator.withAlgorithm(algorithm, clock);
    }

    /**
     * Binds the loopback socket and starts serving.
     *
     * @return the bound address, with the real port when port 0 was configured
     * @throws MockServerException when the port cannot be bound
     */
    public synchronized InetSocketAddress start() {
        if (server != null) {
            throw new IllegalStateException("Server already started");
        }
        InetSocketAddress address = new InetSocketAddress(InetAddress.getLoopbackAddress(), config.port());
        HttpServer created;
        try {
            created = HttpServer.create(address, 0);
        } catch (IOException e) {
            throw new MockServerException("Failed to bind " + address + ": " + e.getMessage(), e);
        }
        created.createContext("/", this::handle);
        if (config.workers() > 0) {
            workerPool = Executors.newFixedThreadPool(config.workers());
            created.setExecutor(workerPool);
        } else {
            created.setExecutor(null);
        }
        created.start();
        server = created;
        LOG.info("Mock runner service listening on http://{}:{} (auth {}, workers {})",
                address.getHostString(), port(), config.authEnabled() ? "enabled" : "disabled", config.workers());
        return created.getAddress();
    }

    /** Blocks until {@link #requestStop()} is observed, then shuts the listener down. */
    public void run() throws InterruptedException {
        if (server == null) {
            start();
        }
        while (!stopRequested.get()) {
            stopSignal.await(config.pollIntervalMs(), TimeUnit.MILLISECONDS);
        }
        shutdown();
    }

    public void requestStop() {
        stopRequested.set(true);
        stopSignal.countDown();
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    public int port() {
        HttpServer current = server;
        return current == null ? config.port() : current.getAddress().getPort();
    }

    public ServiceState state() {
        return state;
    }

    @Override
    public void close() {
        requestStop();
        shutdown();
    }

    private synchronized void shutdown() {
        if (terminated.getCount() == 0) {
            return;
        }
        if (server == null) {
            terminated.countDown();
            return;
        }
        server.stop(STOP_GRACE_SECONDS);
        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(STOP_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    LOG.warn("Worker pool still busy after {}s", STOP_GRACE_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        LOG.info("Mock runner service stopped after {} requests", state.snapshot().requestCount());
        terminated.countDown();
    }

    private void handle(HttpExchange exchange) {
        String method = exchange.getRequestMethod();
        try {
            drain(exchange.getRequestBody());
            ApiResponse response;
            try {
                response = dispatcher.dispatch(method, target(exchange.getRequestURI()),
                        exchange.getRequestHeaders().getFirst("Authorization"));
            } catch (RuntimeException e) {
                LOG.error("Dispatch failed for {} {}", method, exchange.getRequestURI(), e);
                response = ApiResponse.internalError(e);
            }
            write(exchange, method, response);
        } catch (IOException e) {
            LOG.warn("Failed to answer {} {}: {}", method, exchange.getRequestURI(), e.getMessage());
        } finally {
            exchange.close();
        }
    }

    private static void write(HttpExchange exchange, String method, ApiResponse response) throws IOException {
        byte[] bytes = response.bytes();
        exchange.getResponseHeaders().set("Content-Type", CONTENT_TYPE);
        exchange.getResponseHeaders().set("X-GitHub-Api-Version", API_VERSION);
        if ("HEAD".equalsIgnoreCase(method)) {
            exchange.sendResponseHeaders(response.status(), -1);
            return;
        }
        exchange.sendResponseHeaders(response.status(), bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static String target(URI uri) {
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        String query = uri.getRawQuery();
        return query == null ? path : path + "?" + query;
    }

    private static void drain(InputStream body) throws IOException {
        try (body) {
            body.readAllBytes();
        }
    }
}
