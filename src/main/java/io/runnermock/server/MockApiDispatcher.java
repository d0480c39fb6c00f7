package io.runnermock.server;

import io.runnermock.observability.RequestLogFile;
import io.runnermock.security.BearerTokenValidator;
import io.runnermock.state.ServiceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Matches a request against the ordered route table, gates protected routes
 * and turns every outcome, including handler faults, into an {@link ApiResponse}.
 * Each call counts as exactly one request and writes one request log line.
 */
public final class MockApiDispatcher {
    private static final Logger REQUEST_LOG = LoggerFactory.getLogger(RequestLogFile.REQUEST_LOGGER);

    private final List<Route> routes;
    private final ServiceState state;
    private final BearerTokenValidator validator;

    public MockApiDispatcher(List<Route> routes, ServiceState state, BearerTokenValidator validator) {
        this.routes = List.copyOf(routes);
        this.state = Objects.requireNonNull(state, "state");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * @param method        HTTP method
     * @param target        raw request target, path plus optional {@code ?query}
     * @param authorization value of the {@code Authorization} header, may be null
     */
    public ApiResponse dispatch(String method, String target, String authorization) {
        state.recordRequest();
        String path = target == null ? "" : target;
        String rawQuery = null;
        int q = path.indexOf('?');
        if (q >= 0) {
            rawQuery = path.substring(q + 1);
            path = path.substring(0, q);
        }
        ApiResponse response;
        try {
            response = route(method, path, rawQuery, authorization);
        } catch (Exception e) {
            response = ApiResponse.internalError(e);
            REQUEST_LOG.error("{} {} -> {} ({} bytes)", method, path, response.status(), response.bytes().length, e);
            return response;
        }
        logOutcome(method, path, response);
        return response;
    }

    private ApiResponse route(String method, String path, String rawQuery, String authorization) throws Exception {
        for (Route route : routes) {
            List<String> params = route.match(method, path);
            if (params == null) {
                continue;
            }
            if (!permitted(route.access(), authorization)) {
                return ApiResponse.unauthorized();
            }
            return route.handler().handle(new Route.Call(method, path, params, parseQuery(rawQuery), authorization));
        }
        return ApiResponse.notFound();
    }

    private boolean permitted(Route.Access access, String authorization) {
        return switch (access) {
            case PUBLIC -> true;
            case ACCESS_TOKEN -> validator.isAuthorized(authorization);
            case REGISTRATION_TOKEN -> validator.isRegistrationAuthorized(authorization);
        };
    }

    private static void logOutcome(String method, String path, ApiResponse response) {
        int status = response.status();
        int length = response.bytes().length;
        if (status == 401) {
            REQUEST_LOG.warn("{} {} -> {} ({} bytes)", method, path, status, length);
        } else if (status >= 500) {
            REQUEST_LOG.error("{} {} -> {} ({} bytes)", method, path, status, length);
        } else {
            REQUEST_LOG.info("{} {} -> {} ({} bytes)", method, path, status, length);
        }
    }

    static Map<String, String> parseQuery(String query) {
        Map<String, String> out = new LinkedHashMap<>();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                String key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
                String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
                out.put(key, value);
            }
        }
        return out;
    }
}
