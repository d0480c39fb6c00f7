package io.runnermock.server;

import io.runnermock.util.Jsons;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A dispatched response: status code plus the already serialized JSON body.
 */
public record ApiResponse(int status, String body) {
    public static final String DOCUMENTATION_URL = "https://docs.github.com/rest";

    public static ApiResponse json(int status, Object body) {
        return new ApiResponse(status, Jsons.toJson(body));
    }

    public static ApiResponse ok(Object body) {
        return json(200, body);
    }

    public static ApiResponse message(int status, String message) {
        return json(status, Map.of("message", message));
    }

    public static ApiResponse unauthorized() {
        return message(401, "Requires authentication");
    }

    public static ApiResponse notFound() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Not Found");
        body.put("documentation_url", DOCUMENTATION_URL);
        return json(404, body);
    }

    public static ApiResponse internalError(Throwable error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Internal server error");
        body.put("error", error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage());
        return json(500, body);
    }

    public byte[] bytes() {
        return body.getBytes(StandardCharsets.UTF_8);
    }
}
