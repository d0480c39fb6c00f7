package io.runnermock.server;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One row of the dispatch table: an HTTP method, an anchored path pattern
 * whose capture groups are the path parameters, and the handler to run.
 */
public record Route(String name, String method, Pattern pattern, Access access, Handler handler) {

    public static Route of(String name, String method, String regex, Access access, Handler handler) {
        return new Route(name, method.toUpperCase(Locale.ROOT), Pattern.compile("^" + regex + "$"), access, handler);
    }

    /** Returns the raw (still percent-encoded) path parameters, or null when this route does not apply. */
    List<String> match(String requestMethod, String path) {
        if (!method.equalsIgnoreCase(requestMethod)) {
            return null;
        }
        Matcher matcher = pattern.matcher(path);
        if (!matcher.matches()) {
            return null;
        }
        List<String> params = new ArrayList<>(matcher.groupCount());
        for (int i = 1; i <= matcher.groupCount(); i++) {
            params.add(matcher.group(i));
        }
        return params;
    }

    /** Which credential, if any, a route checks before its handler runs. */
    public enum Access {
        PUBLIC,
        ACCESS_TOKEN,
        REGISTRATION_TOKEN
    }

    @FunctionalInterface
    public interface Handler {
        ApiResponse handle(Call call) throws Exception;
    }

    public record Call(String method, String path, List<String> pathParams, Map<String, String> query, String authorization) {
        public Call {
            pathParams = List.copyOf(pathParams);
            query = Map.copyOf(query);
        }
    }
}
