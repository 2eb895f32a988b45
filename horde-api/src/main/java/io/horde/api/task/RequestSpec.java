package io.horde.api.task;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A single HTTP request built by a task.
 * <p>
 * The {@code body} may be a {@code String}, a {@code byte[]} or any object the executor
 * serializes to JSON. The {@code category} is the statistics bucket the outcome is recorded
 * under; it defaults to {@code "<METHOD> <path>"}. A non-null {@code timeout} overrides both
 * the task timeout and the target default.
 */
public record RequestSpec(
        String method,
        String path,
        Map<String, String> headers,
        Object body,
        String category,
        Duration timeout
) {

    public RequestSpec {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("HTTP method must not be blank");
        }
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("Request path must start with '/': " + path);
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Request timeout must be positive");
        }
        method = method.toUpperCase(Locale.ROOT);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        if (category == null || category.isBlank()) {
            category = method + " " + path;
        }
    }

    public static RequestSpec of(String method, String path) {
        return new RequestSpec(method, path, Map.of(), null, null, null);
    }

    public static RequestSpec get(String path) {
        return of("GET", path);
    }

    public static RequestSpec post(String path, Object body) {
        return of("POST", path).body(body);
    }

    /**
     * Record the outcome under the given statistics category instead of method and path.
     */
    public RequestSpec named(String category) {
        return new RequestSpec(method, path, headers, body, category, timeout);
    }

    public RequestSpec header(String name, String value) {
        Map<String, String> merged = new LinkedHashMap<>(headers);
        merged.put(name, value);
        return new RequestSpec(method, path, merged, body, category, timeout);
    }

    public RequestSpec body(Object body) {
        return new RequestSpec(method, path, headers, body, category, timeout);
    }

    public RequestSpec timeout(Duration timeout) {
        return new RequestSpec(method, path, headers, body, category, timeout);
    }
}
