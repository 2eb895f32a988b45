package io.horde.api.run;

import io.horde.api.ConfigurationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The service under test: base URL, default request timeout, connect timeout and default headers.
 */
public record TargetDescriptor(
        URI baseUri,
        Duration defaultTimeout,
        Duration connectTimeout,
        Map<String, String> defaultHeaders
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    public TargetDescriptor {
        validateHost(baseUri);
        requirePositive(defaultTimeout, "Default timeout");
        requirePositive(connectTimeout, "Connect timeout");
        defaultHeaders = defaultHeaders == null ? Map.of() : Map.copyOf(defaultHeaders);
    }

    /**
     * Parse a base URL such as {@code http://localhost:3000}.
     *
     * @throws ConfigurationException if the URL is not an absolute http(s) URL with a host
     */
    public static TargetDescriptor of(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ConfigurationException("Target host must not be blank");
        }
        String trimmed = baseUrl.trim();
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        try {
            return new TargetDescriptor(new URI(trimmed), DEFAULT_TIMEOUT, DEFAULT_CONNECT_TIMEOUT, Map.of());
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Malformed target host: " + baseUrl, e);
        }
    }

    public TargetDescriptor defaultTimeout(Duration timeout) {
        return new TargetDescriptor(baseUri, timeout, connectTimeout, defaultHeaders);
    }

    public TargetDescriptor connectTimeout(Duration timeout) {
        return new TargetDescriptor(baseUri, defaultTimeout, timeout, defaultHeaders);
    }

    public TargetDescriptor header(String name, String value) {
        Map<String, String> merged = new LinkedHashMap<>(defaultHeaders);
        merged.put(name, value);
        return new TargetDescriptor(baseUri, defaultTimeout, connectTimeout, merged);
    }

    /**
     * @return the absolute URI of a request path
     */
    public URI resolve(String path) {
        return URI.create(baseUri.toString() + path);
    }

    public String host() {
        return baseUri.toString();
    }

    private static void validateHost(URI uri) {
        if (uri == null) {
            throw new ConfigurationException("Target host must not be null");
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new ConfigurationException("Target host must use http or https: " + uri);
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new ConfigurationException("Malformed target host: " + uri);
        }
        if (uri.getRawQuery() != null || uri.getRawFragment() != null) {
            throw new ConfigurationException("Target host must not carry a query or fragment: " + uri);
        }
    }

    private static void requirePositive(Duration duration, String what) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new ConfigurationException(what + " must be positive");
        }
    }
}
