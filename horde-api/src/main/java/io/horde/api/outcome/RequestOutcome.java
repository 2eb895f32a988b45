package io.horde.api.outcome;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable result of one request, produced once and recorded once.
 * Exactly one of {@code statusCode} and {@code errorKind} is set.
 */
public record RequestOutcome(
        String category,
        Integer statusCode,
        Duration latency,
        long bodyLength,
        ErrorKind errorKind,
        String errorMessage,
        Instant timestamp
) {

    public RequestOutcome {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Outcome category must not be blank");
        }
        if ((statusCode == null) == (errorKind == null)) {
            throw new IllegalArgumentException("Outcome must carry either a status code or an error kind");
        }
        latency = latency == null || latency.isNegative() ? Duration.ZERO : latency;
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static RequestOutcome response(String category, int statusCode, Duration latency,
                                          long bodyLength, Instant timestamp) {
        return new RequestOutcome(category, statusCode, latency, bodyLength, null, null, timestamp);
    }

    public static RequestOutcome error(String category, ErrorKind errorKind, Duration latency,
                                       String errorMessage, Instant timestamp) {
        return new RequestOutcome(category, null, latency, 0, errorKind, errorMessage, timestamp);
    }

    public boolean hasStatus() {
        return statusCode != null;
    }

    public boolean isError() {
        return errorKind != null;
    }

    public long latencyMs() {
        return latency.toMillis();
    }
}
