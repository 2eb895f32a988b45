package io.horde.core.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.horde.api.executor.RequestExecutor;
import io.horde.api.outcome.ErrorKind;
import io.horde.api.outcome.RequestOutcome;
import io.horde.api.run.TargetDescriptor;
import io.horde.api.task.RequestSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;

/**
 * Request executor backed by the JDK {@link HttpClient}.
 * <p>
 * Issues exactly one request per call with the given timeout; there is no retry logic.
 * Transport problems are returned as error outcomes, never thrown.
 */
public class HttpClientRequestExecutor implements RequestExecutor {

    private static final Logger log = LoggerFactory.getLogger(HttpClientRequestExecutor.class);

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";

    private final TargetDescriptor target;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpClientRequestExecutor(TargetDescriptor target) {
        this(target, HttpClient.newBuilder()
                .connectTimeout(target.connectTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build());
    }

    public HttpClientRequestExecutor(TargetDescriptor target, HttpClient httpClient) {
        this.target = target;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        log.info("HTTP executor initialised - target: {}, connect timeout: {}ms, default timeout: {}ms",
                target.host(), target.connectTimeout().toMillis(), target.defaultTimeout().toMillis());
    }

    @Override
    public RequestOutcome execute(RequestSpec spec, Duration timeout) {
        Duration effectiveTimeout = timeout != null ? timeout : target.defaultTimeout();
        Instant timestamp = Instant.now();
        long start = System.nanoTime();
        try {
            HttpRequest request = buildRequest(spec, effectiveTimeout);
            log.debug("Executing {} {}", spec.method(), request.uri());

            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            Duration latency = elapsedSince(start);
            byte[] body = response.body();

            log.debug("{} completed in {} ms with status {}", spec.category(), latency.toMillis(), response.statusCode());
            return RequestOutcome.response(spec.category(), response.statusCode(), latency,
                    body == null ? 0 : body.length, timestamp);

        } catch (HttpTimeoutException e) {
            log.debug("{} timed out after {} ms", spec.category(), effectiveTimeout.toMillis());
            return error(spec, ErrorKind.TIMEOUT, start, "timed out after " + effectiveTimeout.toMillis() + "ms", timestamp);
        } catch (ConnectException e) {
            log.debug("{} could not connect: {}", spec.category(), e.getMessage());
            return error(spec, ErrorKind.CONNECTION, start, describe(e), timestamp);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return error(spec, ErrorKind.CANCELLED, start, "request cancelled", timestamp);
        } catch (JsonProcessingException e) {
            log.debug("{} body could not be serialized: {}", spec.category(), e.getOriginalMessage());
            return error(spec, ErrorKind.TASK, start, "Failed to serialize request body: " + e.getOriginalMessage(), timestamp);
        } catch (IOException e) {
            log.debug("{} failed: {}", spec.category(), e.toString());
            return error(spec, ErrorKind.TRANSPORT, start, describe(e), timestamp);
        } catch (IllegalArgumentException e) {
            // invalid header name/value or URI built from the task's path
            return error(spec, ErrorKind.TASK, start, e.getMessage(), timestamp);
        }
    }

    private HttpRequest buildRequest(RequestSpec spec, Duration timeout) throws JsonProcessingException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(target.resolve(spec.path()))
                .timeout(timeout);

        // target headers first, request headers override
        target.defaultHeaders().forEach(builder::setHeader);
        spec.headers().forEach(builder::setHeader);

        builder.method(spec.method(), bodyPublisher(spec, builder));
        return builder.build();
    }

    private HttpRequest.BodyPublisher bodyPublisher(RequestSpec spec, HttpRequest.Builder builder)
            throws JsonProcessingException {
        Object body = spec.body();
        if (body == null) {
            return HttpRequest.BodyPublishers.noBody();
        }
        if (body instanceof byte[] bytes) {
            return HttpRequest.BodyPublishers.ofByteArray(bytes);
        }
        if (body instanceof String text) {
            return HttpRequest.BodyPublishers.ofString(text);
        }
        String json = objectMapper.writeValueAsString(body);
        if (!hasHeader(spec, CONTENT_TYPE)) {
            builder.setHeader(CONTENT_TYPE, APPLICATION_JSON);
        }
        return HttpRequest.BodyPublishers.ofString(json);
    }

    private boolean hasHeader(RequestSpec spec, String name) {
        return spec.headers().keySet().stream().anyMatch(name::equalsIgnoreCase)
                || target.defaultHeaders().keySet().stream().anyMatch(name::equalsIgnoreCase);
    }

    private static RequestOutcome error(RequestSpec spec, ErrorKind kind, long start, String message, Instant timestamp) {
        return RequestOutcome.error(spec.category(), kind, elapsedSince(start), message, timestamp);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    public TargetDescriptor target() {
        return target;
    }
}
