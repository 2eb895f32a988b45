package io.horde.api.executor;

import io.horde.api.outcome.RequestOutcome;
import io.horde.api.task.RequestSpec;

import java.time.Duration;

/**
 * Issues one HTTP request and reports what happened.
 * <p>
 * Implementations never throw for network problems: connection failures and timeouts are
 * returned as outcomes with an error kind and no status code. They never retry on their own,
 * and an interrupt of the calling thread aborts the call with a cancelled outcome.
 * Implementations must be safe to call from many virtual users at once.
 */
public interface RequestExecutor extends AutoCloseable {

    /**
     * @param spec    the request to send
     * @param timeout time allowed for the response
     * @return the outcome, never {@code null}
     */
    RequestOutcome execute(RequestSpec spec, Duration timeout);

    /**
     * Release connections held by this executor.
     */
    @Override
    default void close() {}
}
