package io.horde.api.executor;

import io.horde.api.run.TargetDescriptor;

/**
 * Factory for request executors, one per run.
 * Implement this interface to drive the engine with another HTTP transport.
 */
@FunctionalInterface
public interface RequestExecutorFactory {

    /**
     * Create an executor bound to the target's base URL, default timeout and headers.
     */
    RequestExecutor create(TargetDescriptor target);
}
