package io.horde.api.run;

/**
 * How virtual users react to a stop signal.
 */
public enum StopMode {

    /**
     * Finish the task in flight, skip the wait, then stop.
     */
    GRACEFUL,

    /**
     * Abort the request in flight; it is recorded as cancelled.
     */
    IMMEDIATE
}
