package io.horde.api.outcome;

import java.util.Locale;

/**
 * Why a request produced no HTTP status.
 */
public enum ErrorKind {

    /** Connect or response timeout. */
    TIMEOUT,

    /** Connection refused, reset or unresolvable host. */
    CONNECTION,

    /** Any other I/O failure. */
    TRANSPORT,

    /** The task could not build or encode its request. */
    TASK,

    /** Aborted because the run stopped. */
    CANCELLED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
