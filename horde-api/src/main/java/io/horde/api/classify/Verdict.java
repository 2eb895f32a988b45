package io.horde.api.classify;

/**
 * Classification of a request outcome.
 */
public enum Verdict {

    SUCCESS,

    /**
     * A non-2xx outcome the task tolerates, e.g. a 429 while simulating burst traffic.
     * Treated as a successful outcome: {@link #isSuccessful()} is {@code true}, it is reported
     * under {@code expectedFailureCount} rather than {@code successCount}, and it stays out of
     * {@code failureCount} and the failure rate.
     */
    EXPECTED_FAILURE,

    FAILURE,

    /**
     * The request was aborted because the run stopped. Not counted as a failure.
     */
    CANCELLED;

    public boolean isSuccessful() {
        return this == SUCCESS || this == EXPECTED_FAILURE;
    }

    public boolean countsAsFailure() {
        return this == FAILURE;
    }
}
