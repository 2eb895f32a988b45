package io.horde.api.classify;

/**
 * A verdict plus a human readable reason ({@code null} for plain successes).
 */
public record Classification(Verdict verdict, String reason) {

    private static final Classification SUCCESS = new Classification(Verdict.SUCCESS, null);
    private static final Classification CANCELLED = new Classification(Verdict.CANCELLED, "cancelled");

    public Classification {
        if (verdict == null) {
            throw new IllegalArgumentException("Verdict must not be null");
        }
    }

    public static Classification success() {
        return SUCCESS;
    }

    public static Classification expectedFailure(String reason) {
        return new Classification(Verdict.EXPECTED_FAILURE, reason);
    }

    public static Classification failure(String reason) {
        return new Classification(Verdict.FAILURE, reason);
    }

    public static Classification cancelled() {
        return CANCELLED;
    }
}
