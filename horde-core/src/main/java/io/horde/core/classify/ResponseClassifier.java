package io.horde.core.classify;

import io.horde.api.classify.Classification;
import io.horde.api.classify.ClassificationPolicy;
import io.horde.api.outcome.ErrorKind;
import io.horde.api.outcome.RequestOutcome;

/**
 * Maps a request outcome to a verdict using the calling task's policy table.
 * <p>
 * Outcomes without a status code never reach the policy: cancellations are
 * {@code CANCELLED}, everything else is a failure.
 */
public final class ResponseClassifier {

    public Classification classify(RequestOutcome outcome, ClassificationPolicy policy) {
        if (outcome.isError()) {
            return classifyError(outcome);
        }
        int status = outcome.statusCode();
        ClassificationPolicy effective = policy == null ? ClassificationPolicy.defaults() : policy;
        return effective.ruleFor(status)
                .orElseGet(() -> Classification.failure("unexpected status " + status));
    }

    private Classification classifyError(RequestOutcome outcome) {
        ErrorKind kind = outcome.errorKind();
        if (kind == ErrorKind.CANCELLED) {
            return Classification.cancelled();
        }
        if (kind == ErrorKind.TASK) {
            return Classification.failure("task error: " + outcome.errorMessage());
        }
        return Classification.failure("transport error: " + kind.label());
    }
}
