package io.horde.api.classify;

import io.horde.api.ConfigurationException;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-task table mapping HTTP status codes to verdicts.
 * <p>
 * Explicit status rules win over the success range. Codes matched by neither are left to the
 * classifier, which treats them as failures. Transport errors and timeouts are never looked up
 * here: they are always failures.
 * <p>
 * The default policy treats 2xx as success and 429 as a "rate limited" failure. Tasks that
 * provoke throttling on purpose override the 429 rule:
 * <pre>{@code
 * ClassificationPolicy.defaults().with(429, Verdict.SUCCESS, "throttled as expected");
 * }</pre>
 */
public final class ClassificationPolicy {

    public static final int TOO_MANY_REQUESTS = 429;

    private static final ClassificationPolicy DEFAULTS = new ClassificationPolicy(200, 299,
            Map.of(TOO_MANY_REQUESTS, Classification.failure("rate limited")));

    private final int successFrom;
    private final int successTo;
    private final Map<Integer, Classification> statusRules;

    private ClassificationPolicy(int successFrom, int successTo, Map<Integer, Classification> statusRules) {
        if (successFrom > successTo) {
            throw new ConfigurationException("Success range is empty: " + successFrom + ".." + successTo);
        }
        this.successFrom = successFrom;
        this.successTo = successTo;
        this.statusRules = Collections.unmodifiableMap(new TreeMap<>(statusRules));
    }

    public static ClassificationPolicy defaults() {
        return DEFAULTS;
    }

    /**
     * Return a copy of this policy with an explicit rule for one status code.
     */
    public ClassificationPolicy with(int statusCode, Verdict verdict, String reason) {
        if (statusCode < 100 || statusCode > 599) {
            throw new ConfigurationException("Not an HTTP status code: " + statusCode);
        }
        if (verdict == Verdict.CANCELLED) {
            throw new ConfigurationException("Status codes cannot be classified as cancelled");
        }
        Map<Integer, Classification> rules = new TreeMap<>(statusRules);
        rules.put(statusCode, new Classification(verdict, reason));
        return new ClassificationPolicy(successFrom, successTo, rules);
    }

    /**
     * Tolerate a status code: it is recorded as an expected failure, not as a failure.
     */
    /**
     * Tolerate a status code. Matching responses are {@link Verdict#EXPECTED_FAILURE}, which
     * counts as successful.
     */
    public ClassificationPolicy tolerating(int statusCode) {
        return with(statusCode, Verdict.EXPECTED_FAILURE, "tolerated status " + statusCode);
    }

    public ClassificationPolicy successRange(int from, int to) {
        return new ClassificationPolicy(from, to, statusRules);
    }

    /**
     * Look up the rule for a status code.
     *
     * @return the classification, or empty when the policy does not cover the code
     */
    public Optional<Classification> ruleFor(int statusCode) {
        Classification explicit = statusRules.get(statusCode);
        if (explicit != null) {
            return Optional.of(explicit);
        }
        if (statusCode >= successFrom && statusCode <= successTo) {
            return Optional.of(Classification.success());
        }
        return Optional.empty();
    }

    public Map<Integer, Classification> statusRules() {
        return statusRules;
    }

    @Override
    public String toString() {
        return "ClassificationPolicy[success=" + successFrom + ".." + successTo + ", rules=" + statusRules + "]";
    }
}
