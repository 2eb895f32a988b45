package io.horde.core.classify;

import io.horde.api.classify.Classification;
import io.horde.api.classify.ClassificationPolicy;
import io.horde.api.classify.Verdict;
import io.horde.api.outcome.ErrorKind;
import io.horde.api.outcome.RequestOutcome;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseClassifierTest {

    private final ResponseClassifier classifier = new ResponseClassifier();

    private static RequestOutcome status(int code) {
        return RequestOutcome.response("/api/chat", code, Duration.ofMillis(20), 10, Instant.now());
    }

    private static RequestOutcome error(ErrorKind kind) {
        return RequestOutcome.error("/api/chat", kind, Duration.ofMillis(20), "boom", Instant.now());
    }

    // --- Default policy ---

    @Test
    void shouldClassify2xxAsSuccess() {
        assertThat(classifier.classify(status(200), ClassificationPolicy.defaults()).verdict()).isEqualTo(Verdict.SUCCESS);
        assertThat(classifier.classify(status(201), ClassificationPolicy.defaults()).verdict()).isEqualTo(Verdict.SUCCESS);
    }

    @Test
    void shouldClassify429AsRateLimitedUnderDefaultPolicy() {
        Classification result = classifier.classify(status(429), ClassificationPolicy.defaults());

        assertThat(result.verdict()).isEqualTo(Verdict.FAILURE);
        assertThat(result.reason()).contains("rate limited");
    }

    @Test
    void shouldClassifyUnmatchedStatusAsFailureWithCode() {
        Classification result = classifier.classify(status(503), ClassificationPolicy.defaults());

        assertThat(result.verdict()).isEqualTo(Verdict.FAILURE);
        assertThat(result.reason()).contains("503");
    }

    @Test
    void shouldUseDefaultsWhenPolicyIsMissing() {
        assertThat(classifier.classify(status(429), null).verdict()).isEqualTo(Verdict.FAILURE);
    }

    // --- Per-task overrides ---

    @Test
    void shouldHonor429OverrideOfBurstTask() {
        ClassificationPolicy burst = ClassificationPolicy.defaults()
                .with(429, Verdict.SUCCESS, "throttled as expected");

        assertThat(classifier.classify(status(429), burst).verdict()).isEqualTo(Verdict.SUCCESS);
    }

    @Test
    void shouldCountTolerated429AsSuccessfulNotFailed() {
        ClassificationPolicy tolerant = ClassificationPolicy.defaults().tolerating(429);

        Classification result = classifier.classify(status(429), tolerant);

        assertThat(result.verdict()).isEqualTo(Verdict.EXPECTED_FAILURE);
        assertThat(result.verdict().isSuccessful()).isTrue();
        assertThat(result.verdict().countsAsFailure()).isFalse();
    }

    // --- Errors ---

    @Test
    void shouldAlwaysFailTimeoutsEvenWhenPolicyIsLenient() {
        ClassificationPolicy lenient = ClassificationPolicy.defaults().successRange(100, 599);

        Classification result = classifier.classify(error(ErrorKind.TIMEOUT), lenient);

        assertThat(result.verdict()).isEqualTo(Verdict.FAILURE);
        assertThat(result.reason()).isEqualTo("transport error: timeout");
    }

    @Test
    void shouldFailConnectionErrors() {
        assertThat(classifier.classify(error(ErrorKind.CONNECTION), ClassificationPolicy.defaults()).reason())
                .startsWith("transport error");
    }

    @Test
    void shouldReportTaskErrors() {
        Classification result = classifier.classify(error(ErrorKind.TASK), ClassificationPolicy.defaults());

        assertThat(result.verdict()).isEqualTo(Verdict.FAILURE);
        assertThat(result.reason()).startsWith("task error");
    }

    @Test
    void shouldTagCancelledOutcomesSeparately() {
        Classification result = classifier.classify(error(ErrorKind.CANCELLED), ClassificationPolicy.defaults());

        assertThat(result.verdict()).isEqualTo(Verdict.CANCELLED);
        assertThat(result.verdict().countsAsFailure()).isFalse();
    }
}
