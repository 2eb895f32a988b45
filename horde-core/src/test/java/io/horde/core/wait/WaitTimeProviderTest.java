package io.horde.core.wait;

import io.horde.api.ConfigurationException;
import io.horde.api.profile.WaitTime;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.SplittableRandom;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WaitTimeProviderTest {

    @Test
    void shouldStayWithinBounds() {
        WaitTimeProvider provider = new WaitTimeProvider(new SplittableRandom(7));
        Duration min = Duration.ofMillis(100);
        Duration max = Duration.ofMillis(500);

        for (int i = 0; i < 5_000; i++) {
            assertThat(provider.next(min, max)).isBetween(min, max);
        }
    }

    @Test
    void shouldCoverTheWholeRange() {
        WaitTimeProvider provider = new WaitTimeProvider(new SplittableRandom(11));
        WaitTime waitTime = WaitTime.between(Duration.ZERO, Duration.ofMillis(9));

        long distinct = IntStream.range(0, 2_000)
                .mapToLong(i -> provider.next(waitTime).toMillis())
                .distinct()
                .count();

        assertThat(distinct).isEqualTo(10);
    }

    @Test
    void shouldReturnConstantForEqualBounds() {
        WaitTimeProvider provider = new WaitTimeProvider(new SplittableRandom());

        assertThat(provider.next(WaitTime.constant(Duration.ofSeconds(2)))).isEqualTo(Duration.ofSeconds(2));
        assertThat(provider.next(WaitTime.none())).isZero();
    }

    @Test
    void shouldBeReproducibleWithTheSameSeed() {
        WaitTimeProvider first = new WaitTimeProvider(new SplittableRandom(42));
        WaitTimeProvider second = new WaitTimeProvider(new SplittableRandom(42));
        WaitTime waitTime = WaitTime.between(Duration.ofSeconds(1), Duration.ofSeconds(5));

        for (int i = 0; i < 100; i++) {
            assertThat(first.next(waitTime)).isEqualTo(second.next(waitTime));
        }
    }

    @Test
    void shouldRejectInvertedBounds() {
        WaitTimeProvider provider = new WaitTimeProvider(new SplittableRandom());

        assertThatThrownBy(() -> provider.next(Duration.ofSeconds(2), Duration.ofSeconds(1)))
                .isInstanceOf(ConfigurationException.class);
    }
}
