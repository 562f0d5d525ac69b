package com.fastbatch.core.backoff;

import com.fastbatch.core.spi.BackoffPolicy;
import com.fastbatch.model.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BackoffRegistryTest {

    private final BackoffRegistry registry = new BackoffRegistry();

    @Test
    void exponentialWithoutJitter_growsByMultiplier() {
        // given
        RetryPolicy policy = RetryPolicy.builder().baseDelayMs(1000).backoffMultiplier(2.0).build();

        // when & then
        assertThat(registry.nextDelayMillis(0, policy)).isEqualTo(1000);
        assertThat(registry.nextDelayMillis(1, policy)).isEqualTo(2000);
        assertThat(registry.nextDelayMillis(2, policy)).isEqualTo(4000);
    }

    @Test
    void exponential_isCappedAtMaxDelay() {
        // given
        RetryPolicy policy = RetryPolicy.builder().baseDelayMs(1000).backoffMultiplier(10).maxDelayMs(5000).build();

        // when & then
        assertThat(registry.nextDelayMillis(5, policy)).isEqualTo(5000);
        assertThat(registry.nextDelayMillis(60, policy)).isEqualTo(5000);
    }

    @Test
    void jitter_staysWithinRatioAndNeverNegative() {
        // given
        RetryPolicy policy = RetryPolicy.builder()
                .baseDelayMs(1000).backoffMultiplier(2.0).jitterRatio(0.3).build();

        // when & then
        for (int attempt = 0; attempt < 4; attempt++) {
            long ideal = (long) (1000 * Math.pow(2, attempt));
            for (int i = 0; i < 500; i++) {
                long d = registry.nextDelayMillis(attempt, policy);
                assertThat(d).isNotNegative();
                assertThat(Math.abs(d - ideal)).isLessThanOrEqualTo((long) (0.3 * ideal));
            }
        }
    }

    @Test
    void fullJitter_canReachZeroButNotBelow() {
        // given
        RetryPolicy policy = RetryPolicy.builder().baseDelayMs(10).jitterRatio(1.0).build();

        // when & then
        for (int i = 0; i < 500; i++) {
            assertThat(registry.nextDelayMillis(0, policy)).isBetween(0L, 20L);
        }
    }

    @Test
    void fixedStrategy_ignoresAttemptNumber() {
        // given
        RetryPolicy policy = RetryPolicy.builder().baseDelayMs(250).backoffStrategy("fixed").build();

        // when & then
        assertThat(registry.nextDelayMillis(0, policy)).isEqualTo(250);
        assertThat(registry.nextDelayMillis(7, policy)).isEqualTo(250);
    }

    @Test
    void resolvesSpiPrefixedStrategy_andFallsBackToExponential() {
        // given
        BackoffPolicy linear = new BackoffPolicy() {
            @Override
            public String name() {
                return "linear";
            }

            @Override
            public long nextDelayMillis(int attemptNumber, RetryPolicy policy) {
                return policy.getBaseDelayMs() * (attemptNumber + 1);
            }
        };
        BackoffRegistry withSpi = new BackoffRegistry(List.of(linear));

        // when & then
        assertThat(withSpi.resolve("spi:linear")).isSameAs(linear);
        assertThat(withSpi.resolve("LINEAR")).isSameAs(linear);
        assertThat(withSpi.resolve("nope").name()).isEqualTo("exponential");
        assertThat(withSpi.resolve(null).name()).isEqualTo("exponential");
        assertThat(withSpi.names()).contains("fixed", "exponential", "linear");
    }
}
