package com.fastbatch.core.ratelimit;

import com.fastbatch.core.time.TimeSource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpacingRateLimiterTest {

    /** 虚拟时钟, sleep 直接推进时间 */
    static final class FakeTime implements TimeSource {
        private long now = 1_000;
        private final List<Long> sleeps = new ArrayList<>();

        @Override
        public synchronized long nowMillis() {
            return now;
        }

        @Override
        public synchronized void sleep(long millis) {
            sleeps.add(millis);
            now += millis;
        }

        synchronized void advance(long millis) {
            now += millis;
        }
    }

    @Test
    void firstGrantIsImmediate_thenSpacedByDelay() throws Exception {
        // given
        FakeTime time = new FakeTime();
        SpacingRateLimiter limiter = new SpacingRateLimiter(200, time);

        // when
        long g1 = limiter.awaitSlot();
        long g2 = limiter.awaitSlot();
        long g3 = limiter.awaitSlot();

        // then
        assertThat(g1).isEqualTo(1_000);
        assertThat(g2 - g1).isEqualTo(200);
        assertThat(g3 - g2).isEqualTo(200);
        assertThat(time.sleeps).containsExactly(200L, 200L);
    }

    @Test
    void noWait_whenEnoughTimeAlreadyElapsed() throws Exception {
        // given
        FakeTime time = new FakeTime();
        SpacingRateLimiter limiter = new SpacingRateLimiter(200, time);
        limiter.awaitSlot();

        // when
        time.advance(500);
        long g = limiter.awaitSlot();

        // then
        assertThat(g).isEqualTo(1_500);
        assertThat(time.sleeps).isEmpty();
    }

    @Test
    void zeroDelay_neverSleeps() throws Exception {
        FakeTime time = new FakeTime();
        SpacingRateLimiter limiter = new SpacingRateLimiter(0, time);

        for (int i = 0; i < 5; i++) {
            limiter.awaitSlot();
        }

        assertThat(time.sleeps).isEmpty();
    }

    @Test
    void grantsAcrossThreadsAreGloballySpaced() throws Exception {
        // given
        SpacingRateLimiter limiter = new SpacingRateLimiter(20);
        List<Long> grants = Collections.synchronizedList(new ArrayList<>());
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);

        // when
        for (int t = 0; t < 4; t++) {
            pool.execute(() -> {
                try {
                    for (int i = 0; i < 3; i++) {
                        grants.add(limiter.awaitSlot());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        pool.shutdownNow();

        // then
        List<Long> sorted = new ArrayList<>(grants);
        Collections.sort(sorted);
        assertThat(sorted).hasSize(12);
        for (int i = 1; i < sorted.size(); i++) {
            assertThat(sorted.get(i) - sorted.get(i - 1)).isGreaterThanOrEqualTo(20);
        }
    }

    @Test
    void rejectsNegativeDelay() {
        assertThatThrownBy(() -> new SpacingRateLimiter(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
