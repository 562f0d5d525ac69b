package com.fastbatch.core.retry;

import com.fastbatch.core.backoff.BackoffRegistry;
import com.fastbatch.core.failure.RouterFailureDecider;
import com.fastbatch.core.failure.decider.NonRetryableHandler;
import com.fastbatch.core.failure.decider.TimeoutHandler;
import com.fastbatch.core.failure.decider.UnknownHandler;
import com.fastbatch.core.spi.failure.FailureDecider;
import com.fastbatch.exception.NonRetryableTaskException;
import com.fastbatch.model.RetryPolicy;
import com.fastbatch.model.ctx.TaskContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class RetryControllerTest {

    private final RetryController controller = new RetryController(new BackoffRegistry());

    private final FailureDecider decider = new RouterFailureDecider(List.of(
            new TimeoutHandler(),
            new NonRetryableHandler<>(NonRetryableTaskException.class),
            new UnknownHandler(true)));

    private final RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(2).baseDelayMs(100).backoffMultiplier(3).build();

    @Test
    void shouldRetry_untilAttemptNumberReachesMax() {
        assertThat(controller.shouldRetry(0, policy)).isTrue();
        assertThat(controller.shouldRetry(1, policy)).isTrue();
        assertThat(controller.shouldRetry(2, policy)).isFalse();
        assertThat(controller.shouldRetry(3, policy)).isFalse();
    }

    @Test
    void zeroMaxAttempts_neverRetries() {
        RetryPolicy none = policy.toBuilder().maxAttempts(0).build();

        assertThat(controller.shouldRetry(0, none)).isFalse();
    }

    @Test
    void nextDelay_followsBackoff() {
        assertThat(controller.nextDelay(0, policy)).isEqualTo(100);
        assertThat(controller.nextDelay(1, policy)).isEqualTo(300);
    }

    @Test
    void decide_retryableWithinBudget() {
        // given
        TaskContext ctx = TaskContext.builder().taskId("t").attempt(1).maxAttempts(2).build();

        // when
        RetryDecision d = controller.decide(new TimeoutException("slow"), ctx, policy, decider);

        // then
        assertThat(d.isRetry()).isTrue();
        assertThat(d.getDelayMs()).isEqualTo(300);
        assertThat(d.getReason()).isEqualTo("TIMEOUT");
    }

    @Test
    void decide_exhaustedBudget_failsWithMaxRetry() {
        // given
        TaskContext ctx = TaskContext.builder().taskId("t").attempt(2).maxAttempts(2).build();

        // when
        RetryDecision d = controller.decide(new IllegalStateException("boom"), ctx, policy, decider);

        // then
        assertThat(d.isRetry()).isFalse();
        assertThat(d.getDelayMs()).isEqualTo(-1);
        assertThat(d.getReason()).isEqualTo(RetryController.REASON_MAX_RETRY);
        assertThat(d.getDecision().getCategory()).isEqualTo(FailureDecider.Category.UNKNOWN);
    }

    @Test
    void decide_nonRetryable_failsImmediately() {
        // given
        TaskContext ctx = TaskContext.builder().taskId("t").attempt(0).maxAttempts(2).build();

        // when
        RetryDecision d = controller.decide(new NonRetryableTaskException("bad input"), ctx, policy, decider);

        // then
        assertThat(d.isRetry()).isFalse();
        assertThat(d.getReason()).isEqualTo("NON_RETRYABLE");
    }
}
