package com.fastbatch.core.failure;

import com.fastbatch.core.failure.decider.IoHandler;
import com.fastbatch.core.failure.decider.NonRetryableHandler;
import com.fastbatch.core.failure.decider.OpenCircuitHandler;
import com.fastbatch.core.failure.decider.TimeoutHandler;
import com.fastbatch.core.failure.decider.UnknownHandler;
import com.fastbatch.core.spi.failure.FailureDecider;
import com.fastbatch.exception.NonRetryableTaskException;
import com.fastbatch.exception.guard.DownstreamOpenCircuitException;
import com.fastbatch.model.ctx.TaskContext;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class RouterFailureDeciderTest {

    private final TaskContext ctx = TaskContext.builder().batchId("b").taskId("t").build();

    private RouterFailureDecider decider(boolean retryUnknown) {
        return new RouterFailureDecider(List.of(
                new UnknownHandler(retryUnknown),
                new TimeoutHandler(),
                new OpenCircuitHandler(),
                new IoHandler(),
                new NonRetryableHandler<>(NonRetryableTaskException.class)));
    }

    @Test
    void routesByExceptionType() {
        RouterFailureDecider d = decider(true);

        assertThat(d.decide(new TimeoutException(), ctx).getCategory()).isEqualTo(FailureDecider.Category.TIMEOUT);
        assertThat(d.decide(new IOException(), ctx).getCategory()).isEqualTo(FailureDecider.Category.IO);
        assertThat(d.decide(new DownstreamOpenCircuitException(new RuntimeException()), ctx).getCode())
                .isEqualTo("CB_OPEN");
        assertThat(d.decide(new NonRetryableTaskException("x"), ctx).isRetry()).isFalse();
    }

    @Test
    void picksNearestHandlerInHierarchy() {
        // FileNotFoundException -> IOException 比 Throwable 更近
        FailureDecider.Decision decision = decider(true).decide(new FileNotFoundException("f"), ctx);

        assertThat(decision.getCategory()).isEqualTo(FailureDecider.Category.IO);
        assertThat(decision.isRetry()).isTrue();
    }

    @Test
    void wrappedNonRetryable_failsFromCause() {
        // given
        RuntimeException wrapped = new RuntimeException("wrapper", new NonRetryableTaskException("x"));

        // when
        FailureDecider.Decision decision = decider(true).decide(wrapped, ctx);

        // then
        assertThat(decision.isRetry()).isFalse();
        assertThat(decision.getCategory()).isEqualTo(FailureDecider.Category.NON_RETRYABLE);
    }

    @Test
    void wrappedIo_retriedEvenWhenUnknownIsNot() {
        // given
        UncheckedIOException wrapped = new UncheckedIOException(new IOException("reset"));

        // when
        FailureDecider.Decision decision = decider(false).decide(wrapped, ctx);

        // then
        assertThat(decision.isRetry()).isTrue();
        assertThat(decision.getCategory()).isEqualTo(FailureDecider.Category.IO);
    }

    @Test
    void outerSpecificHandlerWinsOverCause() {
        // given
        TimeoutException outer = new TimeoutException("slow");
        outer.initCause(new NonRetryableTaskException("x"));

        // when
        FailureDecider.Decision decision = decider(true).decide(outer, ctx);

        // then
        assertThat(decision.getCategory()).isEqualTo(FailureDecider.Category.TIMEOUT);
    }

    @Test
    void selfReferencingCause_fallsBackToCatchAll() {
        // given
        IllegalStateException a = new IllegalStateException("a");
        IllegalStateException b = new IllegalStateException("b", a);
        a.initCause(b);

        // when
        FailureDecider.Decision decision = decider(false).decide(a, ctx);

        // then
        assertThat(decision.isRetry()).isFalse();
        assertThat(decision.getCode()).isEqualTo("UNHANDLED");
    }

    @Test
    void equalDistance_firstRegisteredWins() {
        // given
        RouterFailureDecider configuredFirst = new RouterFailureDecider(List.of(
                new NonRetryableHandler<>(IOException.class),
                new IoHandler()));

        // when
        FailureDecider.Decision decision = configuredFirst.decide(new IOException(), ctx);

        // then
        assertThat(decision.isRetry()).isFalse();
        assertThat(decision.getCategory()).isEqualTo(FailureDecider.Category.NON_RETRYABLE);
    }

    @Test
    void unknownFollowsRetryUnknownFlag() {
        assertThat(decider(true).decide(new IllegalStateException(), ctx).isRetry()).isTrue();
        assertThat(decider(false).decide(new IllegalStateException(), ctx).isRetry()).isFalse();
        assertThat(decider(false).decide(new IllegalStateException(), ctx).getCode()).isEqualTo("UNHANDLED");
    }

    @Test
    void withoutHandlers_defaultsToRetryUnknown() {
        FailureDecider.Decision decision = new RouterFailureDecider(List.of()).decide(new RuntimeException(), ctx);

        assertThat(decision.isRetry()).isTrue();
        assertThat(decision.getCategory()).isEqualTo(FailureDecider.Category.UNKNOWN);
    }
}
