package com.fastbatch.model.enums;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TaskStateTest {

    @Test
    void terminalStatesHaveNoSuccessors() {
        for (TaskState terminal : new TaskState[]{TaskState.SUCCEEDED, TaskState.FAILED, TaskState.CANCELLED}) {
            assertThat(terminal.isTerminal()).isTrue();
            for (TaskState next : TaskState.values()) {
                assertThat(terminal.canTransitTo(next)).isFalse();
            }
        }
    }

    @Test
    void onlyWaitingStatesCanBeCancelled() {
        assertThat(TaskState.PENDING.canTransitTo(TaskState.CANCELLED)).isTrue();
        assertThat(TaskState.RETRYING.canTransitTo(TaskState.CANCELLED)).isTrue();
        assertThat(TaskState.ATTEMPTING.canTransitTo(TaskState.CANCELLED)).isFalse();
    }

    @Test
    void retryLoopsBackThroughAttempting() {
        assertThat(TaskState.ATTEMPTING.canTransitTo(TaskState.RETRYING)).isTrue();
        assertThat(TaskState.RETRYING.canTransitTo(TaskState.ATTEMPTING)).isTrue();
        assertThat(TaskState.RETRYING.canTransitTo(TaskState.SUCCEEDED)).isFalse();
        assertThat(TaskState.PENDING.canTransitTo(TaskState.SUCCEEDED)).isFalse();
    }
}
