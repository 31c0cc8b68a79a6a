package com.example.vrudetect_backend.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JobStateTest {

    @Test
    void happyPathTransitions() {
        assertThat(JobState.QUEUED.canTransitionTo(JobState.RUNNING)).isTrue();
        assertThat(JobState.RUNNING.canTransitionTo(JobState.FINALIZING)).isTrue();
        assertThat(JobState.FINALIZING.canTransitionTo(JobState.COMPLETED)).isTrue();
        assertThat(JobState.FINALIZING.canTransitionTo(JobState.TIMED_OUT)).isTrue();
        assertThat(JobState.FINALIZING.canTransitionTo(JobState.CANCELLED)).isTrue();
    }

    @Test
    void onlyFailureMayBypassFinalizing() {
        assertThat(JobState.RUNNING.canTransitionTo(JobState.FAILED)).isTrue();
        assertThat(JobState.RUNNING.canTransitionTo(JobState.COMPLETED)).isFalse();
        assertThat(JobState.RUNNING.canTransitionTo(JobState.CANCELLED)).isFalse();
        assertThat(JobState.QUEUED.canTransitionTo(JobState.FINALIZING)).isFalse();
    }

    @Test
    void terminalStatesAreFinal() {
        for (JobState terminal : new JobState[]{JobState.COMPLETED, JobState.TIMED_OUT, JobState.FAILED, JobState.CANCELLED}) {
            assertThat(terminal.isTerminal()).isTrue();
            for (JobState next : JobState.values()) {
                assertThat(terminal.canTransitionTo(next)).isFalse();
            }
        }
        assertThat(JobState.FINALIZING.isTerminal()).isFalse();
    }
}
