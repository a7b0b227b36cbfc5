package io.github.drompincen.javacron.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JobStatusTest {

    @Test
    void terminalStatuses() {
        assertThat(JobStatus.values()).filteredOn(JobStatus::isTerminal)
                .containsExactly(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED);
    }

    @Test
    void queuedResultMentionsJob() {
        ExecutionResult result = ExecutionResult.queued("job-9", 4);

        assertThat(result.success()).isTrue();
        assertThat(result.jobId()).isEqualTo("job-9");
        assertThat(result.output()).contains("job-9");
        assertThat(result.condition()).isNull();
    }
}
