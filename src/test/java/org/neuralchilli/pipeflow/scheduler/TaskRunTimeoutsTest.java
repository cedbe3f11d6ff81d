package org.neuralchilli.pipeflow.scheduler;

import org.junit.jupiter.api.Test;
import org.neuralchilli.pipeflow.domain.PipelineRun;
import org.neuralchilli.pipeflow.domain.PipelineRunSpec;
import org.neuralchilli.pipeflow.domain.PipelineTask;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TaskRunTimeoutsTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");
    private static final Duration DEFAULT = Duration.ofMinutes(60);

    private static PipelineRun started(Duration runTimeout) {
        PipelineRun run = PipelineRun.of("ns", "r", PipelineRunSpec.forPipeline("p").timeout(runTimeout).build());
        return run.withStatus(run.status().withStartTime(START));
    }

    private static PipelineTask task(Duration timeout) {
        PipelineTask.Builder builder = PipelineTask.builder("t").taskRef("echo");
        if (timeout != null) {
            builder.timeout(timeout);
        }
        return builder.build();
    }

    @Test
    void shouldGiveWhatIsLeftOfTheRun() {
        Duration timeout = TaskRunTimeouts.forTask(started(Duration.ofMinutes(30)), task(null),
                START.plus(Duration.ofMinutes(10)), DEFAULT);

        assertThat(timeout).isEqualTo(Duration.ofMinutes(20));
    }

    @Test
    void shouldPreferShorterTaskTimeout() {
        Duration timeout = TaskRunTimeouts.forTask(started(Duration.ofMinutes(30)), task(Duration.ofMinutes(5)),
                START, DEFAULT);

        assertThat(timeout).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void shouldCapLongerTaskTimeoutAtWhatIsLeft() {
        Duration timeout = TaskRunTimeouts.forTask(started(Duration.ofMinutes(30)), task(Duration.ofHours(2)),
                START.plus(Duration.ofMinutes(25)), DEFAULT);

        assertThat(timeout).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void shouldUseDefaultRunTimeoutWhenRunSetsNone() {
        PipelineRun run = PipelineRun.of("ns", "r", PipelineRunSpec.forPipeline("p").build());
        run = run.withStatus(run.status().withStartTime(START));

        assertThat(TaskRunTimeouts.forTask(run, task(null), START, DEFAULT)).isEqualTo(DEFAULT);
    }

    @Test
    void shouldGiveOneSecondOnceTheRunIsOutOfTime() {
        Duration timeout = TaskRunTimeouts.forTask(started(Duration.ofMinutes(1)), task(null),
                START.plus(Duration.ofMinutes(3)), DEFAULT);

        assertThat(timeout).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void shouldHaveNoTimeoutWhenRunHasNone() {
        assertThat(TaskRunTimeouts.forTask(started(Duration.ZERO), task(null), START.plus(Duration.ofDays(1)), DEFAULT))
                .isEqualTo(Duration.ZERO);
        assertThat(TaskRunTimeouts.forTask(started(Duration.ZERO), task(Duration.ofMinutes(7)), START, DEFAULT))
                .isEqualTo(Duration.ofMinutes(7));
    }
}
