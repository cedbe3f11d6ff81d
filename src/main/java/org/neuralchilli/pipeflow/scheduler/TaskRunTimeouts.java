package org.neuralchilli.pipeflow.scheduler;

import org.neuralchilli.pipeflow.domain.PipelineRun;
import org.neuralchilli.pipeflow.domain.PipelineTask;

import java.time.Duration;
import java.time.Instant;

/**
 * Timeout given to a new task-run so it cannot outlive its pipeline run.
 */
public final class TaskRunTimeouts {

    static final Duration EXPIRED = Duration.ofSeconds(1);

    private TaskRunTimeouts() {
    }

    /**
     * Zero when neither the run nor the task has a timeout; one second when the run's
     * time is already up; otherwise the smaller of the time left and the task's own timeout.
     */
    public static Duration forTask(PipelineRun run, PipelineTask task, Instant now, Duration defaultTimeout) {
        Duration taskTimeout = task.timeout() != null && !task.timeout().isZero() ? task.timeout() : null;
        Duration runTimeout = run.timeout(defaultTimeout);

        if (runTimeout.isZero()) {
            return taskTimeout != null ? taskTimeout : Duration.ZERO;
        }

        Instant start = run.status().startTime() != null ? run.status().startTime() : now;
        Duration remaining = runTimeout.minus(Duration.between(start, now));
        if (remaining.isZero() || remaining.isNegative()) {
            return EXPIRED;
        }
        if (taskTimeout != null && taskTimeout.compareTo(remaining) < 0) {
            return taskTimeout;
        }
        return remaining;
    }
}
