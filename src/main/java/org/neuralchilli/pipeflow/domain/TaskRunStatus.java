package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Observed state of a task-run (or condition check), written by the task engine.
 * {@code retriesStatus} holds one entry per failed attempt that was retried.
 */
public record TaskRunStatus(
        StatusCondition condition,
        Instant startTime,
        Instant completionTime,
        String podName,
        List<TaskRunResult> taskResults,
        List<TaskRunStatus> retriesStatus
) implements Serializable {

    public static final TaskRunStatus EMPTY = new TaskRunStatus(null, null, null, null, List.of(), List.of());

    public TaskRunStatus {
        taskResults = taskResults == null ? List.of() : List.copyOf(taskResults);
        retriesStatus = retriesStatus == null ? List.of() : List.copyOf(retriesStatus);
    }

    public static TaskRunStatus of(StatusCondition condition) {
        return new TaskRunStatus(condition, null, null, null, List.of(), List.of());
    }

    public boolean isSucceeded() {
        return condition != null && condition.isTrue();
    }

    public boolean isFailed() {
        return condition != null && condition.isFalse();
    }

    public boolean isDone() {
        return condition != null && !condition.isUnknown();
    }

    public boolean isCancelled() {
        return isFailed() && TaskRunReason.CANCELLED.equals(condition.reason());
    }

    /**
     * Value of a named result, or null if the task-run did not emit it.
     */
    public String result(String name) {
        return taskResults.stream()
                .filter(r -> r.name().equals(name))
                .map(TaskRunResult::value)
                .findFirst()
                .orElse(null);
    }

    public TaskRunStatus withCondition(StatusCondition newCondition) {
        return new TaskRunStatus(newCondition, startTime, completionTime, podName, taskResults, retriesStatus);
    }

    public TaskRunStatus withResults(List<TaskRunResult> results) {
        return new TaskRunStatus(condition, startTime, completionTime, podName, results, retriesStatus);
    }

    /**
     * Archive the current attempt into the retry history and reset to a fresh, unknown attempt.
     */
    public TaskRunStatus forRetry(Instant at) {
        List<TaskRunStatus> history = new ArrayList<>(retriesStatus);
        history.add(new TaskRunStatus(condition, startTime, completionTime, podName, taskResults, List.of()));
        StatusCondition reset = StatusCondition.unknown(TaskRunReason.RETRYING,
                "Retrying after failed attempt " + history.size(), at);
        return new TaskRunStatus(reset, null, null, null, List.of(), history);
    }
}
