package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted state of a pipeline run.
 * {@code taskRuns} is keyed by generated task-run name.
 */
public record PipelineRunStatus(
        StatusCondition condition,
        Instant startTime,
        Instant completionTime,
        Map<String, PipelineRunTaskRunStatus> taskRuns,
        List<PipelineRunResult> pipelineResults,
        PipelineSpec pipelineSpec
) implements Serializable {

    public static final PipelineRunStatus EMPTY = new PipelineRunStatus(null, null, null, Map.of(), List.of(), null);

    public PipelineRunStatus {
        taskRuns = taskRuns == null ? Map.of() : Map.copyOf(taskRuns);
        pipelineResults = pipelineResults == null ? List.of() : List.copyOf(pipelineResults);
    }

    public boolean isDone() {
        return condition != null && condition.status().isTerminal();
    }

    public PipelineRunStatus withCondition(StatusCondition newCondition) {
        return new PipelineRunStatus(newCondition, startTime, completionTime, taskRuns, pipelineResults, pipelineSpec);
    }

    public PipelineRunStatus withStartTime(Instant at) {
        return new PipelineRunStatus(condition, at, completionTime, taskRuns, pipelineResults, pipelineSpec);
    }

    public PipelineRunStatus withCompletionTime(Instant at) {
        return new PipelineRunStatus(condition, startTime, at, taskRuns, pipelineResults, pipelineSpec);
    }

    public PipelineRunStatus withTaskRuns(Map<String, PipelineRunTaskRunStatus> newTaskRuns) {
        return new PipelineRunStatus(condition, startTime, completionTime, newTaskRuns, pipelineResults, pipelineSpec);
    }

    /**
     * Copy with one task-run entry added or replaced.
     */
    public PipelineRunStatus withTaskRun(String taskRunName, PipelineRunTaskRunStatus entry) {
        Map<String, PipelineRunTaskRunStatus> merged = new HashMap<>(taskRuns);
        merged.put(taskRunName, entry);
        return withTaskRuns(merged);
    }

    public PipelineRunStatus withPipelineResults(List<PipelineRunResult> results) {
        return new PipelineRunStatus(condition, startTime, completionTime, taskRuns, results, pipelineSpec);
    }

    public PipelineRunStatus withPipelineSpec(PipelineSpec spec) {
        return new PipelineRunStatus(condition, startTime, completionTime, taskRuns, pipelineResults, spec);
    }

    /**
     * Name of the task-run recorded for a pipeline task, or null.
     */
    public String taskRunNameFor(String pipelineTaskName) {
        return taskRuns.entrySet().stream()
                .filter(e -> e.getValue().pipelineTaskName().equals(pipelineTaskName))
                .map(Map.Entry::getKey)
                .sorted()
                .findFirst()
                .orElse(null);
    }
}
