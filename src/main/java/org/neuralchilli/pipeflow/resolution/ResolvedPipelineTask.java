package org.neuralchilli.pipeflow.resolution;

import org.neuralchilli.pipeflow.domain.PipelineTask;
import org.neuralchilli.pipeflow.domain.TaskKind;
import org.neuralchilli.pipeflow.domain.TaskRun;
import org.neuralchilli.pipeflow.domain.TaskSpec;

import java.util.List;
import java.util.Map;

/**
 * A pipeline task with everything it needs resolved for this pass. Never persisted.
 *
 * @param taskRunName    task-run name, reused from the run status when recorded there
 * @param taskRun        the existing task-run, or null if not created yet
 * @param taskName       referenced task name, null for inline specs
 * @param resources      bound pipeline resources keyed by pipeline resource name
 * @param conditionChecks one entry per condition, in declaration order
 */
public record ResolvedPipelineTask(
        PipelineTask pipelineTask,
        String taskRunName,
        TaskRun taskRun,
        TaskKind kind,
        String taskName,
        TaskSpec taskSpec,
        Map<String, ResolvedResource> resources,
        List<ResolvedConditionCheck> conditionChecks
) {

    public ResolvedPipelineTask {
        resources = resources == null ? Map.of() : Map.copyOf(resources);
        conditionChecks = conditionChecks == null ? List.of() : List.copyOf(conditionChecks);
    }

    public String name() {
        return pipelineTask.name();
    }

    public boolean isStarted() {
        return taskRun != null;
    }

    public boolean isSuccessful() {
        return taskRun != null && taskRun.isSucceeded();
    }

    /**
     * Failed for good: cancelled, or failed with no retries left.
     */
    public boolean isFailure() {
        if (taskRun == null || !taskRun.isFailed()) {
            return false;
        }
        return taskRun.status().isCancelled() || taskRun.spec().isCancelled() || !hasRetriesLeft();
    }

    /**
     * Failed, not cancelled, and allowed another attempt.
     */
    public boolean isRetryable() {
        return taskRun != null
                && taskRun.isFailed()
                && !taskRun.status().isCancelled()
                && !taskRun.spec().isCancelled()
                && hasRetriesLeft();
    }

    public boolean hasConditions() {
        return !conditionChecks.isEmpty();
    }

    public boolean isConditionCheckFailure() {
        return conditionChecks.stream().anyMatch(ResolvedConditionCheck::isFailed);
    }

    public boolean conditionChecksSucceeded() {
        return conditionChecks.stream().allMatch(ResolvedConditionCheck::isSucceeded);
    }

    public ResolvedPipelineTask withTaskRun(TaskRun run) {
        return new ResolvedPipelineTask(pipelineTask, taskRunName, run, kind, taskName, taskSpec, resources, conditionChecks);
    }

    public ResolvedPipelineTask withConditionChecks(List<ResolvedConditionCheck> checks) {
        return new ResolvedPipelineTask(pipelineTask, taskRunName, taskRun, kind, taskName, taskSpec, resources, checks);
    }

    private boolean hasRetriesLeft() {
        return taskRun.status().retriesStatus().size() < pipelineTask.retries();
    }
}
