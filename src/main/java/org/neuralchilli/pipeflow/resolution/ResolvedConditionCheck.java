package org.neuralchilli.pipeflow.resolution;

import org.neuralchilli.pipeflow.domain.Condition;
import org.neuralchilli.pipeflow.domain.PipelineTaskCondition;
import org.neuralchilli.pipeflow.domain.TaskRun;

import java.util.Map;

/**
 * One condition gating a pipeline task, with the check task-run if it exists.
 *
 * @param registerName {@code <condition>-<index>}, stable across passes
 * @param checkName    name of the check task-run
 * @param resources    condition resources keyed by the condition's resource name
 */
public record ResolvedConditionCheck(
        String registerName,
        String checkName,
        PipelineTaskCondition pipelineTaskCondition,
        Condition condition,
        Map<String, ResolvedResource> resources,
        TaskRun checkRun
) {

    public ResolvedConditionCheck {
        resources = resources == null ? Map.of() : Map.copyOf(resources);
    }

    public String conditionName() {
        return pipelineTaskCondition.conditionRef();
    }

    public boolean isStarted() {
        return checkRun != null;
    }

    public boolean isSucceeded() {
        return checkRun != null && checkRun.isSucceeded();
    }

    public boolean isFailed() {
        return checkRun != null && checkRun.isFailed();
    }

    public ResolvedConditionCheck withCheckRun(TaskRun run) {
        return new ResolvedConditionCheck(registerName, checkName, pipelineTaskCondition, condition, resources, run);
    }
}
