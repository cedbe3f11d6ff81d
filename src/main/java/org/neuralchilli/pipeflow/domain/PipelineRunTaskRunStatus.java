package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

/**
 * Status entry for one pipeline task, keyed in the run status by task-run name.
 */
public record PipelineRunTaskRunStatus(
        String pipelineTaskName,
        TaskRunStatus status,
        Map<String, PipelineRunConditionCheckStatus> conditionChecks
) implements Serializable {

    public PipelineRunTaskRunStatus {
        if (pipelineTaskName == null || pipelineTaskName.isBlank()) {
            throw new IllegalArgumentException("Task-run status must name its pipeline task");
        }
        conditionChecks = conditionChecks == null ? Map.of() : Map.copyOf(conditionChecks);
    }

    public static PipelineRunTaskRunStatus of(String pipelineTaskName, TaskRunStatus status) {
        return new PipelineRunTaskRunStatus(pipelineTaskName, status, Map.of());
    }

    public PipelineRunTaskRunStatus withStatus(TaskRunStatus newStatus) {
        return new PipelineRunTaskRunStatus(pipelineTaskName, newStatus, conditionChecks);
    }

    public PipelineRunTaskRunStatus withConditionCheck(String checkName, PipelineRunConditionCheckStatus check) {
        Map<String, PipelineRunConditionCheckStatus> merged = new HashMap<>(conditionChecks);
        merged.put(checkName, check);
        return new PipelineRunTaskRunStatus(pipelineTaskName, status, merged);
    }

    /**
     * Name of the check registered under {@code registerName}, or null.
     */
    public String conditionCheckName(String registerName) {
        return conditionChecks.entrySet().stream()
                .filter(e -> e.getValue().conditionName().equals(registerName))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(null);
    }
}
