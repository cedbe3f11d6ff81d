package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;

/**
 * Status entry of one condition check. {@code conditionName} holds the register name
 * ({@code <condition>-<index>}); {@code status} is null until observed.
 */
public record PipelineRunConditionCheckStatus(String conditionName, TaskRunStatus status) implements Serializable {

    public PipelineRunConditionCheckStatus {
        if (conditionName == null || conditionName.isBlank()) {
            throw new IllegalArgumentException("Condition check status must name its condition");
        }
    }

    public PipelineRunConditionCheckStatus withStatus(TaskRunStatus newStatus) {
        return new PipelineRunConditionCheckStatus(conditionName, newStatus);
    }
}
