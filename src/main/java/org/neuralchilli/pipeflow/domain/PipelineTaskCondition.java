package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.util.List;

/**
 * Condition gating a pipeline task, with the params and resources passed to its check.
 */
public record PipelineTaskCondition(
        String conditionRef,
        List<Param> params,
        List<PipelineTaskInputResource> resources
) implements Serializable {

    public PipelineTaskCondition {
        if (conditionRef == null || conditionRef.isBlank()) {
            throw new IllegalArgumentException("Condition reference cannot be null or empty");
        }
        params = params == null ? List.of() : List.copyOf(params);
        resources = resources == null ? List.of() : List.copyOf(resources);
    }

    public static PipelineTaskCondition of(String conditionRef) {
        return new PipelineTaskCondition(conditionRef, List.of(), List.of());
    }
}
