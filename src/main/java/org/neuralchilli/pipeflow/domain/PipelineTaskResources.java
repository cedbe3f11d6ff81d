package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.util.List;

public record PipelineTaskResources(
        List<PipelineTaskInputResource> inputs,
        List<PipelineTaskOutputResource> outputs
) implements Serializable {

    public static final PipelineTaskResources NONE = new PipelineTaskResources(List.of(), List.of());

    public PipelineTaskResources {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    public boolean isEmpty() {
        return inputs.isEmpty() && outputs.isEmpty();
    }
}
