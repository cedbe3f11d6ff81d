package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.util.List;

public record TaskResources(
        List<ResourceDeclaration> inputs,
        List<ResourceDeclaration> outputs
) implements Serializable {

    public static final TaskResources NONE = new TaskResources(List.of(), List.of());

    public TaskResources {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }
}
