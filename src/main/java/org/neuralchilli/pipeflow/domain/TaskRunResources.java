package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.util.List;

public record TaskRunResources(
        List<TaskResourceBinding> inputs,
        List<TaskResourceBinding> outputs
) implements Serializable {

    public static final TaskRunResources NONE = new TaskRunResources(List.of(), List.of());

    public TaskRunResources {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    public TaskResourceBinding input(String name) {
        return inputs.stream().filter(b -> b.name().equals(name)).findFirst().orElse(null);
    }

    public TaskResourceBinding output(String name) {
        return outputs.stream().filter(b -> b.name().equals(name)).findFirst().orElse(null);
    }
}
