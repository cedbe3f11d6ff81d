package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.util.List;

/**
 * A resource handed to a task-run, with the artifact paths it is copied from or to.
 */
public record TaskResourceBinding(
        String name,
        String resourceRef,
        PipelineResourceSpec resourceSpec,
        List<String> paths
) implements Serializable {

    public TaskResourceBinding {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task resource binding name cannot be null or empty");
        }
        if ((resourceRef == null) == (resourceSpec == null)) {
            throw new IllegalArgumentException(
                    "Task resource binding " + name + " must set exactly one of resourceRef or resourceSpec"
            );
        }
        paths = paths == null ? List.of() : List.copyOf(paths);
    }
}
