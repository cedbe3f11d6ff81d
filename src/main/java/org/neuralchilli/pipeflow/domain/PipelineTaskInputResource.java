package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.util.List;

/**
 * Input resource of a pipeline task.
 * {@code from} names earlier tasks whose output of the same resource this input consumes.
 */
public record PipelineTaskInputResource(String name, String resource, List<String> from) implements Serializable {

    public PipelineTaskInputResource {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Input resource name cannot be null or empty");
        }
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("Input resource " + name + " must name a pipeline resource");
        }
        from = from == null ? List.of() : List.copyOf(from);
    }

    public static PipelineTaskInputResource of(String name, String resource) {
        return new PipelineTaskInputResource(name, resource, List.of());
    }
}
