package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;

/**
 * Output resource of a pipeline task.
 */
public record PipelineTaskOutputResource(String name, String resource) implements Serializable {

    public PipelineTaskOutputResource {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Output resource name cannot be null or empty");
        }
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("Output resource " + name + " must name a pipeline resource");
        }
    }
}
