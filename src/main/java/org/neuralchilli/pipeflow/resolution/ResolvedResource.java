package org.neuralchilli.pipeflow.resolution;

import org.neuralchilli.pipeflow.domain.PipelineResourceSpec;
import org.neuralchilli.pipeflow.domain.ResourceType;

/**
 * A pipeline resource after lookup.
 *
 * @param name        name of the pipeline's declared resource
 * @param resourceRef name of the stored resource, null when bound inline
 * @param spec        resolved content
 */
public record ResolvedResource(String name, String resourceRef, PipelineResourceSpec spec) {

    public ResolvedResource {
        if (spec == null) {
            throw new IllegalArgumentException("Resolved resource " + name + " has no spec");
        }
    }

    public ResourceType type() {
        return spec.type();
    }
}
