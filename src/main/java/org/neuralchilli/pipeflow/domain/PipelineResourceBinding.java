package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;

/**
 * Binds a pipeline's declared resource to a stored resource or to an inline spec.
 * Exactly one of {@code resourceRef} and {@code resourceSpec} is set.
 */
public record PipelineResourceBinding(
        String name,
        String resourceRef,
        PipelineResourceSpec resourceSpec
) implements Serializable {

    public PipelineResourceBinding {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Resource binding name cannot be null or empty");
        }
        if ((resourceRef == null) == (resourceSpec == null)) {
            throw new IllegalArgumentException(
                    "Resource binding " + name + " must set exactly one of resourceRef or resourceSpec"
            );
        }
    }

    public static PipelineResourceBinding ref(String name, String resourceName) {
        return new PipelineResourceBinding(name, resourceName, null);
    }

    public static PipelineResourceBinding inline(String name, PipelineResourceSpec spec) {
        return new PipelineResourceBinding(name, null, spec);
    }

    public boolean isInline() {
        return resourceSpec != null;
    }
}
