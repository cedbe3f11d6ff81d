package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.util.Map;

/**
 * Content of a pipeline resource, either stored or given inline in a binding.
 */
public record PipelineResourceSpec(
        ResourceType type,
        Map<String, String> params,
        String description
) implements Serializable {

    public PipelineResourceSpec {
        if (type == null) {
            throw new IllegalArgumentException("Resource type cannot be null");
        }
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static PipelineResourceSpec of(ResourceType type, Map<String, String> params) {
        return new PipelineResourceSpec(type, params, null);
    }
}
