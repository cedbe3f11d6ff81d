package org.neuralchilli.pipeflow.domain;

/**
 * A stored pipeline definition.
 */
public record Pipeline(ObjectMeta metadata, PipelineSpec spec) implements ClusterObject<Pipeline> {

    public Pipeline {
        if (metadata == null) {
            throw new IllegalArgumentException("Pipeline metadata cannot be null");
        }
        if (spec == null) {
            throw new IllegalArgumentException("Pipeline spec cannot be null");
        }
    }

    @Override
    public Pipeline withMetadata(ObjectMeta newMetadata) {
        return new Pipeline(newMetadata, spec);
    }
}
