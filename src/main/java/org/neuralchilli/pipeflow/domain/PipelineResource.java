package org.neuralchilli.pipeflow.domain;

/**
 * A stored, shareable pipeline resource (a git repo, an image, a bucket...).
 */
public record PipelineResource(ObjectMeta metadata, PipelineResourceSpec spec)
        implements ClusterObject<PipelineResource> {

    public PipelineResource {
        if (metadata == null) {
            throw new IllegalArgumentException("Resource metadata cannot be null");
        }
        if (spec == null) {
            throw new IllegalArgumentException("Resource spec cannot be null");
        }
    }

    @Override
    public PipelineResource withMetadata(ObjectMeta newMetadata) {
        return new PipelineResource(newMetadata, spec);
    }
}
