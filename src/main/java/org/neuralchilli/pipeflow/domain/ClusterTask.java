package org.neuralchilli.pipeflow.domain;

/**
 * A cluster-scoped task definition, visible from every namespace.
 */
public record ClusterTask(ObjectMeta metadata, TaskSpec spec) implements ClusterObject<ClusterTask> {

    public ClusterTask {
        if (metadata == null) {
            throw new IllegalArgumentException("Cluster task metadata cannot be null");
        }
        if (spec == null) {
            spec = TaskSpec.EMPTY;
        }
    }

    @Override
    public ClusterTask withMetadata(ObjectMeta newMetadata) {
        return new ClusterTask(newMetadata, spec);
    }
}
