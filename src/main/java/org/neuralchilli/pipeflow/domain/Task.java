package org.neuralchilli.pipeflow.domain;

/**
 * A namespaced task definition. Shared and read-only from the reconciler's point of view.
 */
public record Task(ObjectMeta metadata, TaskSpec spec) implements ClusterObject<Task> {

    public Task {
        if (metadata == null) {
            throw new IllegalArgumentException("Task metadata cannot be null");
        }
        if (spec == null) {
            spec = TaskSpec.EMPTY;
        }
    }

    @Override
    public Task withMetadata(ObjectMeta newMetadata) {
        return new Task(newMetadata, spec);
    }
}
