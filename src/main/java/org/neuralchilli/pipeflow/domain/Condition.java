package org.neuralchilli.pipeflow.domain;

/**
 * Stored condition definition referenced by pipeline tasks.
 */
public record Condition(ObjectMeta metadata, ConditionSpec spec) implements ClusterObject<Condition> {

    public Condition {
        if (metadata == null) {
            throw new IllegalArgumentException("Condition metadata cannot be null");
        }
        if (spec == null) {
            throw new IllegalArgumentException("Condition spec cannot be null");
        }
    }

    @Override
    public Condition withMetadata(ObjectMeta newMetadata) {
        return new Condition(newMetadata, spec);
    }
}
