package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;

/**
 * A resource slot declared by a pipeline, task or condition.
 */
public record ResourceDeclaration(String name, ResourceType type, boolean optional) implements Serializable {

    public ResourceDeclaration {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Resource name cannot be null or empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("Resource " + name + " must declare a type");
        }
    }

    public static ResourceDeclaration of(String name, ResourceType type) {
        return new ResourceDeclaration(name, type, false);
    }
}
