package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;

/**
 * Result a task promises to emit.
 */
public record TaskResultDeclaration(String name, String description) implements Serializable {

    public TaskResultDeclaration {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Result name cannot be null or empty");
        }
    }
}
