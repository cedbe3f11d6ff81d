package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;

/**
 * Workspace declared by a pipeline or a task.
 */
public record WorkspaceDeclaration(
        String name,
        String description,
        String mountPath,
        boolean optional
) implements Serializable {

    public WorkspaceDeclaration {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Workspace name cannot be null or empty");
        }
    }

    public static WorkspaceDeclaration of(String name) {
        return new WorkspaceDeclaration(name, null, null, false);
    }
}
