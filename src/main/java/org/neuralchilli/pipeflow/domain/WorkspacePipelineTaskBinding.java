package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;

/**
 * Maps a task's workspace {@code name} to the pipeline workspace {@code workspace}.
 */
public record WorkspacePipelineTaskBinding(String name, String workspace, String subPath) implements Serializable {

    public WorkspacePipelineTaskBinding {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task workspace name cannot be null or empty");
        }
        if (workspace == null || workspace.isBlank()) {
            workspace = name;
        }
        if (subPath == null) {
            subPath = "";
        }
    }
}
