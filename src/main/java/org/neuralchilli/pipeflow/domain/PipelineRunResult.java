package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;

public record PipelineRunResult(String name, String value) implements Serializable {

    public PipelineRunResult {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pipeline run result name cannot be null or empty");
        }
    }
}
