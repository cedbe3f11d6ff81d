package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;

/**
 * Pipeline-level result; {@code value} is an expression over task results.
 */
public record PipelineResult(String name, String description, String value) implements Serializable {

    public PipelineResult {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pipeline result name cannot be null or empty");
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Pipeline result " + name + " must have a value");
        }
    }
}
