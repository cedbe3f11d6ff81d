package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;

/**
 * A result value emitted by a finished task-run.
 */
public record TaskRunResult(String name, String value) implements Serializable {

    public TaskRunResult {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Result name cannot be null or empty");
        }
        if (value == null) {
            value = "";
        }
    }
}
