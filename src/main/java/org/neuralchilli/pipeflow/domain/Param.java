package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;

/**
 * A named parameter value supplied by a run, a pipeline task or a task-run.
 */
public record Param(String name, ParamValue value) implements Serializable {

    public Param {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter name cannot be null or empty");
        }
        if (value == null) {
            throw new IllegalArgumentException("Parameter " + name + " has no value");
        }
    }

    public static Param of(String name, String value) {
        return new Param(name, ParamValue.ofString(value));
    }

    public static Param of(String name, java.util.List<String> values) {
        return new Param(name, ParamValue.ofArray(values));
    }
}
