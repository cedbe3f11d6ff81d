package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;

/**
 * Declaration of a parameter on a pipeline, task or condition.
 * A declaration without default must be supplied by the caller.
 */
public record ParamSpec(
        String name,
        ParamType type,
        String description,
        ParamValue defaultValue
) implements Serializable {

    public ParamSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter name cannot be null or empty");
        }
        if (type == null) {
            type = defaultValue != null ? defaultValue.type() : ParamType.STRING;
        }
        if (defaultValue != null && defaultValue.type() != type) {
            throw new IllegalArgumentException(
                    "Default value of parameter " + name + " must be of type " + type.lowerName()
            );
        }
    }

    public static ParamSpec required(String name, ParamType type) {
        return new ParamSpec(name, type, null, null);
    }

    public static ParamSpec withDefault(String name, ParamValue defaultValue) {
        return new ParamSpec(name, defaultValue.type(), null, defaultValue);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
