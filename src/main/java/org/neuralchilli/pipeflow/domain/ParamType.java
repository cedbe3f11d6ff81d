package org.neuralchilli.pipeflow.domain;

/**
 * Type of a parameter value.
 */
public enum ParamType {
    STRING,
    ARRAY;

    /**
     * Parse from YAML string (case-insensitive). Missing means string.
     */
    public static ParamType fromString(String value) {
        if (value == null || value.isBlank()) {
            return STRING;
        }
        try {
            return valueOf(value.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid parameter type: " + value + ". Must be one of: string, array"
            );
        }
    }

    public String lowerName() {
        return name().toLowerCase();
    }
}
