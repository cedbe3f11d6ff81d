package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.util.List;

/**
 * A string or array parameter value.
 */
public record ParamValue(ParamType type, String stringVal, List<String> arrayVal) implements Serializable {

    public ParamValue {
        if (type == null) {
            throw new IllegalArgumentException("Parameter value type cannot be null");
        }
        if (type == ParamType.STRING && stringVal == null) {
            stringVal = "";
        }
        arrayVal = arrayVal == null ? List.of() : List.copyOf(arrayVal);
    }

    public static ParamValue ofString(String value) {
        return new ParamValue(ParamType.STRING, value, List.of());
    }

    public static ParamValue ofArray(List<String> values) {
        return new ParamValue(ParamType.ARRAY, null, values);
    }

    public boolean isArray() {
        return type == ParamType.ARRAY;
    }

    @Override
    public String toString() {
        return isArray() ? arrayVal.toString() : stringVal;
    }
}
