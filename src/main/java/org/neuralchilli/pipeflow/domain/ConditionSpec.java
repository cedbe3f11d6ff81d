package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.util.List;

/**
 * A gating check: a single container whose exit status decides whether a task runs.
 */
public record ConditionSpec(
        Step check,
        List<ParamSpec> params,
        List<ResourceDeclaration> resources,
        String description
) implements Serializable {

    public ConditionSpec {
        if (check == null) {
            throw new IllegalArgumentException("Condition must define a check step");
        }
        params = params == null ? List.of() : List.copyOf(params);
        resources = resources == null ? List.of() : List.copyOf(resources);
    }
}
