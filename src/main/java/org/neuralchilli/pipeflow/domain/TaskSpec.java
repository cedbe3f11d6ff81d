package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.util.List;

/**
 * Body of a task: what it takes, what it produces and the steps the task engine runs.
 */
public record TaskSpec(
        String description,
        List<ParamSpec> params,
        TaskResources resources,
        List<WorkspaceDeclaration> workspaces,
        List<Step> steps,
        List<TaskResultDeclaration> results
) implements Serializable {

    public static final TaskSpec EMPTY = new TaskSpec(null, List.of(), TaskResources.NONE, List.of(), List.of(), List.of());

    public TaskSpec {
        params = params == null ? List.of() : List.copyOf(params);
        resources = resources == null ? TaskResources.NONE : resources;
        workspaces = workspaces == null ? List.of() : List.copyOf(workspaces);
        steps = steps == null ? List.of() : List.copyOf(steps);
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static TaskSpec withParams(List<ParamSpec> params) {
        return new TaskSpec(null, params, TaskResources.NONE, List.of(), List.of(), List.of());
    }

    public static TaskSpec withSteps(List<Step> steps) {
        return new TaskSpec(null, List.of(), TaskResources.NONE, List.of(), steps, List.of());
    }
}
