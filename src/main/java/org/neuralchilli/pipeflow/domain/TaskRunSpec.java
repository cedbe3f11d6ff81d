package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Fully concrete request to run one task. {@code timeout} of zero means no timeout.
 */
public record TaskRunSpec(
        TaskRef taskRef,
        List<Param> params,
        TaskRunResources resources,
        String serviceAccountName,
        Duration timeout,
        List<WorkspaceBinding> workspaces,
        String status
) implements Serializable {

    public TaskRunSpec {
        if (taskRef == null) {
            throw new IllegalArgumentException("Task-run must reference a task");
        }
        params = params == null ? List.of() : List.copyOf(params);
        resources = resources == null ? TaskRunResources.NONE : resources;
        workspaces = workspaces == null ? List.of() : List.copyOf(workspaces);
    }

    public boolean isCancelled() {
        return TaskRunReason.CANCELLED.equals(status);
    }

    /**
     * Copy carrying the cancellation request.
     */
    public TaskRunSpec cancelled() {
        return new TaskRunSpec(taskRef, params, resources, serviceAccountName, timeout, workspaces,
                TaskRunReason.CANCELLED);
    }

    public Param param(String name) {
        return params.stream().filter(p -> p.name().equals(name)).findFirst().orElse(null);
    }

    public WorkspaceBinding workspace(String name) {
        return workspaces.stream().filter(w -> w.name().equals(name)).findFirst().orElse(null);
    }
}
