package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;

/**
 * Reference from a pipeline task (or a task-run) to the task it runs.
 * The three variants are mutually exclusive: a namespaced name, a cluster-scoped name,
 * or an inline spec.
 */
public record TaskRef(TaskKind kind, String name, TaskSpec spec) implements Serializable {

    public TaskRef {
        if (kind == null) {
            throw new IllegalArgumentException("Task reference kind cannot be null");
        }
        if (kind == TaskKind.INLINE) {
            if (spec == null) {
                throw new IllegalArgumentException("Inline task reference must carry a task spec");
            }
            if (name != null) {
                throw new IllegalArgumentException("Inline task reference cannot also name a task");
            }
        } else {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Task reference must name a task");
            }
            if (spec != null) {
                throw new IllegalArgumentException("Named task reference cannot also carry a task spec");
            }
        }
    }

    public static TaskRef named(String name) {
        return new TaskRef(TaskKind.TASK, name, null);
    }

    public static TaskRef clusterScoped(String name) {
        return new TaskRef(TaskKind.CLUSTER_TASK, name, null);
    }

    public static TaskRef inline(TaskSpec spec) {
        return new TaskRef(TaskKind.INLINE, null, spec);
    }

    public boolean isInline() {
        return kind == TaskKind.INLINE;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case TASK -> "Task/" + name;
            case CLUSTER_TASK -> "ClusterTask/" + name;
            case INLINE -> "inline";
        };
    }
}
