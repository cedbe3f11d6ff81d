package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * A pipeline: declared resources, params and workspaces, the task graph and its results.
 */
public record PipelineSpec(
        String description,
        List<ResourceDeclaration> resources,
        List<ParamSpec> params,
        List<WorkspaceDeclaration> workspaces,
        List<PipelineTask> tasks,
        List<PipelineResult> results
) implements Serializable {

    public PipelineSpec {
        resources = resources == null ? List.of() : List.copyOf(resources);
        params = params == null ? List.of() : List.copyOf(params);
        workspaces = workspaces == null ? List.of() : List.copyOf(workspaces);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        results = results == null ? List.of() : List.copyOf(results);
    }

    /**
     * Find a pipeline task by name, or null.
     */
    public PipelineTask task(String name) {
        return tasks.stream().filter(t -> t.name().equals(name)).findFirst().orElse(null);
    }

    public ParamSpec param(String name) {
        return params.stream().filter(p -> p.name().equals(name)).findFirst().orElse(null);
    }

    public ResourceDeclaration resource(String name) {
        return resources.stream().filter(r -> r.name().equals(name)).findFirst().orElse(null);
    }

    public PipelineSpec withTasks(List<PipelineTask> newTasks) {
        return new PipelineSpec(description, resources, params, workspaces, newTasks, results);
    }

    public PipelineSpec withResults(List<PipelineResult> newResults) {
        return new PipelineSpec(description, resources, params, workspaces, tasks, newResults);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String description;
        private final List<ResourceDeclaration> resources = new ArrayList<>();
        private final List<ParamSpec> params = new ArrayList<>();
        private final List<WorkspaceDeclaration> workspaces = new ArrayList<>();
        private final List<PipelineTask> tasks = new ArrayList<>();
        private final List<PipelineResult> results = new ArrayList<>();

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder resource(String name, ResourceType type) {
            this.resources.add(ResourceDeclaration.of(name, type));
            return this;
        }

        public Builder param(ParamSpec param) {
            this.params.add(param);
            return this;
        }

        public Builder workspace(String name) {
            this.workspaces.add(WorkspaceDeclaration.of(name));
            return this;
        }

        public Builder task(PipelineTask task) {
            this.tasks.add(task);
            return this;
        }

        public Builder result(String name, String value) {
            this.results.add(new PipelineResult(name, null, value));
            return this;
        }

        public PipelineSpec build() {
            return new PipelineSpec(description, resources, params, workspaces, tasks, results);
        }
    }
}
