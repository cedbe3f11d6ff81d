package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * One node of a pipeline graph.
 */
public record PipelineTask(
        String name,
        TaskRef taskRef,
        List<Param> params,
        PipelineTaskResources resources,
        List<WorkspacePipelineTaskBinding> workspaces,
        List<PipelineTaskCondition> conditions,
        List<String> runAfter,
        Duration timeout,
        int retries
) implements Serializable {

    public PipelineTask {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pipeline task name cannot be null or empty");
        }
        if (taskRef == null) {
            throw new IllegalArgumentException("Pipeline task " + name + " must reference a task");
        }
        if (retries < 0) {
            throw new IllegalArgumentException("Retries of pipeline task " + name + " cannot be negative");
        }
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout of pipeline task " + name + " cannot be negative");
        }

        // Defaults
        params = params == null ? List.of() : List.copyOf(params);
        resources = resources == null ? PipelineTaskResources.NONE : resources;
        workspaces = workspaces == null ? List.of() : List.copyOf(workspaces);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        runAfter = runAfter == null ? List.of() : List.copyOf(runAfter);
    }

    public Param param(String paramName) {
        return params.stream().filter(p -> p.name().equals(paramName)).findFirst().orElse(null);
    }

    public PipelineTask withParams(List<Param> newParams) {
        return new PipelineTask(name, taskRef, newParams, resources, workspaces, conditions, runAfter, timeout, retries);
    }

    public PipelineTask withConditions(List<PipelineTaskCondition> newConditions) {
        return new PipelineTask(name, taskRef, params, resources, workspaces, newConditions, runAfter, timeout, retries);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private TaskRef taskRef;
        private final List<Param> params = new ArrayList<>();
        private final List<PipelineTaskInputResource> inputs = new ArrayList<>();
        private final List<PipelineTaskOutputResource> outputs = new ArrayList<>();
        private final List<WorkspacePipelineTaskBinding> workspaces = new ArrayList<>();
        private final List<PipelineTaskCondition> conditions = new ArrayList<>();
        private final List<String> runAfter = new ArrayList<>();
        private Duration timeout;
        private int retries;

        public Builder(String name) {
            this.name = name;
        }

        public Builder taskRef(String taskName) {
            this.taskRef = TaskRef.named(taskName);
            return this;
        }

        public Builder taskRef(TaskRef ref) {
            this.taskRef = ref;
            return this;
        }

        public Builder param(String paramName, String value) {
            this.params.add(Param.of(paramName, value));
            return this;
        }

        public Builder param(Param param) {
            this.params.add(param);
            return this;
        }

        public Builder input(String inputName, String resource, String... from) {
            this.inputs.add(new PipelineTaskInputResource(inputName, resource, List.of(from)));
            return this;
        }

        public Builder output(String outputName, String resource) {
            this.outputs.add(new PipelineTaskOutputResource(outputName, resource));
            return this;
        }

        public Builder workspace(String taskWorkspace, String pipelineWorkspace, String subPath) {
            this.workspaces.add(new WorkspacePipelineTaskBinding(taskWorkspace, pipelineWorkspace, subPath));
            return this;
        }

        public Builder condition(PipelineTaskCondition condition) {
            this.conditions.add(condition);
            return this;
        }

        public Builder condition(String conditionRef) {
            return condition(PipelineTaskCondition.of(conditionRef));
        }

        public Builder runAfter(String... tasks) {
            this.runAfter.addAll(List.of(tasks));
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public PipelineTask build() {
            return new PipelineTask(name, taskRef, params, new PipelineTaskResources(inputs, outputs),
                    workspaces, conditions, runAfter, timeout, retries);
        }
    }
}
