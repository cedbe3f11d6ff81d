package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * What to run and with which bindings.
 * Exactly one of {@code pipelineRef} and {@code pipelineSpec} is set. A null timeout means the
 * configured default; a zero timeout means none.
 */
public record PipelineRunSpec(
        String pipelineRef,
        PipelineSpec pipelineSpec,
        List<Param> params,
        List<PipelineResourceBinding> resources,
        String serviceAccountName,
        List<TaskServiceAccount> serviceAccountNames,
        Duration timeout,
        String status,
        List<WorkspaceBinding> workspaces
) implements Serializable {

    public static final String CANCELLED = "PipelineRunCancelled";

    public PipelineRunSpec {
        if (pipelineRef != null && pipelineRef.isBlank()) {
            pipelineRef = null;
        }
        if ((pipelineRef == null) == (pipelineSpec == null)) {
            throw new IllegalArgumentException("Pipeline run must set exactly one of pipelineRef or pipelineSpec");
        }
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("Pipeline run timeout cannot be negative");
        }
        params = params == null ? List.of() : List.copyOf(params);
        resources = resources == null ? List.of() : List.copyOf(resources);
        serviceAccountNames = serviceAccountNames == null ? List.of() : List.copyOf(serviceAccountNames);
        workspaces = workspaces == null ? List.of() : List.copyOf(workspaces);
    }

    public boolean isCancelled() {
        return CANCELLED.equals(status);
    }

    public PipelineRunSpec cancelled() {
        return new PipelineRunSpec(pipelineRef, pipelineSpec, params, resources, serviceAccountName,
                serviceAccountNames, timeout, CANCELLED, workspaces);
    }

    /**
     * Service account for one pipeline task: the per-task override, else the run's account (may be null).
     */
    public String serviceAccountFor(String pipelineTaskName) {
        return serviceAccountNames.stream()
                .filter(sa -> sa.taskName().equals(pipelineTaskName))
                .map(TaskServiceAccount::serviceAccountName)
                .findFirst()
                .orElse(serviceAccountName);
    }

    public PipelineResourceBinding resource(String name) {
        return resources.stream().filter(r -> r.name().equals(name)).findFirst().orElse(null);
    }

    public WorkspaceBinding workspace(String name) {
        return workspaces.stream().filter(w -> w.name().equals(name)).findFirst().orElse(null);
    }

    public Param param(String name) {
        return params.stream().filter(p -> p.name().equals(name)).findFirst().orElse(null);
    }

    public static Builder forPipeline(String pipelineName) {
        return new Builder(pipelineName, null);
    }

    public static Builder embedded(PipelineSpec spec) {
        return new Builder(null, spec);
    }

    public static class Builder {
        private final String pipelineRef;
        private final PipelineSpec pipelineSpec;
        private final List<Param> params = new ArrayList<>();
        private final List<PipelineResourceBinding> resources = new ArrayList<>();
        private String serviceAccountName;
        private final List<TaskServiceAccount> serviceAccountNames = new ArrayList<>();
        private Duration timeout;
        private String status;
        private final List<WorkspaceBinding> workspaces = new ArrayList<>();

        private Builder(String pipelineRef, PipelineSpec pipelineSpec) {
            this.pipelineRef = pipelineRef;
            this.pipelineSpec = pipelineSpec;
        }

        public Builder param(String name, String value) {
            this.params.add(Param.of(name, value));
            return this;
        }

        public Builder param(Param param) {
            this.params.add(param);
            return this;
        }

        public Builder resource(PipelineResourceBinding binding) {
            this.resources.add(binding);
            return this;
        }

        public Builder serviceAccountName(String serviceAccountName) {
            this.serviceAccountName = serviceAccountName;
            return this;
        }

        public Builder serviceAccountName(String taskName, String serviceAccountName) {
            this.serviceAccountNames.add(new TaskServiceAccount(taskName, serviceAccountName));
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder cancelled() {
            this.status = CANCELLED;
            return this;
        }

        public Builder workspace(WorkspaceBinding binding) {
            this.workspaces.add(binding);
            return this;
        }

        public PipelineRunSpec build() {
            return new PipelineRunSpec(pipelineRef, pipelineSpec, params, resources, serviceAccountName,
                    serviceAccountNames, timeout, status, workspaces);
        }
    }
}
