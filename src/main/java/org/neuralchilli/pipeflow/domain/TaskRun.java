package org.neuralchilli.pipeflow.domain;

/**
 * Child execution object for one pipeline task or one condition check.
 */
public record TaskRun(ObjectMeta metadata, TaskRunSpec spec, TaskRunStatus status)
        implements ClusterObject<TaskRun> {

    public TaskRun {
        if (metadata == null) {
            throw new IllegalArgumentException("Task-run metadata cannot be null");
        }
        if (spec == null) {
            throw new IllegalArgumentException("Task-run spec cannot be null");
        }
        if (status == null) {
            status = TaskRunStatus.EMPTY;
        }
    }

    @Override
    public TaskRun withMetadata(ObjectMeta newMetadata) {
        return new TaskRun(newMetadata, spec, status);
    }

    public TaskRun withStatus(TaskRunStatus newStatus) {
        return new TaskRun(metadata, spec, newStatus);
    }

    public TaskRun withSpec(TaskRunSpec newSpec) {
        return new TaskRun(metadata, newSpec, status);
    }

    public boolean isSucceeded() {
        return status.isSucceeded();
    }

    public boolean isFailed() {
        return status.isFailed();
    }

    public boolean isDone() {
        return status.isDone();
    }

    public boolean isConditionCheck() {
        return metadata.labels().containsKey(Labels.CONDITION_CHECK);
    }

    public String pipelineTaskName() {
        return metadata.label(Labels.PIPELINE_TASK);
    }
}
