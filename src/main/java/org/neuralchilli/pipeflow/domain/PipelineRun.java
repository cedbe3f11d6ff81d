package org.neuralchilli.pipeflow.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * One execution of a pipeline. The reconciler owns {@code status}; users own {@code spec}.
 */
public record PipelineRun(ObjectMeta metadata, PipelineRunSpec spec, PipelineRunStatus status)
        implements ClusterObject<PipelineRun> {

    public static final String KIND = "PipelineRun";

    public PipelineRun {
        if (metadata == null) {
            throw new IllegalArgumentException("Pipeline run metadata cannot be null");
        }
        if (spec == null) {
            throw new IllegalArgumentException("Pipeline run spec cannot be null");
        }
        if (status == null) {
            status = PipelineRunStatus.EMPTY;
        }
    }

    public static PipelineRun of(String namespace, String name, PipelineRunSpec spec) {
        return new PipelineRun(ObjectMeta.of(namespace, name), spec, PipelineRunStatus.EMPTY);
    }

    @Override
    public PipelineRun withMetadata(ObjectMeta newMetadata) {
        return new PipelineRun(newMetadata, spec, status);
    }

    public PipelineRun withStatus(PipelineRunStatus newStatus) {
        return new PipelineRun(metadata, spec, newStatus);
    }

    public PipelineRun withSpec(PipelineRunSpec newSpec) {
        return new PipelineRun(metadata, newSpec, status);
    }

    public boolean isDone() {
        return status.isDone();
    }

    public boolean isCancelled() {
        return spec.isCancelled();
    }

    public boolean hasStarted() {
        return status.startTime() != null;
    }

    /**
     * Effective run timeout: the spec's, else the given default. Zero means no timeout.
     */
    public Duration timeout(Duration defaultTimeout) {
        return spec.timeout() != null ? spec.timeout() : defaultTimeout;
    }

    /**
     * True when the run has a timeout and {@code now} is at or past start + timeout.
     */
    public boolean isTimedOut(Instant now, Duration defaultTimeout) {
        Duration timeout = timeout(defaultTimeout);
        if (timeout.isZero() || status.startTime() == null) {
            return false;
        }
        return !now.isBefore(status.startTime().plus(timeout));
    }

    /**
     * Name used for the pipeline label: the referenced pipeline, or the run itself for an embedded spec.
     */
    public String pipelineName() {
        return spec.pipelineRef() != null ? spec.pipelineRef() : metadata.name();
    }
}
