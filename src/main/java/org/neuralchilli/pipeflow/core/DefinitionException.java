package org.neuralchilli.pipeflow.core;

import org.neuralchilli.pipeflow.domain.PipelineRunReason;

/**
 * A problem with what a run asks for rather than with the control plane.
 * Retrying cannot fix it, so the run is failed with {@link #reason()}.
 */
public class DefinitionException extends RuntimeException {

    private final PipelineRunReason reason;

    public DefinitionException(PipelineRunReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public DefinitionException(PipelineRunReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public PipelineRunReason reason() {
        return reason;
    }
}
