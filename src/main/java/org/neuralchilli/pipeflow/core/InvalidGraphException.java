package org.neuralchilli.pipeflow.core;

import org.neuralchilli.pipeflow.domain.PipelineRunReason;

/**
 * Thrown when a pipeline task depends on a task the pipeline does not contain,
 * or when two tasks share a name.
 */
public class InvalidGraphException extends DefinitionException {

    public InvalidGraphException(String message) {
        super(PipelineRunReason.INVALID_GRAPH, message);
    }
}
