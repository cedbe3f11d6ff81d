package org.neuralchilli.pipeflow.core;

import org.neuralchilli.pipeflow.domain.PipelineRunReason;

/**
 * Thrown when the dependencies of a pipeline form a cycle.
 */
public class GraphCycleException extends DefinitionException {

    public GraphCycleException(String message) {
        super(PipelineRunReason.INVALID_GRAPH, message);
    }

    public GraphCycleException(String message, Throwable cause) {
        super(PipelineRunReason.INVALID_GRAPH, message, cause);
    }
}
