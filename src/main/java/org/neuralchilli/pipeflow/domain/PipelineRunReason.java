package org.neuralchilli.pipeflow.domain;

/**
 * Reason codes written to a pipeline run's condition.
 */
public enum PipelineRunReason {

    // Definition errors, always terminal
    COULDNT_GET_PIPELINE("CouldntGetPipeline"),
    COULDNT_GET_TASK("CouldntGetTask"),
    COULDNT_GET_RESOURCE("CouldntGetResource"),
    COULDNT_GET_CONDITION("CouldntGetCondition"),
    FAILED_VALIDATION("FailedValidation"),
    INVALID_BINDINGS("InvalidBindings"),
    PARAMETER_TYPE_MISMATCH("ParameterTypeMismatch"),
    INVALID_GRAPH("InvalidGraph"),
    INVALID_WORKSPACE_BINDINGS("InvalidWorkspaceBindings"),
    INVALID_SERVICE_ACCOUNT_MAPPINGS("InvalidServiceAccountMappings"),
    INVALID_TASK_RESULT_REFERENCE("InvalidTaskResultReference"),

    // Lifecycle
    RUNNING("Running"),
    SUCCEEDED("Succeeded"),
    FAILED("Failed"),
    CANCELLED("Cancelled"),
    COULDNT_CANCEL("CouldntCancel"),
    TIMED_OUT("TimedOut");

    private final String reason;

    PipelineRunReason(String reason) {
        this.reason = reason;
    }

    /**
     * The string stored in the condition's reason field.
     */
    public String reason() {
        return reason;
    }

    @Override
    public String toString() {
        return reason;
    }
}
