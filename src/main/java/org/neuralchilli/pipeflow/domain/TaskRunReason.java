package org.neuralchilli.pipeflow.domain;

/**
 * Reason codes the reconciler writes to task-run level status.
 */
public final class TaskRunReason {

    public static final String CANCELLED = "TaskRunCancelled";
    public static final String CONDITION_CHECK_FAILED = "ConditionCheckFailed";
    public static final String RETRYING = "Retrying";

    private TaskRunReason() {
    }
}
