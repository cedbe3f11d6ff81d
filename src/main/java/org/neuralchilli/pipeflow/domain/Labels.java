package org.neuralchilli.pipeflow.domain;

/**
 * Well-known label keys applied to generated objects.
 * The run label is the key used to find orphaned task-runs.
 */
public final class Labels {

    public static final String GROUP = "pipeflow.dev/";

    public static final String PIPELINE = GROUP + "pipeline";
    public static final String PIPELINE_RUN = GROUP + "pipelineRun";
    public static final String PIPELINE_TASK = GROUP + "pipelineTask";
    public static final String CONDITION_CHECK = GROUP + "conditionCheck";
    public static final String CONDITION_NAME = GROUP + "conditionName";

    private Labels() {
    }
}
