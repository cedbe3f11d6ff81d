package org.neuralchilli.pipeflow.domain;

/**
 * Variant tag of a {@link TaskRef}.
 */
public enum TaskKind {
    /** Task stored in the run's namespace */
    TASK,

    /** Cluster-scoped task */
    CLUSTER_TASK,

    /** Spec embedded in the pipeline task */
    INLINE
}
