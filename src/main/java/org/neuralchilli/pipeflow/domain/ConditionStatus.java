package org.neuralchilli.pipeflow.domain;

/**
 * Tri-state status of a {@link StatusCondition}.
 */
public enum ConditionStatus {
    TRUE,
    FALSE,
    UNKNOWN;

    /**
     * TRUE and FALSE are final outcomes; UNKNOWN means still in progress.
     */
    public boolean isTerminal() {
        return this != UNKNOWN;
    }
}
