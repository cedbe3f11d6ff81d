package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * The "Succeeded" condition of a run or task-run.
 */
public record StatusCondition(
        ConditionStatus status,
        String reason,
        String message,
        Instant lastTransitionTime
) implements Serializable {

    public StatusCondition {
        if (status == null) {
            throw new IllegalArgumentException("Condition status cannot be null");
        }
        if (reason == null) {
            reason = "";
        }
        if (message == null) {
            message = "";
        }
    }

    public static StatusCondition unknown(String reason, String message, Instant at) {
        return new StatusCondition(ConditionStatus.UNKNOWN, reason, message, at);
    }

    public static StatusCondition succeeded(String reason, String message, Instant at) {
        return new StatusCondition(ConditionStatus.TRUE, reason, message, at);
    }

    public static StatusCondition failed(String reason, String message, Instant at) {
        return new StatusCondition(ConditionStatus.FALSE, reason, message, at);
    }

    public boolean isTrue() {
        return status == ConditionStatus.TRUE;
    }

    public boolean isFalse() {
        return status == ConditionStatus.FALSE;
    }

    public boolean isUnknown() {
        return status == ConditionStatus.UNKNOWN;
    }

    /**
     * Same status, reason and message; the transition time is ignored.
     */
    public boolean sameState(StatusCondition other) {
        return other != null
                && status == other.status
                && Objects.equals(reason, other.reason)
                && Objects.equals(message, other.message);
    }
}
