package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;

/**
 * Per-task service account override on a pipeline run.
 */
public record TaskServiceAccount(String taskName, String serviceAccountName) implements Serializable {

    public TaskServiceAccount {
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("Service account override must name a task");
        }
        if (serviceAccountName == null || serviceAccountName.isBlank()) {
            throw new IllegalArgumentException("Service account override for " + taskName + " must name an account");
        }
    }
}
