package org.neuralchilli.pipeflow.domain;

import java.io.Serializable;

/**
 * Points a generated object at the object that owns it, for garbage collection.
 */
public record OwnerReference(
        String apiVersion,
        String kind,
        String name,
        String uid,
        boolean controller,
        boolean blockOwnerDeletion
) implements Serializable {

    public static final String API_VERSION = "pipeflow.dev/v1beta1";

    public OwnerReference {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Owner kind cannot be null or empty");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Owner name cannot be null or empty");
        }
        if (apiVersion == null) {
            apiVersion = API_VERSION;
        }
    }

    /**
     * Controller reference to a pipeline run.
     */
    public static OwnerReference controllerOf(PipelineRun run) {
        return new OwnerReference(API_VERSION, PipelineRun.KIND, run.name(), run.metadata().uid(), true, true);
    }
}
