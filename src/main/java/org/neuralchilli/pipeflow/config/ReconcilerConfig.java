package org.neuralchilli.pipeflow.config;

import java.time.Duration;

/**
 * Immutable settings handed to the reconciler and its collaborators.
 *
 * @param defaultTimeout          run timeout when the run does not set one
 * @param defaultServiceAccount   fallback service account for task-runs
 * @param shellImage              image for condition check steps without one
 * @param artifactStorage         requested size of the artifact volume claim
 * @param artifactStorageClass    storage class of the artifact volume claim, may be null
 */
public record ReconcilerConfig(
        Duration defaultTimeout,
        String defaultServiceAccount,
        String shellImage,
        String artifactStorage,
        String artifactStorageClass
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(60);

    public ReconcilerConfig {
        if (defaultTimeout == null || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("Default timeout must be zero or positive");
        }
        if (defaultServiceAccount == null || defaultServiceAccount.isBlank()) {
            throw new IllegalArgumentException("Default service account cannot be empty");
        }
        if (shellImage == null || shellImage.isBlank()) {
            throw new IllegalArgumentException("Shell image cannot be empty");
        }
        if (artifactStorage == null || artifactStorage.isBlank()) {
            throw new IllegalArgumentException("Artifact storage size cannot be empty");
        }
    }

    public static ReconcilerConfig defaults() {
        return new ReconcilerConfig(DEFAULT_TIMEOUT, "default", "busybox", "5Gi", null);
    }

    public static ReconcilerConfig from(PipeflowConfig config) {
        return new ReconcilerConfig(
                config.defaultTimeout(),
                config.defaultServiceAccount(),
                config.images().shell(),
                config.artifacts().pvcSize(),
                config.artifacts().storageClassName().orElse(null)
        );
    }

    public ReconcilerConfig withDefaultTimeout(Duration timeout) {
        return new ReconcilerConfig(timeout, defaultServiceAccount, shellImage, artifactStorage, artifactStorageClass);
    }
}
