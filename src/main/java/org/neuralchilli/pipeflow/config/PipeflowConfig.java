package org.neuralchilli.pipeflow.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

/**
 * Settings under the {@code pipeflow.} prefix of {@code application.properties}.
 */
@ConfigMapping(prefix = "pipeflow")
public interface PipeflowConfig {

    /**
     * Run timeout used when a run does not set one.
     */
    @WithDefault("60m")
    Duration defaultTimeout();

    /**
     * Service account for task-runs when neither the run nor a per-task mapping names one.
     */
    @WithDefault("default")
    String defaultServiceAccount();

    Images images();

    Artifacts artifacts();

    Queue queue();

    Definitions definitions();

    interface Images {
        /**
         * Image given to condition checks whose step names none.
         */
        @WithDefault("busybox")
        String shell();
    }

    interface Artifacts {
        @WithDefault("5Gi")
        String pvcSize();

        Optional<String> storageClassName();
    }

    interface Queue {
        @WithDefault("100ms")
        Duration baseBackoff();

        @WithDefault("5m")
        Duration maxBackoff();

        @WithDefault("10m")
        Duration resyncInterval();
    }

    interface Definitions {
        Optional<String> path();

        @WithDefault("false")
        boolean loadOnStart();
    }
}
