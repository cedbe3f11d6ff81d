package org.neuralchilli.pipeflow.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Turns the bound configuration into the immutable values the reconciler is built with.
 */
@ApplicationScoped
public class ReconcilerConfigProducer {

    private static final Logger log = LoggerFactory.getLogger(ReconcilerConfigProducer.class);

    @Produces
    @Singleton
    public ReconcilerConfig reconcilerConfig(PipeflowConfig config) {
        ReconcilerConfig reconcilerConfig = ReconcilerConfig.from(config);
        log.info("Reconciler configured: default timeout {}, default service account '{}'",
                reconcilerConfig.defaultTimeout(), reconcilerConfig.defaultServiceAccount());
        return reconcilerConfig;
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }
}
