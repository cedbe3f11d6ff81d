package org.neuralchilli.pipeflow.config;

import com.hazelcast.config.Config;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import io.quarkus.test.Mock;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

/**
 * Provides an embedded Hazelcast instance for tests.
 * Plain unit tests share the same member through {@link #shared()}.
 */
public class HazelcastTestProducer {

    private static HazelcastInstance instance;

    @Produces
    @ApplicationScoped
    @Mock
    public HazelcastInstance hazelcastInstance() {
        return shared();
    }

    public static synchronized HazelcastInstance shared() {
        if (instance == null || !instance.getLifecycleService().isRunning()) {
            Config config = HazelcastConfig.baseConfig("pipeflow-test");
            config.getNetworkConfig().getJoin().getAutoDetectionConfig().setEnabled(false);
            config.getMetricsConfig().setEnabled(false);
            config.getMapConfig("*").setBackupCount(0).setAsyncBackupCount(0);
            instance = Hazelcast.newHazelcastInstance(config);
        }
        return instance;
    }
}
