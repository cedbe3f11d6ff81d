package org.neuralchilli.pipeflow.config;

import com.hazelcast.config.Config;
import com.hazelcast.config.SerializationConfig;
import com.hazelcast.config.SerializerConfig;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.pipeflow.serializer.ObjectKeySerializer;
import org.neuralchilli.pipeflow.store.ObjectKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the embedded Hazelcast member that holds the control plane.
 */
@ApplicationScoped
public class HazelcastConfig {

    private static final Logger log = LoggerFactory.getLogger(HazelcastConfig.class);

    @ConfigProperty(name = "hazelcast.cluster-name", defaultValue = "pipeflow-dev")
    String clusterName;

    @Produces
    @Singleton
    @Startup
    public HazelcastInstance hazelcastInstance() {
        log.info("Initializing Hazelcast with cluster name: {}", clusterName);

        HazelcastInstance instance = Hazelcast.newHazelcastInstance(baseConfig(clusterName));

        log.info("Hazelcast instance created successfully");
        return instance;
    }

    /**
     * Stand-alone member configuration: no network join, custom key serializer registered.
     * Shared with tests that start their own member.
     */
    public static Config baseConfig(String clusterName) {
        Config config = new Config();
        config.setClusterName(clusterName);

        // Disable network join for embedded instance
        config.getNetworkConfig().getJoin().getMulticastConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getTcpIpConfig().setEnabled(false);
        config.setProperty("hazelcast.phone.home.enabled", "false");

        SerializationConfig serializationConfig = config.getSerializationConfig();
        serializationConfig.setEnableCompression(false);
        serializationConfig.setEnableSharedObject(false);
        serializationConfig.addSerializerConfig(new SerializerConfig()
                .setTypeClass(ObjectKey.class)
                .setImplementation(new ObjectKeySerializer()));
        log.debug("Registered ObjectKeySerializer (TYPE_ID: {})", ObjectKeySerializer.TYPE_ID);

        return config;
    }
}
