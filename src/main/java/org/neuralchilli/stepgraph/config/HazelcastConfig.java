package org.neuralchilli.stepgraph.config;

import com.hazelcast.config.Config;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the embedded Hazelcast instance holding runs, step events, artifacts and loaded graphs.
 * Run records and artifacts use plain Java serialization.
 */
@ApplicationScoped
public class HazelcastConfig {

    private static final Logger log = LoggerFactory.getLogger(HazelcastConfig.class);

    @ConfigProperty(name = "stepgraph.hazelcast.cluster-name", defaultValue = "stepgraph-dev")
    String clusterName;

    @Produces
    @Singleton
    @Startup
    public HazelcastInstance hazelcastInstance() {
        log.info("Initializing Hazelcast with cluster name: {}", clusterName);

        Config config = new Config();
        config.setClusterName(clusterName);
        // Records and plans are deserialized by the application class loader
        config.setClassLoader(Thread.currentThread().getContextClassLoader());

        // Disable network join for embedded instance
        config.getNetworkConfig().getJoin().getMulticastConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getTcpIpConfig().setEnabled(false);
        config.setProperty("hazelcast.phone.home.enabled", "false");

        HazelcastInstance instance = Hazelcast.newHazelcastInstance(config);

        log.info("Hazelcast instance created successfully");

        return instance;
    }

    void shutdown(@Disposes HazelcastInstance instance) {
        if (instance.getLifecycleService().isRunning()) {
            log.info("Shutting down Hazelcast instance");
            instance.shutdown();
        }
    }
}
