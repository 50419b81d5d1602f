package io.topologycache;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.topologycache.cache.ForeignPods;
import io.topologycache.cache.NodeTopologyCache;
import io.topologycache.cache.OverReserveCache;
import io.topologycache.config.TopologyCacheConfig;
import io.topologycache.metrics.MetricsProvider;
import io.topologycache.podprovider.PodFilters;
import io.topologycache.resources.ResourceRequests;
import io.topologycache.store.EtcdPodWatcher;
import io.topologycache.store.EtcdTopologyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot application hosting the node topology cache.
 * <p>
 * Loads the published node topologies from etcd, keeps the over-reserve overlay for the
 * scheduler, watches pods to detect the ones placed by other schedulers and periodically
 * resyncs dirty nodes.
 */
@Slf4j
@SpringBootApplication
public class TopologyCacheApplication {

    private static final String INSTANCE_ENV_VAR = "HOSTNAME";
    private static final String DEFAULT_INSTANCE_ID = "topology-cache";

    public static void main(String[] args) {
        log.info("Starting Topology Cache Application");

        try {
            SpringApplication.run(TopologyCacheApplication.class, args);
            log.info("Topology Cache Application started successfully");
        } catch (Exception e) {
            log.error("Failed to start Topology Cache Application: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    public TopologyCacheConfig config() {
        TopologyCacheConfig config = new TopologyCacheConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public MetricsProvider metricsProvider(MeterRegistry meterRegistry) {
        String instanceId = System.getenv(INSTANCE_ENV_VAR);
        if (instanceId == null || instanceId.isBlank()) {
            instanceId = DEFAULT_INSTANCE_ID;
        }
        return new MetricsProvider(meterRegistry, instanceId.trim());
    }

    /**
     * Backing store for both the topology snapshots and the pods
     */
    @Bean(destroyMethod = "close")
    public EtcdTopologyStore topologyStore(TopologyCacheConfig config) {
        log.info("Initializing connection to etcd for cluster: {}", config.getClusterName());
        return EtcdTopologyStore.connect(config.getEtcdEndpoints(), config.getClusterName());
    }

    @Bean
    public NodeTopologyCache nodeTopologyCache(TopologyCacheConfig config, EtcdTopologyStore topologyStore) {
        log.info("Initializing OverReserveCache");
        return new OverReserveCache(
            config,
            topologyStore,
            topologyStore,
            PodFilters.forInformerMode(config.getInformerMode()),
            ResourceRequests::areExclusiveForPod
        );
    }

    @Bean
    public ForeignPods foreignPods(TopologyCacheConfig config) {
        return new ForeignPods(config.getForeignPodsDetect(), config.getSchedulerProfiles(), ResourceRequests::areExclusiveForPod);
    }

    @Bean(destroyMethod = "close")
    public EtcdPodWatcher podWatcher(TopologyCacheConfig config, EtcdTopologyStore topologyStore,
                                     ForeignPods foreignPods, NodeTopologyCache nodeTopologyCache) {
        log.info("Initializing pod watcher for foreign pods detection");
        return new EtcdPodWatcher(topologyStore.getEtcdClient(), config.getClusterName(),
            pod -> foreignPods.onPodObserved(nodeTopologyCache, pod));
    }

    @Bean(destroyMethod = "stop")
    public ResyncManager resyncManager(NodeTopologyCache nodeTopologyCache, MetricsProvider metricsProvider,
                                       TopologyCacheConfig config) {
        ResyncManager resyncManager = new ResyncManager(nodeTopologyCache, metricsProvider,
            config.getClusterName(), config.getResyncPeriodSeconds());
        resyncManager.start();
        return resyncManager;
    }
}
