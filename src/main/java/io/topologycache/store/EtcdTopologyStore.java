package io.topologycache.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.options.GetOption;
import io.topologycache.models.NodeResourceTopology;
import io.topologycache.models.Pod;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static io.topologycache.config.Constants.PATH_DELIMITER;

/**
 * etcd-based implementation of the topology client and the pod lister.
 * Node agents publish snapshots as JSON documents; pods are mirrored the same way.
 */
@Slf4j
public class EtcdTopologyStore implements NodeTopologyClient, PodLister, AutoCloseable {

    // TODO: Make etcd timeout configurable once the scheduler passes a per-cycle deadline
    private static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5;

    private final String clusterName;
    private final Client etcdClient;
    private final KV kvClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;

    public EtcdTopologyStore(Client etcdClient, String clusterName) {
        this.clusterName = clusterName;
        this.etcdClient = etcdClient;
        this.kvClient = etcdClient.getKVClient();
        this.pathResolver = EtcdPathResolver.getInstance();
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        log.info("EtcdTopologyStore initialized for cluster: {}", clusterName);
    }

    /**
     * Build a store with its own etcd client connected to the given endpoints.
     */
    public static EtcdTopologyStore connect(String[] etcdEndpoints, String clusterName) {
        log.info("Connecting to etcd endpoints: {}", String.join(",", etcdEndpoints));
        Client client = Client.builder().endpoints(etcdEndpoints).build();
        return new EtcdTopologyStore(client, clusterName);
    }

    /**
     * Get the etcd client for use by other components (e.g., the pod watcher)
     */
    public Client getEtcdClient() {
        return etcdClient;
    }

    // =================================================================
    // NODE TOPOLOGY OPERATIONS
    // =================================================================

    @Override
    public List<NodeResourceTopology> listNodeTopologies() throws Exception {
        log.debug("Getting all node topologies from etcd");

        try {
            String prefix = pathResolver.getNodeTopologyPrefix(clusterName);
            List<NodeResourceTopology> nrts = getAllObjectsByPrefix(prefix, NodeResourceTopology.class);
            log.debug("Retrieved {} node topologies from etcd", nrts.size());
            return nrts;
        } catch (Exception e) {
            log.error("Failed to get node topologies from etcd: {}", e.getMessage(), e);
            throw new Exception("Failed to retrieve node topologies from etcd", e);
        }
    }

    @Override
    public Optional<NodeResourceTopology> getNodeTopology(String nodeName) throws Exception {
        log.debug("Getting node topology {} from etcd", nodeName);

        try {
            String path = pathResolver.getNodeTopologyPath(clusterName, nodeName);
            Optional<NodeResourceTopology> result = getObjectByPath(path, NodeResourceTopology.class);
            if (result.isEmpty()) {
                log.debug("Node topology {} not found in etcd", nodeName);
            }
            return result;
        } catch (Exception e) {
            log.error("Failed to get node topology {} from etcd: {}", nodeName, e.getMessage());
            throw new Exception("Failed to retrieve node topology " + nodeName + " from etcd", e);
        }
    }

    // =================================================================
    // POD OPERATIONS
    // =================================================================

    @Override
    public List<Pod> listPods() throws Exception {
        log.debug("Getting all pods from etcd");

        try {
            String prefix = pathResolver.getPodsPrefix(clusterName);
            List<Pod> pods = getAllObjectsByPrefix(prefix, Pod.class);
            log.debug("Retrieved {} pods from etcd", pods.size());
            return pods;
        } catch (Exception e) {
            log.error("Failed to get pods from etcd: {}", e.getMessage(), e);
            throw new Exception("Failed to retrieve pods from etcd", e);
        }
    }

    @Override
    public void close() {
        log.info("Closing etcd topology store");
        etcdClient.close();
    }

    // =================================================================
    // PRIVATE HELPER METHODS FOR ETCD OPERATIONS
    // =================================================================

    /**
     * Executes etcd prefix query to retrieve all keys matching the given prefix
     */
    private GetResponse executeEtcdPrefixQuery(String prefix) throws Exception {
        // Add trailing slash for etcd prefix queries to ensure precise matching
        ByteSequence prefixBytes = ByteSequence.from(prefix + PATH_DELIMITER, StandardCharsets.UTF_8);
        return kvClient.get(
            prefixBytes,
            GetOption.newBuilder().withPrefix(prefixBytes).build()
        ).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    /**
     * Executes etcd get operation for a single key
     */
    private GetResponse executeEtcdGet(String key) throws Exception {
        ByteSequence keyBytes = ByteSequence.from(key, StandardCharsets.UTF_8);
        return kvClient.get(keyBytes).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private <T> List<T> getAllObjectsByPrefix(String prefix, Class<T> clazz) throws Exception {
        GetResponse response = executeEtcdPrefixQuery(prefix);
        List<T> items = new ArrayList<>();
        for (var kv : response.getKvs()) {
            String json = kv.getValue().toString(StandardCharsets.UTF_8);
            items.add(objectMapper.readValue(json, clazz));
        }
        return items;
    }

    private <T> Optional<T> getObjectByPath(String path, Class<T> clazz) throws Exception {
        GetResponse response = executeEtcdGet(path);
        if (response.getCount() == 0) {
            return Optional.empty();
        }
        String json = response.getKvs().get(0).getValue().toString(StandardCharsets.UTF_8);
        return Optional.of(objectMapper.readValue(json, clazz));
    }
}
