package io.topologycache.cache;

import io.topologycache.config.TopologyCacheConfig;
import io.topologycache.enums.CacheResyncMethod;
import io.topologycache.enums.FingerprintCheckResult;
import io.topologycache.enums.ResyncSkipReason;
import io.topologycache.fingerprint.MalformedFingerprintException;
import io.topologycache.models.CachedTopology;
import io.topologycache.models.NodeResourceTopology;
import io.topologycache.models.Pod;
import io.topologycache.models.PodData;
import io.topologycache.models.ResyncResult;
import io.topologycache.podprovider.PodFilter;
import io.topologycache.podprovider.PodFilters;
import io.topologycache.resources.ExclusivityPredicate;
import io.topologycache.resources.ResourceRequests;
import io.topologycache.store.NodeTopologyClient;
import io.topologycache.store.PodLister;
import io.topologycache.util.LogIds;
import io.topologycache.util.Stringify;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Node topology cache which overlays the resources of pods reserved by the scheduler
 * on top of the last published snapshots.
 * <p>
 * Published snapshots lag behind the real allocations, so every reserved pod is charged
 * against its node until a snapshot proven to include it arrives. Proof comes from the
 * pod set fingerprint: once the fingerprint recomputed over the pods running on a node
 * matches the one the node agent embedded in the snapshot, the overlay of that node is
 * redundant and gets flushed.
 * <p>
 * All state is guarded by a single lock; every public operation holds it for its whole
 * duration, except {@link #resync()} which releases it around calls to the backing store.
 */
@Slf4j
public class OverReserveCache implements NodeTopologyCache {

    private final Object lock = new Object();

    private final NodeTopologyClient client;
    private final PodLister podLister;
    private final PodFilter isPodRelevant;
    private final ExclusivityPredicate exclusivity;
    private final CacheResyncMethod resyncMethod;

    private final NrtStore nrts;
    private final Map<String, ResourceStore> assumedResources = new HashMap<>(); // node name -> resources
    // how many times a node was discarded as candidate since its last reservation; resync trigger
    private final Counter nodesMaybeOverReserved = new Counter();
    private final Counter nodesWithForeignPods = new Counter();

    public OverReserveCache(TopologyCacheConfig config, NodeTopologyClient client, PodLister podLister,
                            PodFilter isPodRelevant, ExclusivityPredicate exclusivity) {
        if (client == null || podLister == null) {
            throw new IllegalArgumentException("received null references");
        }
        this.client = client;
        this.podLister = podLister;
        this.isPodRelevant = isPodRelevant != null ? isPodRelevant : PodFilters.ALWAYS;
        this.exclusivity = exclusivity != null ? exclusivity : ResourceRequests::areExclusiveForPod;
        this.resyncMethod = resyncMethodFrom(config);

        List<NodeResourceTopology> nrtObjs;
        try {
            nrtObjs = client.listNodeTopologies();
        } catch (Exception e) {
            log.error("Failed to list node topologies: {}", e.getMessage(), e);
            throw new CacheInitializationException("Failed to load initial node topologies", e);
        }
        this.nrts = new NrtStore(nrtObjs);

        log.info("OverReserveCache initialized with {} node topologies, resync method: {}", nrtObjs.size(), resyncMethod);
    }

    private static CacheResyncMethod resyncMethodFrom(TopologyCacheConfig config) {
        if (config != null && config.getResyncMethod() != null) {
            return config.getResyncMethod();
        }
        log.info("Cache resync method missing, falling back to {}", CacheResyncMethod.AUTODETECT);
        return CacheResyncMethod.AUTODETECT;
    }

    @Override
    public CachedTopology getCachedCopy(String nodeName, Pod pod) {
        synchronized (lock) {
            if (nodesWithForeignPods.isSet(nodeName)) {
                return CachedTopology.unknown();
            }

            Optional<NodeResourceTopology> nrt = nrts.getCopy(nodeName);
            if (nrt.isEmpty()) {
                return CachedTopology.missing();
            }
            ResourceStore nodeAssumedResources = assumedResources.get(nodeName);
            if (nodeAssumedResources == null) {
                return CachedTopology.of(nrt.get());
            }

            String logId = LogIds.forPod(pod);
            if (log.isTraceEnabled()) {
                log.trace("[{}] Node {} topology vanilla: {}", logId, nodeName, Stringify.topologyResources(nrt.get()));
            }
            nodeAssumedResources.applyTo(logId, nrt.get());
            if (log.isDebugEnabled()) {
                log.debug("[{}] Node {} topology updated: {}", logId, nodeName, Stringify.topologyResources(nrt.get()));
            }
            return CachedTopology.of(nrt.get());
        }
    }

    @Override
    public void markMaybeOverReserved(String nodeName, Pod pod) {
        synchronized (lock) {
            int val = nodesMaybeOverReserved.incr(nodeName);
            log.debug("[{}] Marked node {} as discarded, count: {}", LogIds.forPod(pod), nodeName, val);
        }
    }

    @Override
    public void markHasForeignPods(String nodeName, Pod pod) {
        String logId = LogIds.forPod(pod);
        synchronized (lock) {
            if (!nrts.contains(nodeName)) {
                log.debug("[{}] Ignoring foreign pods on node {}: topology info missing", logId, nodeName);
                return;
            }
            int val = nodesWithForeignPods.incr(nodeName);
            log.debug("[{}] Marked node {} with foreign pods, count: {}", logId, nodeName, val);
        }
    }

    @Override
    public void reserve(String nodeName, Pod pod) {
        String logId = LogIds.forPod(pod);
        synchronized (lock) {
            ResourceStore nodeAssumedResources = assumedResources.computeIfAbsent(nodeName, name -> new ResourceStore());
            nodeAssumedResources.addPod(pod);
            log.debug("[{}] Post reserve node {} assumed resources: {}", logId, nodeName, nodeAssumedResources);

            // the node had room for this pod, so earlier discards no longer hint at over-reservation
            nodesMaybeOverReserved.delete(nodeName);
            log.trace("[{}] Reset discard counter for node {}", logId, nodeName);
        }
    }

    @Override
    public void unreserve(String nodeName, Pod pod) {
        String logId = LogIds.forPod(pod);
        synchronized (lock) {
            ResourceStore nodeAssumedResources = assumedResources.get(nodeName);
            if (nodeAssumedResources == null) {
                // unexpected, but there is nothing to recover
                log.info("[{}] No resources tracked for node {}", logId, nodeName);
                return;
            }
            nodeAssumedResources.deletePod(pod);
            if (nodeAssumedResources.isEmpty()) {
                // only nodes with outstanding reservations keep an overlay
                assumedResources.remove(nodeName);
                log.debug("[{}] Post release node {} has no assumed resources left", logId, nodeName);
                return;
            }
            log.debug("[{}] Post release node {} assumed resources: {}", logId, nodeName, nodeAssumedResources);
        }
    }

    @Override
    public void postBind(String nodeName, Pod pod) {
        // nothing to do yet
    }

    /**
     * Names of the nodes which may have stale data in the cache.
     * <p>
     * This is intentionally over-inclusive: a node discarded because it legitimately ran out
     * of resources is listed just like one discarded because its overlay was too pessimistic.
     * Telling them apart would require predicting the future workload; an unneeded resync
     * attempt is cheap.
     */
    public List<String> listDirtyNodes() {
        synchronized (lock) {
            Counter nodes = nodesWithForeignPods.copy();
            int foreignCount = nodes.len();
            for (String node : nodesMaybeOverReserved.keys()) {
                nodes.incr(node);
            }
            if (nodes.len() > 0) {
                log.debug("Found dirty nodes - foreign: {}, discarded: {}, total: {}",
                        foreignCount, nodes.len() - foreignCount, nodes.len());
            }
            return nodes.keys();
        }
    }

    /**
     * Checks, for every dirty node, whether the latest published snapshot matches the pods
     * running on it; nodes which pass are flushed. Nodes failing any check stay dirty and
     * are retried on the next call.
     */
    @Override
    public ResyncResult resync() {
        String logId = LogIds.forTime();

        List<String> nodeNames = listDirtyNodes();
        if (nodeNames.isEmpty()) {
            log.trace("[{}] No dirty nodes detected", logId);
            return ResyncResult.nothingToDo(logId);
        }

        Map<String, List<PodData>> nodeToPods;
        try {
            nodeToPods = makeNodeToPodDataMap(logId);
        } catch (Exception e) {
            log.error("[{}] Cannot find the mapping between running pods and nodes: {}", logId, e.getMessage(), e);
            return ResyncResult.aborted(logId, nodeNames.size());
        }

        log.debug("[{}] Resync of node topology cache starting, dirty nodes: {}", logId, nodeNames.size());
        ResyncResult result = new ResyncResult(logId, nodeNames.size(), false);
        List<NodeResourceTopology> nrtUpdates = new ArrayList<>();
        for (String nodeName : nodeNames) {
            NodeResourceTopology candidate = resyncCandidate(logId, nodeName, nodeToPods, result);
            if (candidate != null) {
                nrtUpdates.add(candidate);
            }
        }

        flushNodes(logId, nrtUpdates);
        nrtUpdates.forEach(nrt -> result.addFlushed(nrt.getName()));
        log.debug("[{}] Resync of node topology cache complete: {}", logId, result);
        return result;
    }

    /**
     * @return the fresh snapshot of the node if it can replace the cached data, null otherwise
     */
    private NodeResourceTopology resyncCandidate(String logId, String nodeName, Map<String, List<PodData>> nodeToPods,
                                                 ResyncResult result) {
        Optional<NodeResourceTopology> fetched;
        try {
            fetched = client.getNodeTopology(nodeName);
        } catch (Exception e) {
            log.info("[{}] Failed to get node topology for node {}: {}", logId, nodeName, e.getMessage());
            result.addSkipped(ResyncSkipReason.FETCH_FAILED);
            return null;
        }
        if (fetched.isEmpty()) {
            log.info("[{}] Missing node topology for node {}", logId, nodeName);
            result.addSkipped(ResyncSkipReason.MISSING_TOPOLOGY);
            return null;
        }
        NodeResourceTopology candidate = fetched.get();
        if (candidate.getName() == null) {
            // the node is implied by the key the snapshot was published under
            candidate.setName(nodeName);
        } else if (!nodeName.equals(candidate.getName())) {
            log.warn("[{}] Node topology fetched for node {} describes node {}", logId, nodeName, candidate.getName());
            result.addSkipped(ResyncSkipReason.NAME_MISMATCH);
            return null;
        }

        List<PodData> pods = nodeToPods.get(nodeName);
        if (pods == null) {
            // a dirty node without any relevant pod should never happen
            log.info("[{}] Cannot find any pod for node {}", logId, nodeName);
            result.addSkipped(ResyncSkipReason.MISSING_PODS);
            return null;
        }

        PodFingerprintCheck.ExpectedFingerprint expected = PodFingerprintCheck.expectedFingerprint(candidate, resyncMethod);
        if (expected.isMissing()) {
            log.info("[{}] Missing podset fingerprint data in node topology for node {}", logId, nodeName);
            result.addSkipped(ResyncSkipReason.MISSING_FINGERPRINT);
            return null;
        }

        log.trace("[{}] Trying to resync node {} fingerprint={} onlyExclusiveResources={}",
                logId, nodeName, expected.getValue(), expected.isOnlyExclusiveResources());

        FingerprintCheckResult check;
        try {
            check = PodFingerprintCheck.check(logId, nodeName, pods, expected);
        } catch (MalformedFingerprintException e) {
            log.error("[{}] Checking podset fingerprint for node {} failed: {}", logId, nodeName, e.getMessage());
            result.addSkipped(ResyncSkipReason.MALFORMED_FINGERPRINT);
            return null;
        }
        if (check != FingerprintCheckResult.MATCH) {
            // the agent has not caught up yet, not critical
            log.debug("[{}] Podset fingerprint mismatch for node {}", logId, nodeName);
            result.addSkipped(ResyncSkipReason.MISMATCH);
            return null;
        }

        log.debug("[{}] Overriding cached info for node {}", logId, nodeName);
        return candidate;
    }

    /**
     * Drops all the cached information about the nodes of the given snapshots and stores
     * the snapshots in place of it.
     */
    public void flushNodes(NodeResourceTopology... nrts) {
        flushNodes(LogIds.forTime(), Arrays.asList(nrts));
    }

    private void flushNodes(String logId, List<NodeResourceTopology> nrtUpdates) {
        synchronized (lock) {
            for (NodeResourceTopology nrt : nrtUpdates) {
                log.debug("[{}] Flushing node {}", logId, nrt.getName());
                nrts.update(nrt);
                assumedResources.remove(nrt.getName());
                nodesMaybeOverReserved.delete(nrt.getName());
                nodesWithForeignPods.delete(nrt.getName());
            }
        }
    }

    private Map<String, List<PodData>> makeNodeToPodDataMap(String logId) throws Exception {
        Map<String, List<PodData>> nodeToPods = new HashMap<>();
        List<Pod> pods = podLister.listPods();
        for (Pod pod : pods) {
            if (!pod.isBound() || !isPodRelevant.isRelevant(pod, logId)) {
                continue;
            }
            nodeToPods.computeIfAbsent(pod.getNodeName(), name -> new ArrayList<>())
                    .add(new PodData(pod.getNamespace(), pod.getName(), exclusivity.hasExclusiveResources(pod)));
        }
        return nodeToPods;
    }

    // =================================================================
    // INTROSPECTION (used by tests and diagnostics)
    // =================================================================

    boolean hasAssumedResources(String nodeName) {
        synchronized (lock) {
            return assumedResources.containsKey(nodeName);
        }
    }

    Optional<NodeResourceTopology> getStoredTopology(String nodeName) {
        synchronized (lock) {
            return nrts.getCopy(nodeName);
        }
    }

    CacheResyncMethod getResyncMethod() {
        return resyncMethod;
    }
}
