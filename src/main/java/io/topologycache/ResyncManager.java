package io.topologycache;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.topologycache.cache.NodeTopologyCache;
import io.topologycache.metrics.MetricsProvider;
import io.topologycache.models.ResyncResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static io.topologycache.metrics.MetricsConstants.*;

/**
 * Periodically triggers the resync of a node topology cache.
 * Runs on a single thread, so resync invocations never overlap.
 */
@Slf4j
public class ResyncManager {

    private final NodeTopologyCache cache;
    private final long intervalSeconds;
    private final ScheduledExecutorService scheduler;

    private final Timer resyncTimer;
    private final Counter abortedCounter;
    private final Counter flushedCounter;
    private final AtomicDouble dirtyNodesGauge;

    private volatile boolean isRunning = false;

    public ResyncManager(NodeTopologyCache cache, MetricsProvider metricsProvider, String clusterName, long intervalSeconds) {
        this.cache = cache;
        this.intervalSeconds = intervalSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "topology-cache-resync"));

        Map<String, String> tags = Map.of(CLUSTER_NAME_TAG, clusterName);
        this.resyncTimer = metricsProvider.timer(RESYNC_DURATION_METRIC_NAME, tags);
        this.abortedCounter = metricsProvider.counter(RESYNC_ABORTED_METRIC_NAME, tags);
        this.flushedCounter = metricsProvider.counter(FLUSHED_NODES_METRIC_NAME, tags);
        this.dirtyNodesGauge = metricsProvider.gauge(DIRTY_NODES_METRIC_NAME, tags);
    }

    public void start() {
        if (intervalSeconds <= 0) {
            log.info("Resync period is {}s, periodic resync disabled", intervalSeconds);
            return;
        }
        log.info("Starting resync manager with period {}s", intervalSeconds);
        isRunning = true;
        scheduler.scheduleWithFixedDelay(
                this::resyncLoop,
                intervalSeconds,
                intervalSeconds,
                TimeUnit.SECONDS
        );
    }

    public void stop() {
        log.info("Stopping resync manager");
        isRunning = false;
        scheduler.shutdown();
    }

    public boolean isRunning() {
        return isRunning;
    }

    /**
     * One resync tick. Never throws, so the schedule survives failures.
     */
    void resyncLoop() {
        try {
            Timer.Sample sample = Timer.start();
            ResyncResult result = cache.resync();
            sample.stop(resyncTimer);
            dirtyNodesGauge.set(result.getDirtyNodes() - result.getFlushedNodes().size());
            if (result.isAborted()) {
                abortedCounter.increment();
                log.warn("[{}] Resync aborted with {} dirty nodes", result.getLogId(), result.getDirtyNodes());
                return;
            }
            if (!result.getFlushedNodes().isEmpty()) {
                flushedCounter.increment(result.getFlushedNodes().size());
                log.info("[{}] Resync flushed nodes: {}", result.getLogId(), result.getFlushedNodes());
            }
        } catch (Exception e) {
            log.error("Error in resync loop: {}", e.getMessage(), e);
        }
    }
}
