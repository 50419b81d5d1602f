package io.topologycache.podprovider;

import io.topologycache.enums.CacheInformerMode;
import io.topologycache.enums.PodPhase;
import io.topologycache.models.Pod;
import org.junit.jupiter.api.Test;

import static io.topologycache.TopologyFixtures.*;
import static org.assertj.core.api.Assertions.*;

class PodFiltersTest {

    private static Pod podIn(PodPhase phase, String nodeName) {
        Pod pod = pod("p1", nodeName, 100, GIB);
        pod.setPhase(phase);
        return pod;
    }

    @Test
    void testAlwaysRequiresBinding() {
        assertThat(PodFilters.ALWAYS.isRelevant(podIn(PodPhase.SUCCEEDED, "node-a"), "test")).isTrue();
        assertThat(PodFilters.ALWAYS.isRelevant(podIn(PodPhase.RUNNING, ""), "test")).isFalse();
        assertThat(PodFilters.ALWAYS.isRelevant(null, "test")).isFalse();
    }

    @Test
    void testSharedOnlyRunning() {
        assertThat(PodFilters.SHARED.isRelevant(podIn(PodPhase.RUNNING, "node-a"), "test")).isTrue();
        assertThat(PodFilters.SHARED.isRelevant(podIn(PodPhase.PENDING, "node-a"), "test")).isFalse();
        assertThat(PodFilters.SHARED.isRelevant(podIn(PodPhase.FAILED, "node-a"), "test")).isFalse();
    }

    @Test
    void testDedicatedRunningOrPending() {
        assertThat(PodFilters.DEDICATED.isRelevant(podIn(PodPhase.RUNNING, "node-a"), "test")).isTrue();
        assertThat(PodFilters.DEDICATED.isRelevant(podIn(PodPhase.PENDING, "node-a"), "test")).isTrue();
        assertThat(PodFilters.DEDICATED.isRelevant(podIn(PodPhase.PENDING, null), "test")).isFalse();
        assertThat(PodFilters.DEDICATED.isRelevant(podIn(PodPhase.SUCCEEDED, "node-a"), "test")).isFalse();
    }

    @Test
    void testForInformerMode() {
        assertThat(PodFilters.forInformerMode(CacheInformerMode.SHARED)).isSameAs(PodFilters.SHARED);
        assertThat(PodFilters.forInformerMode(CacheInformerMode.DEDICATED)).isSameAs(PodFilters.DEDICATED);
        assertThat(PodFilters.forInformerMode(null)).isSameAs(PodFilters.DEDICATED);
    }
}
