package io.topologycache.cache;

import io.topologycache.models.CachedTopology;
import io.topologycache.models.NodeResourceTopology;
import io.topologycache.models.Pod;
import io.topologycache.models.ResyncResult;
import io.topologycache.store.NodeTopologyClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Optional;

import static io.topologycache.TopologyFixtures.*;
import static io.topologycache.config.Constants.RESOURCE_CPU;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class PassthroughCacheTest {

    @Mock
    private NodeTopologyClient client;

    private PassthroughCache cache;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        cache = new PassthroughCache(client);
    }

    @Test
    void testRejectsNullClient() {
        assertThatThrownBy(() -> new PassthroughCache(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testGetCachedCopyReadsThrough() throws Exception {
        NodeResourceTopology nrt = nodeTopology("node-a", 4000, GIB);
        when(client.getNodeTopology("node-a")).thenReturn(Optional.of(nrt));

        CachedTopology result = cache.getCachedCopy("node-a", null);

        assertThat(result.isKnown()).isTrue();
        assertThat(result.getTopology()).isEqualTo(nrt);
        verify(client).getNodeTopology("node-a");
    }

    @Test
    void testGetCachedCopyMissingOrFailing() throws Exception {
        when(client.getNodeTopology("node-a")).thenReturn(Optional.empty());
        when(client.getNodeTopology("node-b")).thenThrow(new Exception("boom"));

        assertThat(cache.getCachedCopy("node-a", null).getTopology()).isNull();
        CachedTopology failed = cache.getCachedCopy("node-b", null);
        assertThat(failed.isKnown()).isTrue();
        assertThat(failed.getTopology()).isNull();
    }

    @Test
    void testReservationsAreNotTracked() throws Exception {
        when(client.getNodeTopology("node-a")).thenReturn(Optional.of(nodeTopology("node-a", 4000, GIB)));
        Pod pod = pod("p1", "node-a", 1000, GIB);

        cache.reserve("node-a", pod);
        cache.markMaybeOverReserved("node-a", pod);
        cache.markHasForeignPods("node-a", pod);
        cache.postBind("node-a", pod);

        CachedTopology result = cache.getCachedCopy("node-a", pod);
        assertThat(result.isKnown()).isTrue();
        assertThat(available(result.getTopology(), "node-0", RESOURCE_CPU)).isEqualTo(4000);

        cache.unreserve("node-a", pod);
        ResyncResult resync = cache.resync();
        assertThat(resync.getDirtyNodes()).isZero();
        assertThat(resync.getFlushedNodes()).isEmpty();
    }
}
