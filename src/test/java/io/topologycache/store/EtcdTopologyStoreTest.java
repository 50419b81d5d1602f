package io.topologycache.store;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.ClientBuilder;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.options.GetOption;
import io.topologycache.enums.PodPhase;
import io.topologycache.models.NodeResourceTopology;
import io.topologycache.models.Pod;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.MockedStatic;
import org.mockito.Mockito;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static io.topologycache.config.Constants.RESOURCE_CPU;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for EtcdTopologyStore.
 */
public class EtcdTopologyStoreTest {

    private static final String CLUSTER = "test-cluster";

    private static final String NRT_JSON = "{\"name\":\"node-a\",\"zones\":[{\"name\":\"node-0\",\"type\":\"Node\","
            + "\"resources\":[{\"name\":\"cpu\",\"capacity\":4000,\"allocatable\":4000,\"available\":3000}]}],"
            + "\"attributes\":[{\"name\":\"nodeTopologyPodsFingerprint\",\"value\":\"pfp0v001abc\"}],"
            + "\"agentVersion\":\"v1\"}";

    private static final String POD_JSON = "{\"namespace\":\"default\",\"name\":\"p1\",\"node_name\":\"node-a\","
            + "\"scheduler_name\":\"topology-aware-scheduler\",\"phase\":\"RUNNING\","
            + "\"containers\":[{\"name\":\"main\",\"requests\":{\"cpu\":1000}}]}";

    private Client mockEtcdClient;
    private KV mockKv;
    private EtcdTopologyStore store;

    @BeforeEach
    public void setUp() {
        mockEtcdClient = mock(Client.class);
        mockKv = mock(KV.class);
        when(mockEtcdClient.getKVClient()).thenReturn(mockKv);
        store = new EtcdTopologyStore(mockEtcdClient, CLUSTER);
    }

    // ------------------------- helpers -------------------------

    private GetResponse mockGetResponse(List<KeyValue> kvs) {
        GetResponse resp = mock(GetResponse.class);
        when(resp.getKvs()).thenReturn(kvs);
        when(resp.getCount()).thenReturn((long) kvs.size());
        return resp;
    }

    private KeyValue mockKv(String valueUtf8) {
        KeyValue kv = mock(KeyValue.class);
        when(kv.getValue()).thenReturn(ByteSequence.from(valueUtf8, StandardCharsets.UTF_8));
        return kv;
    }

    private void stubPrefixGet(GetResponse response) {
        when(mockKv.get(any(ByteSequence.class), any(GetOption.class)))
                .thenReturn(CompletableFuture.completedFuture(response));
    }

    private void stubGet(GetResponse response) {
        when(mockKv.get(any(ByteSequence.class))).thenReturn(CompletableFuture.completedFuture(response));
    }

    // ------------------------- node topologies -------------------------

    @Test
    public void testListNodeTopologies() throws Exception {
        GetResponse response = mockGetResponse(List.of(mockKv(NRT_JSON)));
        stubPrefixGet(response);

        List<NodeResourceTopology> nrts = store.listNodeTopologies();

        assertThat(nrts).hasSize(1);
        NodeResourceTopology nrt = nrts.get(0);
        assertThat(nrt.getName()).isEqualTo("node-a");
        assertThat(nrt.getZones().get(0).getResources().get(0).getName()).isEqualTo(RESOURCE_CPU);
        assertThat(nrt.getZones().get(0).getResources().get(0).getAvailable()).isEqualTo(3000);
        assertThat(nrt.getAttribute("nodeTopologyPodsFingerprint")).contains("pfp0v001abc");

        ArgumentCaptor<ByteSequence> keyCaptor = ArgumentCaptor.forClass(ByteSequence.class);
        verify(mockKv).get(keyCaptor.capture(), any(GetOption.class));
        assertThat(keyCaptor.getValue().toString(StandardCharsets.UTF_8)).isEqualTo("/test-cluster/node-topology/");
    }

    @Test
    public void testListNodeTopologiesEmpty() throws Exception {
        GetResponse response = mockGetResponse(Collections.emptyList());
        stubPrefixGet(response);

        assertThat(store.listNodeTopologies()).isEmpty();
    }

    @Test
    public void testListNodeTopologiesFailure() {
        when(mockKv.get(any(ByteSequence.class), any(GetOption.class)))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("connection refused")));

        assertThatThrownBy(() -> store.listNodeTopologies())
                .isInstanceOf(Exception.class)
                .hasMessageContaining("Failed to retrieve node topologies");
    }

    @Test
    public void testGetNodeTopology() throws Exception {
        GetResponse response = mockGetResponse(List.of(mockKv(NRT_JSON)));
        stubGet(response);

        Optional<NodeResourceTopology> nrt = store.getNodeTopology("node-a");

        assertThat(nrt).isPresent();
        assertThat(nrt.get().getName()).isEqualTo("node-a");

        ArgumentCaptor<ByteSequence> keyCaptor = ArgumentCaptor.forClass(ByteSequence.class);
        verify(mockKv).get(keyCaptor.capture());
        assertThat(keyCaptor.getValue().toString(StandardCharsets.UTF_8)).isEqualTo("/test-cluster/node-topology/node-a");
    }

    @Test
    public void testGetNodeTopologyNotFound() throws Exception {
        GetResponse response = mockGetResponse(Collections.emptyList());
        stubGet(response);

        assertThat(store.getNodeTopology("node-x")).isEmpty();
    }

    @Test
    public void testGetNodeTopologyMalformedJson() {
        GetResponse response = mockGetResponse(List.of(mockKv("{not json")));
        stubGet(response);

        assertThatThrownBy(() -> store.getNodeTopology("node-a"))
                .isInstanceOf(Exception.class)
                .hasMessageContaining("node-a");
    }

    // ------------------------- pods -------------------------

    @Test
    public void testListPods() throws Exception {
        GetResponse response = mockGetResponse(List.of(mockKv(POD_JSON)));
        stubPrefixGet(response);

        List<Pod> pods = store.listPods();

        assertThat(pods).hasSize(1);
        Pod pod = pods.get(0);
        assertThat(pod.getKey()).isEqualTo("default/p1");
        assertThat(pod.getNodeName()).isEqualTo("node-a");
        assertThat(pod.getPhase()).isEqualTo(PodPhase.RUNNING);
        assertThat(pod.getContainers().get(0).getRequests()).containsEntry(RESOURCE_CPU, 1000L);
        assertThat(pod.isBound()).isTrue();

        ArgumentCaptor<ByteSequence> keyCaptor = ArgumentCaptor.forClass(ByteSequence.class);
        verify(mockKv).get(keyCaptor.capture(), any(GetOption.class));
        String podPath = EtcdPathResolver.getInstance().getPodPath(CLUSTER, "default", "p1");
        assertThat(podPath).startsWith(keyCaptor.getValue().toString(StandardCharsets.UTF_8));
    }

    @Test
    public void testListPodsFailure() {
        when(mockKv.get(any(ByteSequence.class), any(GetOption.class)))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("timeout")));

        assertThatThrownBy(() -> store.listPods())
                .isInstanceOf(Exception.class)
                .hasMessageContaining("Failed to retrieve pods");
    }

    // ------------------------- lifecycle -------------------------

    @Test
    public void testConnectBuildsClient() {
        try (MockedStatic<Client> clientStaticMock = Mockito.mockStatic(Client.class)) {
            ClientBuilder mockBuilder = mock(ClientBuilder.class);
            clientStaticMock.when(Client::builder).thenReturn(mockBuilder);
            when(mockBuilder.endpoints(any(String[].class))).thenReturn(mockBuilder);
            when(mockBuilder.build()).thenReturn(mockEtcdClient);

            EtcdTopologyStore connected = EtcdTopologyStore.connect(new String[]{"http://localhost:2379"}, CLUSTER);

            assertThat(connected.getEtcdClient()).isSameAs(mockEtcdClient);
        }
    }

    @Test
    public void testCloseClosesClient() {
        store.close();

        verify(mockEtcdClient).close();
    }
}
