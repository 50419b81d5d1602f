package io.topologycache.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.options.WatchOption;
import io.etcd.jetcd.watch.WatchEvent;
import io.etcd.jetcd.watch.WatchResponse;
import io.topologycache.models.Pod;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

import static io.topologycache.config.Constants.PATH_DELIMITER;

/**
 * Watches the pods of a cluster in etcd and hands every added or updated pod to a listener.
 * Deletions are ignored: a pod going away never makes cached data less safe.
 */
@Slf4j
public class EtcdPodWatcher implements Closeable {

    private final Consumer<Pod> podListener;
    private final ObjectMapper objectMapper;
    private final Watch.Watcher podWatcher;

    public EtcdPodWatcher(Client etcdClient, String clusterName, Consumer<Pod> podListener) {
        this.podListener = podListener;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        String prefix = EtcdPathResolver.getInstance().getPodsPrefix(clusterName) + PATH_DELIMITER;
        ByteSequence prefixBytes = ByteSequence.from(prefix, StandardCharsets.UTF_8);
        this.podWatcher = etcdClient.getWatchClient()
                .watch(prefixBytes, WatchOption.newBuilder().withPrefix(prefixBytes).build(), new PodListener());
        log.info("Watching pods under {}", prefix);
    }

    @Override
    public void close() {
        log.info("Closing pod watcher");
        podWatcher.close();
    }

    void handlePodChange(KeyValue keyValue) {
        try {
            Pod pod = objectMapper.readValue(keyValue.getValue().toString(StandardCharsets.UTF_8), Pod.class);
            podListener.accept(pod);
        } catch (Exception e) {
            log.warn("Failed to process pod change for key {}: {}",
                    keyValue.getKey().toString(StandardCharsets.UTF_8), e.getMessage());
        }
    }

    private class PodListener implements Watch.Listener {
        @Override
        public void onNext(WatchResponse watchResponse) {
            for (WatchEvent event : watchResponse.getEvents()) {
                if (event.getEventType() == WatchEvent.EventType.PUT) {
                    handlePodChange(event.getKeyValue());
                }
            }
        }

        @Override
        public void onError(Throwable throwable) {
            log.error("Error in pod watcher", throwable);
        }

        @Override
        public void onCompleted() {
            log.info("Pod watcher completed");
        }
    }
}
