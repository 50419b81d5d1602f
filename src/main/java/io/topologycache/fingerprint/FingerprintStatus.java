package io.topologycache.fingerprint;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Trace of a fingerprint computation, kept to explain mismatches in the logs.
 */
@Data
public class FingerprintStatus {
    private final String nodeName;
    private final List<String> pods = new ArrayList<>();
    private String fingerprintExpected;
    private String fingerprintComputed;

    public void addPod(String namespace, String name) {
        pods.add(namespace + "/" + name);
    }
}
