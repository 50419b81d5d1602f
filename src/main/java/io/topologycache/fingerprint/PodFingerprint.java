package io.topologycache.fingerprint;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Order independent digest over a set of pod identities.
 * <p>
 * Every pod contributes a 64 bit hash of its namespace and name; the hashes are sorted
 * and folded into a second hash, so the result only depends on the set of pods.
 * The signature is {@code PREFIX + VERSION + hex(digest)}.
 */
public class PodFingerprint {

    public static final String PREFIX = "pfp0";
    public static final String VERSION = "v001";

    // Where the node agent publishes the fingerprint in the topology snapshot
    public static final String ATTRIBUTE = "nodeTopologyPodsFingerprint";
    public static final String ATTRIBUTE_METHOD = "nodeTopologyPodsFingerprintMethod";
    public static final String ANNOTATION = "topology.node.k8s.io/fingerprint";

    // Values of ATTRIBUTE_METHOD
    public static final String METHOD_ALL = "all";
    public static final String METHOD_WITH_EXCLUSIVE_RESOURCES = "with-exclusive-resources";

    private static final HashFunction POD_HASH = Hashing.farmHashFingerprint64();
    private static final HashFunction SET_HASH = Hashing.farmHashFingerprint64();

    private final List<Long> hashes;
    private final FingerprintStatus status;

    public PodFingerprint(int sizeHint) {
        this(sizeHint, null);
    }

    private PodFingerprint(int sizeHint, FingerprintStatus status) {
        this.hashes = new ArrayList<>(Math.max(sizeHint, 0));
        this.status = status;
    }

    /**
     * Fingerprint which also records the pods it was fed and the signatures it produced.
     */
    public static PodFingerprint tracing(int sizeHint, FingerprintStatus status) {
        return new PodFingerprint(sizeHint, status);
    }

    public void add(String namespace, String name) {
        long hash = POD_HASH.newHasher()
                .putString(namespace, UTF_8)
                .putByte((byte) 0)
                .putString(name, UTF_8)
                .hash()
                .asLong();
        hashes.add(hash);
        if (status != null) {
            status.addPod(namespace, name);
        }
    }

    public String sum() {
        List<Long> sorted = new ArrayList<>(hashes);
        Collections.sort(sorted);
        Hasher hasher = SET_HASH.newHasher();
        hasher.putInt(sorted.size());
        for (Long hash : sorted) {
            hasher.putLong(hash);
        }
        return hasher.hash().toString();
    }

    public String sign() {
        String signature = PREFIX + VERSION + sum();
        if (status != null) {
            status.setFingerprintComputed(signature);
        }
        return signature;
    }

    /**
     * Compares the signature of the current pod set with the expected one.
     *
     * @return true if they match
     * @throws MalformedFingerprintException if the expected signature has an unknown prefix or version
     */
    public boolean check(String expected) throws MalformedFingerprintException {
        if (status != null) {
            status.setFingerprintExpected(expected);
        }
        if (expected == null || !expected.startsWith(PREFIX)) {
            throw new MalformedFingerprintException("malformed pod fingerprint: " + expected);
        }
        if (!expected.startsWith(PREFIX + VERSION)) {
            throw new MalformedFingerprintException("incompatible pod fingerprint version: " + expected);
        }
        return sign().equals(expected);
    }
}
