package io.topologycache.cache;

import io.topologycache.enums.CacheResyncMethod;
import io.topologycache.enums.FingerprintCheckResult;
import io.topologycache.fingerprint.FingerprintStatus;
import io.topologycache.fingerprint.MalformedFingerprintException;
import io.topologycache.fingerprint.PodFingerprint;
import io.topologycache.models.NodeResourceTopology;
import io.topologycache.models.PodData;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Decides whether a published snapshot already accounts for the pods running on its node,
 * by recomputing the pod set fingerprint the node agent embedded in it.
 */
@Slf4j
final class PodFingerprintCheck {

    private PodFingerprintCheck() {
        // Utility class
    }

    /**
     * Fingerprint published in a snapshot and the pod scope it was computed over.
     */
    @Data
    @AllArgsConstructor
    static class ExpectedFingerprint {
        private final String value; // empty if the snapshot carries none
        private final boolean onlyExclusiveResources;

        boolean isMissing() {
            return value == null || value.isEmpty();
        }
    }

    static ExpectedFingerprint expectedFingerprint(NodeResourceTopology nrt, CacheResyncMethod method) {
        boolean onlyExclRes;
        if (method == CacheResyncMethod.ONLY_EXCLUSIVE_RESOURCES) {
            onlyExclRes = true;
        } else if (method == CacheResyncMethod.ALL_RESOURCES) {
            onlyExclRes = false;
        } else {
            onlyExclRes = nrt.getAttribute(PodFingerprint.ATTRIBUTE_METHOD)
                    .map(PodFingerprint.METHOD_WITH_EXCLUSIVE_RESOURCES::equals)
                    .orElse(false);
        }

        // attributes take precedence over the legacy annotation
        String pfp = nrt.getAttribute(PodFingerprint.ATTRIBUTE).orElse("");
        if (pfp.isEmpty() && nrt.getAnnotations() != null) {
            pfp = nrt.getAnnotations().getOrDefault(PodFingerprint.ANNOTATION, "");
        }
        return new ExpectedFingerprint(pfp, onlyExclRes);
    }

    static FingerprintCheckResult check(String logId, String nodeName, List<PodData> pods, ExpectedFingerprint expected)
            throws MalformedFingerprintException {
        if (expected.isMissing()) {
            return FingerprintCheckResult.MISSING;
        }

        FingerprintStatus status = new FingerprintStatus(nodeName);
        PodFingerprint pfp = PodFingerprint.tracing(pods.size(), status);
        for (PodData pod : pods) {
            if (expected.isOnlyExclusiveResources() && !pod.isHasExclusiveResources()) {
                continue;
            }
            pfp.add(pod.getNamespace(), pod.getName());
        }

        boolean match = pfp.check(expected.getValue());
        log.debug("[{}] Podset fingerprint check node={} expected={} computed={} onlyExclusiveResources={}",
                logId, nodeName, status.getFingerprintExpected(), status.getFingerprintComputed(),
                expected.isOnlyExclusiveResources());
        log.trace("[{}] Podset fingerprint pods node={} pods={}", logId, nodeName, status.getPods());
        return match ? FingerprintCheckResult.MATCH : FingerprintCheckResult.MISMATCH;
    }
}
