package io.topologycache.fingerprint;

/**
 * Raised when a published fingerprint signature cannot be interpreted,
 * e.g. because of an unknown prefix or an incompatible version.
 */
public class MalformedFingerprintException extends Exception {

    public MalformedFingerprintException(String message) {
        super(message);
    }
}
