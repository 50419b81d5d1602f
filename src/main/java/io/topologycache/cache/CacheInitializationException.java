package io.topologycache.cache;

/**
 * Thrown when a cache cannot load its initial view of the node topologies.
 */
public class CacheInitializationException extends RuntimeException {

    public CacheInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
