package com.enterprise.orchestrator.core.blob;

/**
 * Key/value object storage scoped to one bucket. Keys are namespaced {@code {tenant}/{document}/...}.
 */
public interface BlobStore {

    void put(String key, byte[] data, String contentType);

    /**
     * @throws com.enterprise.orchestrator.core.exception.BlobUnavailableException if the object is
     *                                                                            missing or unreadable
     */
    byte[] get(String key);

    boolean exists(String key);

    void delete(String key);

    String bucket();
}
