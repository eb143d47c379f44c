package com.enterprise.orchestrator.core.blob;

import com.enterprise.orchestrator.core.exception.BlobUnavailableException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryBlobStore implements BlobStore {

    private final String bucket;
    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    private final Map<String, String> contentTypes = new ConcurrentHashMap<>();
    private final AtomicInteger putCount = new AtomicInteger();

    public InMemoryBlobStore(String bucket) {
        this.bucket = bucket;
    }

    @Override
    public void put(String key, byte[] data, String contentType) {
        objects.put(key, data.clone());
        contentTypes.put(key, contentType);
        putCount.incrementAndGet();
    }

    @Override
    public byte[] get(String key) {
        byte[] data = objects.get(key);
        if (data == null) {
            throw new BlobUnavailableException("Object not found: " + bucket + "/" + key);
        }
        return data.clone();
    }

    @Override
    public boolean exists(String key) {
        return objects.containsKey(key);
    }

    @Override
    public void delete(String key) {
        objects.remove(key);
        contentTypes.remove(key);
    }

    @Override
    public String bucket() {
        return bucket;
    }

    public String contentType(String key) {
        return contentTypes.get(key);
    }

    /**
     * Number of writes since creation, overwrites included.
     */
    public int putCount() {
        return putCount.get();
    }
}
