package com.enterprise.orchestrator.core.blob;

public final class BlobKeys {

    public static final String MANIFEST_FILE = "results.json";

    private BlobKeys() {
    }

    public static String upload(String tenantId, String documentId, String fileName) {
        return tenantId + "/" + documentId + "/" + fileName;
    }

    public static String manifest(String tenantId, String documentId) {
        return tenantId + "/" + documentId + "/" + MANIFEST_FILE;
    }
}
