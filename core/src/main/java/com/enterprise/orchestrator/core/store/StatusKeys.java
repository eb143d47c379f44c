package com.enterprise.orchestrator.core.store;

import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Key layout of the single orchestrator table.
 */
public final class StatusKeys {

    public static final String PK = "PK";
    public static final String SK = "SK";
    public static final String GSI1 = "GSI1";
    public static final String GSI1_PK = "GSI1PK";
    public static final String GSI1_SK = "GSI1SK";

    public static final String STATUS_SK = "STATUS";
    public static final String METADATA_SK = "METADATA";
    public static final String PAGE_SK_PREFIX = "PAGE#";

    private StatusKeys() {
    }

    public static Map<String, AttributeValue> file(String documentId) {
        return Map.of(PK, s("FILE#" + documentId), SK, s(METADATA_SK));
    }

    public static Map<String, AttributeValue> documentStatus(String documentId) {
        return Map.of(PK, s(documentPk(documentId)), SK, s(STATUS_SK));
    }

    public static Map<String, AttributeValue> page(String documentId, int pageNumber) {
        return Map.of(PK, s(documentPk(documentId)), SK, s(pageSk(pageNumber)));
    }

    public static String documentPk(String documentId) {
        return "DOC#" + documentId;
    }

    public static String pageSk(int pageNumber) {
        return PAGE_SK_PREFIX + String.format("%04d", pageNumber);
    }

    public static String tenantFilesGsiPk(String tenantId) {
        return "TENANT#" + tenantId;
    }

    public static String tenantStatusGsiPk(String tenantId) {
        return "TENANT#" + tenantId + "#STATUS";
    }

    public static long ttl(int retentionDays) {
        return Instant.now().plus(Duration.ofDays(retentionDays)).getEpochSecond();
    }

    private static AttributeValue s(String value) {
        return AttributeValue.builder().s(value).build();
    }
}
