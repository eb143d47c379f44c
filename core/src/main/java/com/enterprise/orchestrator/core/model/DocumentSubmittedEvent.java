package com.enterprise.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of a {@code document.uploaded} event on the partitioned log.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DocumentSubmittedEvent {
    public static final String EVENT_TYPE = "document.uploaded";

    private String documentId;
    private String tenantId;
    private String blobKey;
    private String bucket;
    private String fileName;
    private long size;
}
