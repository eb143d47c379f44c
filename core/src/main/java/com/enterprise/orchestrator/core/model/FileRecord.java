package com.enterprise.orchestrator.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metadata for one uploaded document. Only {@link #status} changes after creation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FileRecord {
    private String documentId;
    private String tenantId;
    private String fileName;
    private long fileSize;
    private String mimeType;
    private String bucket;
    private String blobKey;
    private ProcessingMode processingMode;
    private FileStatus status;
    private String errorMessage;
    private String uploadedAt;
    private String updatedAt;
}
