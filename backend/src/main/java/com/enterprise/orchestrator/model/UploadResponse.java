package com.enterprise.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadResponse {
    private String documentId;
    private String tenantId;
    private String fileName;
    private String status;
    private String processingMode; // sync | async
    private String message;
}
