package com.enterprise.orchestrator.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Aggregated result for a completed document, written to {@code {tenant}/{document}/results.json}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResultManifest {
    private String documentId;
    private String tenantId;
    private String processedAt;
    private int totalPages;
    private int successCount;
    private int failedCount;
    private List<Chunk> chunks;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Chunk {
        private int pageNumber;
        private String status; // success | failed
        private AnalysisPayload analysis;
        private String error;
        private String failedAt;
    }
}
