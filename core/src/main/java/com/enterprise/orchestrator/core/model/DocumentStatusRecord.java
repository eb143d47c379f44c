package com.enterprise.orchestrator.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Document-level progress row. Completion is decided solely by comparing
 * {@link #processedPages} with {@link #totalPages}; a total of 0 means "not yet known".
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DocumentStatusRecord {
    private String documentId;
    private String tenantId;
    private int totalPages;
    private int processedPages;
    private int failedPages;
    private OverallStatus overallStatus;
    private String resultKey;
    private String errorMessage;
    private String startedAt;
    private String completedAt;
    private String createdAt;
    private String updatedAt;

    public boolean isReadyForAggregation() {
        return totalPages > 0
                && processedPages == totalPages
                && overallStatus == OverallStatus.PROCESSING;
    }
}
