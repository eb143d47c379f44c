package com.enterprise.orchestrator.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PageRecord {
    private String documentId;
    private String tenantId;
    private int pageNumber;
    private PageOutcome outcome;
    private String updatedAt;
}
