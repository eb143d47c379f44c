package com.enterprise.orchestrator.core.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of analysing one page, decided once when the page is written.
 * A success carries the analysis; a failure carries the reason and when it happened.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PageOutcome {

    boolean success;
    AnalysisPayload payload;
    String reason;
    String failedAt;

    public static PageOutcome success(AnalysisPayload payload) {
        return new PageOutcome(true, payload, null, null);
    }

    public static PageOutcome failure(String reason, String failedAt) {
        return new PageOutcome(false, null, reason, failedAt);
    }
}
