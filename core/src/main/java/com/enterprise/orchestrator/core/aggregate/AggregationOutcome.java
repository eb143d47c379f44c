package com.enterprise.orchestrator.core.aggregate;

public enum AggregationOutcome {
    /** Manifest written and document completed. */
    COMPLETED,
    /** Fewer page records visible than expected; document returned to processing. */
    DEFERRED,
    /** Another trigger owns the document, or it is not processing. */
    SKIPPED
}
