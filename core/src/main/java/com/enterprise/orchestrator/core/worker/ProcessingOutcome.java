package com.enterprise.orchestrator.core.worker;

public enum ProcessingOutcome {
    /** Every page was analysed (or marked failed) and counted. */
    PAGES_DISPATCHED,
    /** The document was not pending, e.g. a redelivered submission event. */
    SKIPPED,
    /** Download, extraction or bookkeeping failed; the document is marked failed. */
    FAILED
}
