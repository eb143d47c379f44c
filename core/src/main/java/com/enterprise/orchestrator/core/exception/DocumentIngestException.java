package com.enterprise.orchestrator.core.exception;

/**
 * Whole-document failure before any page was enumerated: download or extraction failed.
 */
public class DocumentIngestException extends OrchestratorException {

    public DocumentIngestException(String message) {
        super(message);
    }

    public DocumentIngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
