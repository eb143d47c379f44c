package com.enterprise.orchestrator.service;

import com.enterprise.orchestrator.core.exception.OrchestratorException;

/**
 * The document exists but has no result manifest yet (still running, or failed).
 */
public class ResultNotAvailableException extends OrchestratorException {

    public ResultNotAvailableException(String documentId, String status) {
        super("Result not available for document " + documentId + ", current status: " + status);
    }
}
