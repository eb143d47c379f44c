package com.enterprise.orchestrator.core.exception;

public class AlreadyExistsException extends OrchestratorException {

    public AlreadyExistsException(String documentId) {
        super("Status record already exists for document: " + documentId);
    }
}
