package com.enterprise.orchestrator.core.exception;

public class DocumentNotFoundException extends OrchestratorException {

    public DocumentNotFoundException(String documentId) {
        super("Document not found: " + documentId);
    }
}
