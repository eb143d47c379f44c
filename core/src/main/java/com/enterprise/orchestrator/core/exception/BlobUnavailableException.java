package com.enterprise.orchestrator.core.exception;

public class BlobUnavailableException extends OrchestratorException {

    public BlobUnavailableException(String message) {
        super(message);
    }

    public BlobUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
