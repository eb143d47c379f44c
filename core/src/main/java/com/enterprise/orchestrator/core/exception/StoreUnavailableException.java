package com.enterprise.orchestrator.core.exception;

public class StoreUnavailableException extends OrchestratorException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
