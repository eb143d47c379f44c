package com.enterprise.orchestrator.core.exception;

/**
 * Base type for failures raised by the orchestration core.
 */
public class OrchestratorException extends RuntimeException {

    public OrchestratorException(String message) {
        super(message);
    }

    public OrchestratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
