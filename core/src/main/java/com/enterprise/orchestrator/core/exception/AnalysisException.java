package com.enterprise.orchestrator.core.exception;

public class AnalysisException extends OrchestratorException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
