package com.enterprise.orchestrator.core.exception;

/**
 * The analysis service asked us to slow down. The only failure the page retry loop retries.
 */
public class RateLimitedException extends OrchestratorException {

    public RateLimitedException(String message) {
        super(message);
    }

    public RateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }
}
