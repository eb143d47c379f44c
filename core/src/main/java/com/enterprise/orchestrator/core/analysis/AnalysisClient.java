package com.enterprise.orchestrator.core.analysis;

import com.enterprise.orchestrator.core.model.AnalysisPayload;

/**
 * External text-analysis service, invoked once per page.
 */
public interface AnalysisClient {

    /**
     * @throws com.enterprise.orchestrator.core.exception.RateLimitedException when the service throttles
     * @throws com.enterprise.orchestrator.core.exception.AnalysisException    for any other failure
     */
    AnalysisPayload analyze(String pageText);
}
