package com.enterprise.orchestrator.core.analysis;

import com.enterprise.orchestrator.core.exception.RateLimitedException;
import com.enterprise.orchestrator.core.model.AnalysisPayload;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Wraps an {@link AnalysisClient} and retries rate-limited calls with exponential backoff.
 * Any other failure is thrown on the first attempt.
 * <p>
 * An interrupt does not cancel a call in flight: a backoff cut short by it moves straight on to the
 * next attempt, and the interrupt flag is restored once the call has finished one way or the other.
 */
@Slf4j
public class RetryingAnalyzer {

    private final AnalysisClient client;
    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public RetryingAnalyzer(AnalysisClient client, RetryPolicy policy, Sleeper sleeper) {
        if (policy.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.client = client;
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public AnalysisPayload analyze(String pageText) {
        boolean interrupted = false;
        try {
            int attempt = 1;
            while (true) {
                try {
                    return client.analyze(pageText);
                } catch (RateLimitedException e) {
                    if (attempt >= policy.getMaxAttempts()) {
                        log.warn("Rate limit persisted after {} attempts", attempt);
                        throw e;
                    }
                    Duration delay = policy.delayBeforeRetry(attempt);
                    log.warn("Rate limit hit, retrying in {}ms (attempt {}/{})",
                            delay.toMillis(), attempt + 1, policy.getMaxAttempts());
                    if (!pause(delay)) {
                        interrupted = true;
                    }
                    attempt++;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * @return false if the pause was cut short by an interrupt
     */
    private boolean pause(Duration delay) {
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            log.warn("Interrupted while backing off, retrying without waiting out {}ms", delay.toMillis());
            return false;
        }
    }
}
