package com.enterprise.orchestrator.core.analysis;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Bounded exponential backoff: {@code maxAttempts} calls in total, the n-th retry waits
 * {@code baseDelay * 2^(n-1)}.
 */
@Value
@Builder
public class RetryPolicy {

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration baseDelay = Duration.ofSeconds(2);

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public Duration delayBeforeRetry(int retryNumber) {
        return baseDelay.multipliedBy(1L << (retryNumber - 1));
    }
}
