package com.enterprise.orchestrator.core.worker;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class WorkerSettings {

    /**
     * Pages analysed concurrently. 1 walks the pages strictly in order.
     */
    @Builder.Default
    int parallelism = 1;

    /**
     * Pause between pages in sequential mode, to stay under the analysis service's rate limit.
     */
    @Builder.Default
    Duration interPageDelay = Duration.ZERO;

    /**
     * Attempts at writing one page record while the status store is unavailable. When they run out the
     * document fails instead of counting a page that was never written.
     */
    @Builder.Default
    int pageWriteAttempts = 3;

    @Builder.Default
    Duration pageWriteBackoff = Duration.ofMillis(200);

    public static WorkerSettings sequential() {
        return WorkerSettings.builder().build();
    }
}
