package com.enterprise.orchestrator.service;

import com.enterprise.orchestrator.core.watch.CompletionWatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Runs the completion watcher's poll path inside the service, for deployments where no change
 * feed invokes the aggregator Lambda (LocalStack, single node).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompletionPollerLifecycle implements SmartLifecycle {

    private final CompletionWatcher completionWatcher;

    @Value("${orchestrator.watcher.poll-enabled:true}")
    private boolean pollEnabled;

    @Override
    public void start() {
        if (!pollEnabled) {
            log.info("Completion poller disabled, relying on the change feed");
            return;
        }
        completionWatcher.start();
    }

    @Override
    public void stop() {
        completionWatcher.stop();
    }

    @Override
    public boolean isRunning() {
        return completionWatcher.isRunning();
    }
}
