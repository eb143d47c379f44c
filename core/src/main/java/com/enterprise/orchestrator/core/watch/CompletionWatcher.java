package com.enterprise.orchestrator.core.watch;

import com.enterprise.orchestrator.core.aggregate.AggregationOutcome;
import com.enterprise.orchestrator.core.aggregate.Aggregator;
import com.enterprise.orchestrator.core.model.DocumentStatusRecord;
import com.enterprise.orchestrator.core.store.StatusKeys;
import com.enterprise.orchestrator.core.store.StatusStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Decides when a document has just become eligible for aggregation and hands it to the
 * {@link Aggregator}.
 * <p>
 * Two paths feed it: change-feed entries via {@link #onChange(StatusChange)}, and a periodic scan
 * started with {@link #start()} for environments without push delivery. Both may fire for the same
 * document; the aggregator's compare-and-set makes the duplicate a no-op.
 */
@Slf4j
public class CompletionWatcher implements AutoCloseable {

    private final StatusStore statusStore;
    private final Aggregator aggregator;
    private final Duration pollInterval;

    private ScheduledExecutorService scheduler;

    public CompletionWatcher(StatusStore statusStore, Aggregator aggregator, Duration pollInterval) {
        this.statusStore = statusStore;
        this.aggregator = aggregator;
        this.pollInterval = pollInterval;
    }

    /**
     * True when the entry is a document status record whose new image has every page counted and
     * is still processing.
     */
    public static boolean shouldAggregate(StatusChange change) {
        if (change == null || "REMOVE".equals(change.getEventName())) {
            return false;
        }
        if (!StatusKeys.STATUS_SK.equals(change.getSortKey())) {
            return false;
        }
        DocumentStatusRecord after = change.getAfter();
        return after != null && after.isReadyForAggregation();
    }

    /**
     * Push path. Aggregation failures propagate to the caller.
     *
     * @return true if aggregation was attempted
     */
    public boolean onChange(StatusChange change) {
        if (!shouldAggregate(change)) {
            return false;
        }
        DocumentStatusRecord after = change.getAfter();
        log.info("Triggering aggregation from change feed: docId={}", after.getDocumentId());
        aggregator.aggregateResults(after.getDocumentId(), after.getTenantId(), after.getTotalPages());
        return true;
    }

    /**
     * Poll path: scan for ready documents and aggregate each, logging per-document failures.
     *
     * @return number of documents that completed in this cycle
     */
    public int pollOnce() {
        List<DocumentStatusRecord> ready = statusStore.scanReadyForAggregation();
        if (ready.isEmpty()) {
            log.debug("No documents ready for aggregation");
            return 0;
        }

        log.info("Found {} documents ready for aggregation", ready.size());
        int completed = 0;
        for (DocumentStatusRecord doc : ready) {
            if (!doc.isReadyForAggregation()) {
                continue;
            }
            try {
                AggregationOutcome outcome = aggregator.aggregateResults(
                        doc.getDocumentId(), doc.getTenantId(), doc.getTotalPages());
                if (outcome == AggregationOutcome.COMPLETED) {
                    completed++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to aggregate document: docId={}", doc.getDocumentId(), e);
            }
        }
        return completed;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        log.info("Starting completion poller, interval={}ms", pollInterval.toMillis());
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "completion-poller");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::pollSafely, pollInterval.toMillis(), pollInterval.toMillis(),
                TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        log.info("Stopping completion poller");
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(pollInterval.toMillis() + 5_000, TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    private void pollSafely() {
        try {
            pollOnce();
        } catch (RuntimeException e) {
            // an exception would cancel the scheduled task
            log.error("Error in completion poller", e);
        }
    }

    @Override
    public void close() {
        stop();
    }
}
