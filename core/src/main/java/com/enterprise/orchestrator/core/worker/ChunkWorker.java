package com.enterprise.orchestrator.core.worker;

import com.enterprise.orchestrator.core.analysis.RetryingAnalyzer;
import com.enterprise.orchestrator.core.analysis.Sleeper;
import com.enterprise.orchestrator.core.blob.BlobStore;
import com.enterprise.orchestrator.core.exception.DocumentIngestException;
import com.enterprise.orchestrator.core.exception.OrchestratorException;
import com.enterprise.orchestrator.core.exception.StoreUnavailableException;
import com.enterprise.orchestrator.core.extract.PageExtractor;
import com.enterprise.orchestrator.core.model.FileStatus;
import com.enterprise.orchestrator.core.model.OverallStatus;
import com.enterprise.orchestrator.core.model.PageOutcome;
import com.enterprise.orchestrator.core.store.StatusStore;
import com.enterprise.orchestrator.core.store.StatusUpdate;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Processes one submitted document page by page.
 * <p>
 * Workflow:
 * 1. pending → processing (a document that is not pending is skipped)
 * 2. Download the source blob and extract page text; any failure here marks the document failed
 *    without touching the processed-page counter
 * 3. Record the total page count
 * 4. Analyse each page with bounded retry and write a success or failure record
 * 5. Increment the processed-page counter for every page once its record is written, whatever the
 *    analysis outcome
 * <p>
 * A page record that cannot be written after {@link WorkerSettings#getPageWriteAttempts()} attempts
 * fails the whole document; the page is never counted without its record.
 * <p>
 * The worker never aggregates. Completion is detected from the counter by the completion watcher.
 */
@Slf4j
public class ChunkWorker implements AutoCloseable {

    private final StatusStore statusStore;
    private final BlobStore sourceBlobs;
    private final PageExtractor pageExtractor;
    private final RetryingAnalyzer analyzer;
    private final WorkerSettings settings;
    private final Sleeper sleeper;
    private final ExecutorService pagePool;

    public ChunkWorker(StatusStore statusStore, BlobStore sourceBlobs, PageExtractor pageExtractor,
                       RetryingAnalyzer analyzer, WorkerSettings settings, Sleeper sleeper) {
        this.statusStore = statusStore;
        this.sourceBlobs = sourceBlobs;
        this.pageExtractor = pageExtractor;
        this.analyzer = analyzer;
        this.settings = settings;
        this.sleeper = sleeper;
        this.pagePool = settings.getParallelism() > 1
                ? Executors.newFixedThreadPool(settings.getParallelism())
                : null;
    }

    public ProcessingOutcome processDocument(String documentId, String tenantId, String blobKey) {
        log.info("Processing document: docId={}, tenantId={}, blob={}", documentId, tenantId, blobKey);

        if (!statusStore.compareAndSetStatus(documentId, OverallStatus.PENDING, OverallStatus.PROCESSING,
                StatusUpdate.none())) {
            log.warn("Skipping document not in pending state: docId={}, status={}", documentId,
                    statusStore.getDocument(documentId).map(s -> s.getOverallStatus().value()).orElse("missing"));
            return ProcessingOutcome.SKIPPED;
        }
        statusStore.updateFileStatus(documentId, FileStatus.PROCESSING, null);

        List<String> pages;
        try {
            byte[] source = sourceBlobs.get(blobKey);
            pages = pageExtractor.extractPages(source);
            if (pages.isEmpty()) {
                throw new DocumentIngestException("Document has no pages");
            }
            statusStore.setTotalPages(documentId, pages.size());
        } catch (RuntimeException e) {
            markFailed(documentId, "Ingest failed: " + e.getMessage(), e);
            return ProcessingOutcome.FAILED;
        }

        log.info("Created {} chunks (one per page): docId={}", pages.size(), documentId);

        try {
            if (pagePool == null) {
                processSequentially(documentId, tenantId, pages);
            } else {
                processInParallel(documentId, tenantId, pages);
            }
        } catch (RuntimeException e) {
            markFailed(documentId, "Page bookkeeping failed: " + e.getMessage(), e);
            return ProcessingOutcome.FAILED;
        }

        log.info("Page processing complete, awaiting aggregation: docId={}", documentId);
        return ProcessingOutcome.PAGES_DISPATCHED;
    }

    private void processSequentially(String documentId, String tenantId, List<String> pages) {
        for (int i = 0; i < pages.size(); i++) {
            log.info("Processing page {}/{}: docId={}", i + 1, pages.size(), documentId);
            processPage(documentId, tenantId, i + 1, pages.get(i));
            if (i < pages.size() - 1) {
                pauseBetweenPages();
            }
        }
    }

    private void processInParallel(String documentId, String tenantId, List<String> pages) {
        List<Future<?>> futures = new ArrayList<>(pages.size());
        for (int i = 0; i < pages.size(); i++) {
            int pageNumber = i + 1;
            String text = pages.get(i);
            futures.add(pagePool.submit(() -> processPage(documentId, tenantId, pageNumber, text)));
        }
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                if (e.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) e.getCause();
                }
                throw new OrchestratorException("Page task failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OrchestratorException("Interrupted while waiting for page tasks", e);
            }
        }
    }

    /**
     * Analyse, record and count one page. Analysis failures become failure records and are counted like
     * any other page. Store failures escape and fail the document.
     */
    void processPage(String documentId, String tenantId, int pageNumber, String text) {
        PageOutcome outcome;
        try {
            outcome = PageOutcome.success(analyzer.analyze(text));
        } catch (RuntimeException e) {
            log.error("Failed to analyse page {}: docId={}, reason={}", pageNumber, documentId, e.getMessage());
            outcome = PageOutcome.failure(failureReason(e), Instant.now().toString());
        }

        writePage(documentId, tenantId, pageNumber, outcome);
        if (!outcome.isSuccess()) {
            statusStore.incrementFailed(documentId);
        }
        int processed = statusStore.incrementProcessed(documentId);
        log.debug("Counted page {}: docId={}, processedPages={}", pageNumber, documentId, processed);
    }

    private void writePage(String documentId, String tenantId, int pageNumber, PageOutcome outcome) {
        int attempt = 1;
        while (true) {
            try {
                statusStore.recordPage(documentId, tenantId, pageNumber, outcome);
                return;
            } catch (StoreUnavailableException e) {
                if (attempt >= settings.getPageWriteAttempts()) {
                    log.error("Giving up on page {} after {} write attempts: docId={}",
                            pageNumber, attempt, documentId);
                    throw e;
                }
                Duration delay = settings.getPageWriteBackoff().multipliedBy(1L << (attempt - 1));
                log.warn("Page {} write failed, retrying in {}ms (attempt {}/{}): docId={}, reason={}",
                        pageNumber, delay.toMillis(), attempt + 1, settings.getPageWriteAttempts(),
                        documentId, e.getMessage());
                pauseBeforeRewrite(delay);
                attempt++;
            }
        }
    }

    private void pauseBeforeRewrite(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            // retry the write straight away; the flag stays set for the caller
            Thread.currentThread().interrupt();
        }
    }

    private void pauseBetweenPages() {
        Duration delay = settings.getInterPageDelay();
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            // finish the remaining pages without delay so the document still reaches its total
            Thread.currentThread().interrupt();
        }
    }

    private void markFailed(String documentId, String message, RuntimeException cause) {
        log.error("Processing failed: docId={}", documentId, cause);
        statusStore.updateOverallStatus(documentId, OverallStatus.FAILED, StatusUpdate.error(message));
        statusStore.updateFileStatus(documentId, FileStatus.FAILED, message);
    }

    private String failureReason(RuntimeException e) {
        String kind = e.getClass().getSimpleName().replace("Exception", "");
        return e.getMessage() != null ? kind + ": " + e.getMessage() : kind;
    }

    @Override
    public void close() {
        if (pagePool != null) {
            pagePool.shutdown();
        }
    }
}
