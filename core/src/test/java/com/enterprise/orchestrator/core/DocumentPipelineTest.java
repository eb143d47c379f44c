package com.enterprise.orchestrator.core;

import com.enterprise.orchestrator.core.aggregate.Aggregator;
import com.enterprise.orchestrator.core.analysis.AnalysisClient;
import com.enterprise.orchestrator.core.analysis.RetryPolicy;
import com.enterprise.orchestrator.core.analysis.RetryingAnalyzer;
import com.enterprise.orchestrator.core.analysis.Sleeper;
import com.enterprise.orchestrator.core.blob.BlobKeys;
import com.enterprise.orchestrator.core.blob.InMemoryBlobStore;
import com.enterprise.orchestrator.core.exception.RateLimitedException;
import com.enterprise.orchestrator.core.extract.PageExtractor;
import com.enterprise.orchestrator.core.model.AnalysisPayload;
import com.enterprise.orchestrator.core.model.DocumentStatusRecord;
import com.enterprise.orchestrator.core.model.OverallStatus;
import com.enterprise.orchestrator.core.model.ResultManifest;
import com.enterprise.orchestrator.core.store.InMemoryStatusStore;
import com.enterprise.orchestrator.core.watch.CompletionWatcher;
import com.enterprise.orchestrator.core.watch.StatusChange;
import com.enterprise.orchestrator.core.worker.ChunkWorker;
import com.enterprise.orchestrator.core.worker.WorkerSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Worker, watcher and aggregator wired together over the in-memory stores.
 */
class DocumentPipelineTest {

    private static final String TENANT = "tenant-a";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Sleeper noSleep = delay -> { };

    private InMemoryStatusStore statusStore;
    private InMemoryBlobStore uploads;
    private InMemoryBlobStore results;
    private CompletionWatcher watcher;
    private ChunkWorker worker;

    // pages are separated by form feeds in the fake source blob
    private final PageExtractor formFeedExtractor = data ->
            Arrays.asList(new String(data, StandardCharsets.UTF_8).split("\f"));

    private final AnalysisClient pageTwoRateLimited = text -> {
        if (text.contains("two")) {
            throw new RateLimitedException("429 Too Many Requests");
        }
        return AnalysisPayload.builder()
                .summary("summary: " + text)
                .entities(List.of())
                .keyPoints(List.of(text))
                .sentiment("neutral")
                .build();
    };

    @BeforeEach
    void setUp() {
        statusStore = new InMemoryStatusStore();
        uploads = new InMemoryBlobStore("document-orchestrator-pdfs");
        results = new InMemoryBlobStore("document-orchestrator-results");
        Aggregator aggregator = new Aggregator(statusStore, results, objectMapper);
        watcher = new CompletionWatcher(statusStore, aggregator, Duration.ofSeconds(5));
        RetryingAnalyzer analyzer = new RetryingAnalyzer(pageTwoRateLimited, RetryPolicy.defaults(), noSleep);
        worker = new ChunkWorker(statusStore, uploads, formFeedExtractor, analyzer, WorkerSettings.sequential(), noSleep);
    }

    @AfterEach
    void tearDown() {
        worker.close();
        watcher.close();
    }

    @Test
    void testThreePageDocument_PageTwoRateLimited_CompletesWithOneFailure() throws Exception {
        // Given
        String blobKey = submit("doc-1", "page one\fpage two\fpage three");

        // When
        worker.processDocument("doc-1", TENANT, blobKey);
        int completed = watcher.pollOnce();

        // Then
        assertEquals(1, completed);
        DocumentStatusRecord status = statusStore.getDocument("doc-1").orElseThrow();
        assertEquals(OverallStatus.COMPLETED, status.getOverallStatus());
        assertEquals(3, status.getTotalPages());
        assertEquals(3, status.getProcessedPages());
        assertEquals(1, status.getFailedPages());

        ResultManifest manifest = objectMapper.readValue(results.get(status.getResultKey()), ResultManifest.class);
        assertEquals(2, manifest.getSuccessCount());
        assertEquals(1, manifest.getFailedCount());
        assertEquals(List.of("success", "failed", "success"),
                manifest.getChunks().stream().map(ResultManifest.Chunk::getStatus).collect(Collectors.toList()));
        assertEquals(manifest.getTotalPages(), manifest.getSuccessCount() + manifest.getFailedCount());
    }

    @Test
    void testChangeFeedAndPollerBothFire_ManifestWrittenOnce() {
        // Given
        String blobKey = submit("doc-1", "alpha\fbeta");
        worker.processDocument("doc-1", TENANT, blobKey);
        DocumentStatusRecord ready = statusStore.getDocument("doc-1").orElseThrow();

        // When
        watcher.onChange(StatusChange.builder().eventName("MODIFY").sortKey("STATUS").after(ready).build());
        int polled = watcher.pollOnce();

        // Then
        assertEquals(0, polled);
        assertEquals(1, results.putCount());
        assertTrue(results.exists(BlobKeys.manifest(TENANT, "doc-1")));
    }

    @Test
    void testManyDocumentsConcurrently_EveryDocumentCompletes() throws Exception {
        // Given
        int documents = 12;
        for (int d = 0; d < documents; d++) {
            submit("doc-" + d, "alpha\fbeta\fgamma\fdelta");
        }
        ExecutorService pool = Executors.newFixedThreadPool(4);

        // When
        for (int d = 0; d < documents; d++) {
            String documentId = "doc-" + d;
            pool.submit(() -> worker.processDocument(documentId, TENANT,
                    BlobKeys.upload(TENANT, documentId, "source.pdf")));
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        int completed = watcher.pollOnce();

        // Then
        assertEquals(documents, completed);
        for (int d = 0; d < documents; d++) {
            DocumentStatusRecord status = statusStore.getDocument("doc-" + d).orElseThrow();
            assertEquals(OverallStatus.COMPLETED, status.getOverallStatus());
            assertEquals(status.getTotalPages(), status.getProcessedPages());
        }
    }

    @Test
    void testReprocessAfterCompletion_RunsAgainFromPending() {
        // Given
        String blobKey = submit("doc-1", "alpha\fbeta");
        worker.processDocument("doc-1", TENANT, blobKey);
        watcher.pollOnce();

        // When
        boolean reset = statusStore.resetForReprocessing("doc-1");
        worker.processDocument("doc-1", TENANT, blobKey);
        int completed = watcher.pollOnce();

        // Then
        assertTrue(reset);
        assertEquals(1, completed);
        DocumentStatusRecord status = statusStore.getDocument("doc-1").orElseThrow();
        assertEquals(OverallStatus.COMPLETED, status.getOverallStatus());
        assertEquals(2, status.getProcessedPages());
    }

    private String submit(String documentId, String body) {
        String blobKey = BlobKeys.upload(TENANT, documentId, "source.pdf");
        uploads.put(blobKey, body.getBytes(StandardCharsets.UTF_8), "application/pdf");
        statusStore.createStatus(documentId, TENANT);
        return blobKey;
    }
}
