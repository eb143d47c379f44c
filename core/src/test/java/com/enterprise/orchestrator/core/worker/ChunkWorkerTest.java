package com.enterprise.orchestrator.core.worker;

import com.enterprise.orchestrator.core.analysis.AnalysisClient;
import com.enterprise.orchestrator.core.analysis.RetryPolicy;
import com.enterprise.orchestrator.core.analysis.RetryingAnalyzer;
import com.enterprise.orchestrator.core.analysis.Sleeper;
import com.enterprise.orchestrator.core.blob.InMemoryBlobStore;
import com.enterprise.orchestrator.core.exception.AnalysisException;
import com.enterprise.orchestrator.core.exception.DocumentIngestException;
import com.enterprise.orchestrator.core.exception.RateLimitedException;
import com.enterprise.orchestrator.core.exception.StoreUnavailableException;
import com.enterprise.orchestrator.core.extract.PageExtractor;
import com.enterprise.orchestrator.core.model.AnalysisPayload;
import com.enterprise.orchestrator.core.model.DocumentStatusRecord;
import com.enterprise.orchestrator.core.model.FileRecord;
import com.enterprise.orchestrator.core.model.FileStatus;
import com.enterprise.orchestrator.core.model.OverallStatus;
import com.enterprise.orchestrator.core.model.PageOutcome;
import com.enterprise.orchestrator.core.model.PageRecord;
import com.enterprise.orchestrator.core.store.InMemoryStatusStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChunkWorkerTest {

    private static final String DOC = "doc-1";
    private static final String TENANT = "tenant-a";
    private static final String BLOB_KEY = "tenant-a/doc-1/report.pdf";

    @Mock
    private AnalysisClient analysisClient;

    @Mock
    private PageExtractor pageExtractor;

    private InMemoryStatusStore statusStore;
    private InMemoryBlobStore uploads;
    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper sleeper = sleeps::add;
    private ChunkWorker worker;

    @BeforeEach
    void setUp() {
        statusStore = new InMemoryStatusStore();
        uploads = new InMemoryBlobStore("document-orchestrator-pdfs");
        statusStore.createStatus(DOC, TENANT);
        statusStore.saveFile(FileRecord.builder().documentId(DOC).tenantId(TENANT).fileName("report.pdf").build());
        worker = newWorker(WorkerSettings.sequential());
    }

    @AfterEach
    void tearDown() {
        worker.close();
    }

    @Test
    void testProcessDocument_AllPagesSucceed() {
        // Given
        uploads.put(BLOB_KEY, new byte[]{1}, "application/pdf");
        when(pageExtractor.extractPages(any())).thenReturn(List.of("p1", "p2"));
        when(analysisClient.analyze(anyString())).thenAnswer(inv ->
                AnalysisPayload.builder().summary("summary of " + inv.getArgument(0)).build());

        // When
        ProcessingOutcome outcome = worker.processDocument(DOC, TENANT, BLOB_KEY);

        // Then
        assertEquals(ProcessingOutcome.PAGES_DISPATCHED, outcome);
        DocumentStatusRecord status = statusStore.getDocument(DOC).orElseThrow();
        assertEquals(OverallStatus.PROCESSING, status.getOverallStatus());
        assertEquals(2, status.getTotalPages());
        assertEquals(2, status.getProcessedPages());
        assertEquals(0, status.getFailedPages());
        assertTrue(status.isReadyForAggregation());
        assertEquals(FileStatus.PROCESSING, statusStore.getFile(DOC).orElseThrow().getStatus());
    }

    @Test
    void testProcessDocument_PageTwoExhaustsRetries_RecordsFailureMarkerAndStillCounts() {
        // Given
        uploads.put(BLOB_KEY, new byte[]{1}, "application/pdf");
        when(pageExtractor.extractPages(any())).thenReturn(List.of("p1", "p2", "p3"));
        when(analysisClient.analyze(anyString())).thenAnswer(inv -> {
            if ("p2".equals(inv.getArgument(0))) {
                throw new RateLimitedException("429 Too Many Requests");
            }
            return AnalysisPayload.builder().summary("ok").build();
        });

        // When
        worker.processDocument(DOC, TENANT, BLOB_KEY);

        // Then
        verify(analysisClient, times(3)).analyze("p2");
        DocumentStatusRecord status = statusStore.getDocument(DOC).orElseThrow();
        assertEquals(3, status.getProcessedPages());
        assertEquals(1, status.getFailedPages());

        List<PageRecord> pages = statusStore.getPages(DOC);
        assertEquals(3, pages.size());
        PageOutcome failure = pages.get(1).getOutcome();
        assertFalse(failure.isSuccess());
        assertTrue(failure.getReason().contains("RateLimited"));
        assertNotNull(failure.getFailedAt());
        assertTrue(pages.get(0).getOutcome().isSuccess());
        assertTrue(pages.get(2).getOutcome().isSuccess());
    }

    @Test
    void testProcessDocument_NonRetryableError_RecordedWithoutRetry() {
        // Given
        uploads.put(BLOB_KEY, new byte[]{1}, "application/pdf");
        when(pageExtractor.extractPages(any())).thenReturn(List.of("p1"));
        when(analysisClient.analyze("p1")).thenThrow(new AnalysisException("response was not JSON"));

        // When
        worker.processDocument(DOC, TENANT, BLOB_KEY);

        // Then
        verify(analysisClient, times(1)).analyze("p1");
        DocumentStatusRecord status = statusStore.getDocument(DOC).orElseThrow();
        assertEquals(1, status.getProcessedPages());
        assertEquals(1, status.getFailedPages());
        assertFalse(statusStore.getPages(DOC).get(0).getOutcome().isSuccess());
    }

    @Test
    void testProcessDocument_DownloadFails_MarksFailedWithoutTouchingCounter() {
        // Given - nothing uploaded under BLOB_KEY

        // When
        ProcessingOutcome outcome = worker.processDocument(DOC, TENANT, BLOB_KEY);

        // Then
        assertEquals(ProcessingOutcome.FAILED, outcome);
        DocumentStatusRecord status = statusStore.getDocument(DOC).orElseThrow();
        assertEquals(OverallStatus.FAILED, status.getOverallStatus());
        assertEquals(0, status.getTotalPages());
        assertEquals(0, status.getProcessedPages());
        assertNotNull(status.getErrorMessage());
        assertTrue(statusStore.getPages(DOC).isEmpty());
        assertEquals(FileStatus.FAILED, statusStore.getFile(DOC).orElseThrow().getStatus());
        verifyNoInteractions(pageExtractor, analysisClient);
    }

    @Test
    void testProcessDocument_ExtractionFails_MarksFailed() {
        // Given
        uploads.put(BLOB_KEY, new byte[]{1}, "application/pdf");
        when(pageExtractor.extractPages(any())).thenThrow(new DocumentIngestException("corrupt xref table"));

        // When
        ProcessingOutcome outcome = worker.processDocument(DOC, TENANT, BLOB_KEY);

        // Then
        assertEquals(ProcessingOutcome.FAILED, outcome);
        assertEquals(OverallStatus.FAILED, statusStore.getDocument(DOC).orElseThrow().getOverallStatus());
        assertEquals(0, statusStore.getDocument(DOC).orElseThrow().getProcessedPages());
    }

    @Test
    void testProcessDocument_ZeroPages_MarksFailed() {
        // Given
        uploads.put(BLOB_KEY, new byte[]{1}, "application/pdf");
        when(pageExtractor.extractPages(any())).thenReturn(List.of());

        // When
        ProcessingOutcome outcome = worker.processDocument(DOC, TENANT, BLOB_KEY);

        // Then
        assertEquals(ProcessingOutcome.FAILED, outcome);
        assertEquals(0, statusStore.getDocument(DOC).orElseThrow().getTotalPages());
    }

    @Test
    void testProcessDocument_RedeliveredEvent_IsSkipped() {
        // Given
        uploads.put(BLOB_KEY, new byte[]{1}, "application/pdf");
        when(pageExtractor.extractPages(any())).thenReturn(List.of("p1", "p2"));
        when(analysisClient.analyze(anyString())).thenReturn(AnalysisPayload.builder().summary("ok").build());
        worker.processDocument(DOC, TENANT, BLOB_KEY);

        // When
        ProcessingOutcome second = worker.processDocument(DOC, TENANT, BLOB_KEY);

        // Then
        assertEquals(ProcessingOutcome.SKIPPED, second);
        assertEquals(2, statusStore.getDocument(DOC).orElseThrow().getProcessedPages());
        verify(pageExtractor, times(1)).extractPages(any());
    }

    @Test
    void testProcessDocument_InterPageDelayBetweenPagesOnly() {
        // Given
        worker.close();
        worker = newWorker(WorkerSettings.builder().interPageDelay(Duration.ofSeconds(1)).build());
        uploads.put(BLOB_KEY, new byte[]{1}, "application/pdf");
        when(pageExtractor.extractPages(any())).thenReturn(List.of("p1", "p2", "p3"));
        when(analysisClient.analyze(anyString())).thenReturn(AnalysisPayload.builder().summary("ok").build());

        // When
        worker.processDocument(DOC, TENANT, BLOB_KEY);

        // Then
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(1)), sleeps);
    }

    @Test
    void testProcessDocument_ParallelPages_CountEveryPageExactlyOnce() {
        // Given
        worker.close();
        worker = newWorker(WorkerSettings.builder().parallelism(8).build());
        List<String> texts = IntStream.rangeClosed(1, 40).mapToObj(i -> "page-" + i).collect(Collectors.toList());
        uploads.put(BLOB_KEY, new byte[]{1}, "application/pdf");
        when(pageExtractor.extractPages(any())).thenReturn(texts);
        when(analysisClient.analyze(anyString())).thenAnswer(inv -> {
            String text = inv.getArgument(0);
            if (text.endsWith("7")) {
                throw new AnalysisException("model refused");
            }
            return AnalysisPayload.builder().summary(text).build();
        });

        // When
        ProcessingOutcome outcome = worker.processDocument(DOC, TENANT, BLOB_KEY);

        // Then
        assertEquals(ProcessingOutcome.PAGES_DISPATCHED, outcome);
        DocumentStatusRecord status = statusStore.getDocument(DOC).orElseThrow();
        assertEquals(40, status.getProcessedPages());
        assertEquals(4, status.getFailedPages());
        assertEquals(40, statusStore.getPages(DOC).size());
    }

    @Test
    void testProcessDocument_PageWriteKeepsFailing_FailsDocumentWithoutCountingThePage() {
        // Given - every write of page 2 is rejected
        statusStore = new RejectingPageStore(2, Integer.MAX_VALUE);
        statusStore.createStatus(DOC, TENANT);
        statusStore.saveFile(FileRecord.builder().documentId(DOC).tenantId(TENANT).fileName("report.pdf").build());
        worker.close();
        worker = newWorker(WorkerSettings.sequential());
        uploads.put(BLOB_KEY, new byte[]{1}, "application/pdf");
        when(pageExtractor.extractPages(any())).thenReturn(List.of("p1", "p2", "p3"));
        when(analysisClient.analyze(anyString())).thenReturn(AnalysisPayload.builder().summary("ok").build());

        // When
        ProcessingOutcome outcome = worker.processDocument(DOC, TENANT, BLOB_KEY);

        // Then
        assertEquals(ProcessingOutcome.FAILED, outcome);
        DocumentStatusRecord status = statusStore.getDocument(DOC).orElseThrow();
        assertEquals(OverallStatus.FAILED, status.getOverallStatus());
        assertTrue(status.getErrorMessage().contains("Status store unavailable"));
        assertEquals(3, status.getTotalPages());
        assertEquals(1, status.getProcessedPages());
        assertFalse(status.isReadyForAggregation());
        assertEquals(1, statusStore.getPages(DOC).size());
        assertEquals(FileStatus.FAILED, statusStore.getFile(DOC).orElseThrow().getStatus());
        assertEquals(List.of(Duration.ofMillis(200), Duration.ofMillis(400)), sleeps);
        verify(analysisClient, never()).analyze("p3");
    }

    @Test
    void testProcessDocument_PageWriteFailsOnce_RetriedAndCounted() {
        // Given - the first write of page 1 is rejected
        statusStore = new RejectingPageStore(1, 1);
        statusStore.createStatus(DOC, TENANT);
        worker.close();
        worker = newWorker(WorkerSettings.sequential());
        uploads.put(BLOB_KEY, new byte[]{1}, "application/pdf");
        when(pageExtractor.extractPages(any())).thenReturn(List.of("p1", "p2"));
        when(analysisClient.analyze(anyString())).thenReturn(AnalysisPayload.builder().summary("ok").build());

        // When
        ProcessingOutcome outcome = worker.processDocument(DOC, TENANT, BLOB_KEY);

        // Then
        assertEquals(ProcessingOutcome.PAGES_DISPATCHED, outcome);
        DocumentStatusRecord status = statusStore.getDocument(DOC).orElseThrow();
        assertEquals(2, status.getProcessedPages());
        assertEquals(2, statusStore.getPages(DOC).size());
        assertTrue(status.isReadyForAggregation());
        assertEquals(List.of(Duration.ofMillis(200)), sleeps);
        verify(analysisClient, times(1)).analyze("p1");
    }

    private ChunkWorker newWorker(WorkerSettings settings) {
        RetryingAnalyzer analyzer = new RetryingAnalyzer(analysisClient, RetryPolicy.builder()
                .maxAttempts(3)
                .baseDelay(Duration.ofMillis(10))
                .build(), sleeper);
        return new ChunkWorker(statusStore, uploads, pageExtractor, analyzer, settings, sleeper);
    }

    private static final class RejectingPageStore extends InMemoryStatusStore {
        private final int rejectedPage;
        private final AtomicInteger rejectionsLeft;

        private RejectingPageStore(int rejectedPage, int rejections) {
            this.rejectedPage = rejectedPage;
            this.rejectionsLeft = new AtomicInteger(rejections);
        }

        @Override
        public void recordPage(String documentId, String tenantId, int pageNumber, PageOutcome outcome) {
            if (pageNumber == rejectedPage && rejectionsLeft.getAndDecrement() > 0) {
                throw new StoreUnavailableException("Status store unavailable during recordPage",
                        new RuntimeException("ProvisionedThroughputExceededException"));
            }
            super.recordPage(documentId, tenantId, pageNumber, outcome);
        }
    }
}
