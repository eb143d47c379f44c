package com.enterprise.orchestrator.core.aggregate;

import com.enterprise.orchestrator.core.blob.BlobKeys;
import com.enterprise.orchestrator.core.blob.BlobStore;
import com.enterprise.orchestrator.core.exception.OrchestratorException;
import com.enterprise.orchestrator.core.model.FileStatus;
import com.enterprise.orchestrator.core.model.OverallStatus;
import com.enterprise.orchestrator.core.model.PageOutcome;
import com.enterprise.orchestrator.core.model.PageRecord;
import com.enterprise.orchestrator.core.model.ResultManifest;
import com.enterprise.orchestrator.core.store.StatusStore;
import com.enterprise.orchestrator.core.store.StatusUpdate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Builds and publishes the result manifest for a document whose page counter reached its total.
 * <p>
 * The processing → aggregating transition is a compare-and-set, so of several concurrent triggers
 * for the same document only one proceeds. The counter is not trusted on its own: if fewer page
 * records are visible than expected, the document goes back to processing and a later trigger
 * retries.
 */
@Slf4j
public class Aggregator {

    private static final String MANIFEST_CONTENT_TYPE = "application/json";

    private final StatusStore statusStore;
    private final BlobStore resultBlobs;
    private final ObjectMapper objectMapper;

    public Aggregator(StatusStore statusStore, BlobStore resultBlobs, ObjectMapper objectMapper) {
        this.statusStore = statusStore;
        this.resultBlobs = resultBlobs;
        this.objectMapper = objectMapper;
    }

    public AggregationOutcome aggregateResults(String documentId, String tenantId, int totalPages) {
        log.info("Aggregating results: docId={}, totalPages={}", documentId, totalPages);

        if (!statusStore.compareAndSetStatus(documentId, OverallStatus.PROCESSING, OverallStatus.AGGREGATING,
                StatusUpdate.none())) {
            log.info("Aggregation skipped, document is no longer processing: docId={}", documentId);
            return AggregationOutcome.SKIPPED;
        }

        ResultManifest manifest;
        String resultKey;
        try {
            Map<Integer, PageRecord> pages = visiblePages(documentId, totalPages);

            if (pages.size() < totalPages) {
                log.warn("Aggregation deferred: docId={}, only {}/{} pages visible",
                        documentId, pages.size(), totalPages);
                statusStore.compareAndSetStatus(documentId, OverallStatus.AGGREGATING, OverallStatus.PROCESSING,
                        StatusUpdate.none());
                return AggregationOutcome.DEFERRED;
            }

            String completedAt = Instant.now().toString();
            manifest = buildManifest(documentId, tenantId, totalPages, pages, completedAt);
            resultKey = BlobKeys.manifest(tenantId, documentId);
            resultBlobs.put(resultKey, toJson(manifest), MANIFEST_CONTENT_TYPE);

            statusStore.updateOverallStatus(documentId, OverallStatus.COMPLETED, StatusUpdate.builder()
                    .resultKey(resultKey)
                    .completedAt(completedAt)
                    .build());
        } catch (RuntimeException e) {
            log.error("Aggregation failed: docId={}", documentId, e);
            String message = "Aggregation failed: " + e.getMessage();
            statusStore.updateOverallStatus(documentId, OverallStatus.FAILED, StatusUpdate.error(message));
            statusStore.updateFileStatus(documentId, FileStatus.FAILED, message);
            throw e;
        }

        // completed is terminal; a stale file record is only logged
        try {
            statusStore.updateFileStatus(documentId, FileStatus.COMPLETED, null);
        } catch (RuntimeException e) {
            log.error("Document completed but file record update failed: docId={}", documentId, e);
        }

        log.info("Aggregated results: docId={}, success={}, failed={}, manifest=s3://{}/{}",
                documentId, manifest.getSuccessCount(), manifest.getFailedCount(),
                resultBlobs.bucket(), resultKey);
        return AggregationOutcome.COMPLETED;
    }

    private Map<Integer, PageRecord> visiblePages(String documentId, int totalPages) {
        Map<Integer, PageRecord> byNumber = new TreeMap<>();
        for (PageRecord page : statusStore.getPages(documentId)) {
            if (page.getPageNumber() >= 1 && page.getPageNumber() <= totalPages) {
                byNumber.put(page.getPageNumber(), page);
            } else {
                log.warn("Ignoring out-of-range page {}: docId={}, totalPages={}",
                        page.getPageNumber(), documentId, totalPages);
            }
        }
        return byNumber;
    }

    static ResultManifest buildManifest(String documentId, String tenantId, int totalPages,
                                        Map<Integer, PageRecord> pages, String processedAt) {
        List<ResultManifest.Chunk> chunks = pages.values().stream()
                .sorted(Comparator.comparingInt(PageRecord::getPageNumber))
                .map(Aggregator::toChunk)
                .collect(Collectors.toList());
        int successCount = (int) chunks.stream().filter(c -> "success".equals(c.getStatus())).count();

        return ResultManifest.builder()
                .documentId(documentId)
                .tenantId(tenantId)
                .processedAt(processedAt)
                .totalPages(totalPages)
                .successCount(successCount)
                .failedCount(chunks.size() - successCount)
                .chunks(chunks)
                .build();
    }

    private static ResultManifest.Chunk toChunk(PageRecord page) {
        ResultManifest.Chunk.ChunkBuilder chunk = ResultManifest.Chunk.builder()
                .pageNumber(page.getPageNumber());
        PageOutcome outcome = page.getOutcome();
        if (outcome.isSuccess()) {
            return chunk.status("success").analysis(outcome.getPayload()).build();
        }
        return chunk.status("failed").error(outcome.getReason()).failedAt(outcome.getFailedAt()).build();
    }

    private byte[] toJson(ResultManifest manifest) {
        try {
            return objectMapper.writeValueAsBytes(manifest);
        } catch (JsonProcessingException e) {
            throw new OrchestratorException("Unable to serialise manifest", e);
        }
    }
}
