package com.enterprise.orchestrator.service;

import com.enterprise.orchestrator.core.blob.BlobKeys;
import com.enterprise.orchestrator.core.blob.BlobStore;
import com.enterprise.orchestrator.core.exception.DocumentNotFoundException;
import com.enterprise.orchestrator.core.exception.OrchestratorException;
import com.enterprise.orchestrator.core.model.DocumentStatusRecord;
import com.enterprise.orchestrator.core.model.DocumentSubmittedEvent;
import com.enterprise.orchestrator.core.model.FileRecord;
import com.enterprise.orchestrator.core.model.FileStatus;
import com.enterprise.orchestrator.core.model.OverallStatus;
import com.enterprise.orchestrator.core.model.ProcessingMode;
import com.enterprise.orchestrator.core.model.ResultManifest;
import com.enterprise.orchestrator.core.store.StatusStore;
import com.enterprise.orchestrator.core.worker.ChunkWorker;
import com.enterprise.orchestrator.model.UploadResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Front door: accepts uploads, dispatches them to the worker (in-process or via the stream) and
 * serves read-only views of progress and results.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentService {

    private static final String PDF_CONTENT_TYPE = "application/pdf";
    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final StatusStore statusStore;
    @Qualifier("uploadBlobStore")
    private final BlobStore uploadBlobStore;
    @Qualifier("resultBlobStore")
    private final BlobStore resultBlobStore;
    private final ChunkWorker chunkWorker;
    private final DocumentEventPublisher eventPublisher;
    private final PresignedUrlService presignedUrlService;
    @Qualifier("documentWorkerExecutor")
    private final TaskExecutor documentWorkerExecutor;
    private final ObjectMapper objectMapper;

    @Value("${orchestrator.upload.async-threshold-mb:10}")
    private double asyncThresholdMb;

    // ─────────────────────────────────────────────────────────────────────
    // Submission
    // ─────────────────────────────────────────────────────────────────────

    public UploadResponse upload(MultipartFile file, String tenantId) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("File is empty");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant ID is required");
        }
        String fileName = Objects.requireNonNullElse(file.getOriginalFilename(), "document.pdf");
        if (!fileName.toLowerCase().endsWith(".pdf")) {
            throw new IllegalArgumentException("Unsupported file type. Only PDF documents are accepted");
        }

        String documentId = UUID.randomUUID().toString();
        String blobKey = BlobKeys.upload(tenantId, documentId, fileName);
        ProcessingMode mode = file.getSize() >= asyncThresholdMb * BYTES_PER_MB
                ? ProcessingMode.ASYNC
                : ProcessingMode.SYNC;

        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new OrchestratorException("Unable to read uploaded file", e);
        }
        uploadBlobStore.put(blobKey, content, PDF_CONTENT_TYPE);

        FileRecord fileRecord = FileRecord.builder()
                .documentId(documentId)
                .tenantId(tenantId)
                .fileName(fileName)
                .fileSize(file.getSize())
                .mimeType(Objects.requireNonNullElse(file.getContentType(), PDF_CONTENT_TYPE))
                .bucket(uploadBlobStore.bucket())
                .blobKey(blobKey)
                .processingMode(mode)
                .status(FileStatus.UPLOADED)
                .build();
        statusStore.saveFile(fileRecord);
        statusStore.createStatus(documentId, tenantId);

        dispatch(fileRecord);

        log.info("Document accepted: docId={}, tenantId={}, file={}, mode={}",
                documentId, tenantId, fileName, mode.value());

        return UploadResponse.builder()
                .documentId(documentId)
                .tenantId(tenantId)
                .fileName(fileName)
                .status(FileStatus.UPLOADED.value())
                .processingMode(mode.value())
                .message("Document uploaded successfully. Use the document ID to track progress.")
                .build();
    }

    /**
     * Return a finished document to pending and run it again. The previous manifest is deleted.
     */
    public Map<String, Object> reprocess(String documentId) {
        FileRecord file = statusStore.getFile(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        DocumentStatusRecord status = statusStore.getDocument(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));

        if (!uploadBlobStore.exists(file.getBlobKey())) {
            throw new IllegalStateException("Original upload no longer exists for document " + documentId);
        }
        if (!statusStore.resetForReprocessing(documentId)) {
            throw new IllegalStateException("Document " + documentId + " is "
                    + status.getOverallStatus().value() + ", only completed or failed documents can be reprocessed");
        }

        if (status.getResultKey() != null) {
            resultBlobStore.delete(status.getResultKey());
            log.info("Deleted previous result for reprocessing: {}", status.getResultKey());
        }
        statusStore.updateFileStatus(documentId, FileStatus.UPLOADED, null);
        dispatch(file);

        log.info("Reprocessing started: docId={}", documentId);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("documentId", documentId);
        response.put("status", OverallStatus.PENDING.value());
        response.put("message", "Reprocessing started. Poll /status/" + documentId + " for updates.");
        return response;
    }

    private void dispatch(FileRecord file) {
        if (file.getProcessingMode() == ProcessingMode.ASYNC) {
            eventPublisher.publishDocumentSubmitted(DocumentSubmittedEvent.builder()
                    .documentId(file.getDocumentId())
                    .tenantId(file.getTenantId())
                    .blobKey(file.getBlobKey())
                    .bucket(file.getBucket())
                    .fileName(file.getFileName())
                    .size(file.getFileSize())
                    .build());
            return;
        }
        documentWorkerExecutor.execute(() ->
                chunkWorker.processDocument(file.getDocumentId(), file.getTenantId(), file.getBlobKey()));
    }

    // ─────────────────────────────────────────────────────────────────────
    // Read views
    // ─────────────────────────────────────────────────────────────────────

    public Map<String, Object> getStatus(String documentId) {
        DocumentStatusRecord status = statusStore.getDocument(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        Optional<FileRecord> file = statusStore.getFile(documentId);

        Map<String, Object> progress = new LinkedHashMap<>();
        progress.put("processed", status.getProcessedPages());
        progress.put("total", status.getTotalPages());
        progress.put("failed", status.getFailedPages());

        Map<String, Object> timestamps = new LinkedHashMap<>();
        timestamps.put("uploaded", file.map(FileRecord::getUploadedAt).orElse(null));
        timestamps.put("started", status.getStartedAt());
        timestamps.put("completed", status.getCompletedAt());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("documentId", documentId);
        response.put("tenantId", status.getTenantId());
        response.put("fileName", file.map(FileRecord::getFileName).orElse(null));
        response.put("status", status.getOverallStatus().value());
        response.put("progress", progress);
        response.put("timestamps", timestamps);
        response.put("resultKey", status.getResultKey());
        if (status.getErrorMessage() != null) {
            response.put("error", status.getErrorMessage());
        }
        if (status.getOverallStatus() == OverallStatus.COMPLETED && status.getResultKey() != null) {
            response.put("downloadUrl",
                    presignedUrlService.downloadLink(resultBlobStore.bucket(), status.getResultKey()));
        }
        return response;
    }

    public ResultManifest getResult(String documentId) {
        DocumentStatusRecord status = completedStatus(documentId);
        byte[] manifest = resultBlobStore.get(status.getResultKey());
        try {
            return objectMapper.readValue(manifest, ResultManifest.class);
        } catch (IOException e) {
            throw new OrchestratorException("Stored manifest is unreadable for document " + documentId, e);
        }
    }

    public Map<String, Object> getDownloadLink(String documentId) {
        DocumentStatusRecord status = completedStatus(documentId);
        String url = presignedUrlService.downloadLink(resultBlobStore.bucket(), status.getResultKey());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("documentId", documentId);
        response.put("downloadUrl", url);
        response.put("expiresAt", Instant.now().plus(PresignedUrlService.DOWNLOAD_LINK_TTL).toString());
        return response;
    }

    public List<Map<String, Object>> listTenantDocuments(String tenantId, int limit) {
        return statusStore.listDocumentsByTenant(tenantId, limit).stream()
                .map(status -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("documentId", status.getDocumentId());
                    row.put("fileName", statusStore.getFile(status.getDocumentId())
                            .map(FileRecord::getFileName).orElse(null));
                    row.put("status", status.getOverallStatus().value());
                    row.put("processedPages", status.getProcessedPages());
                    row.put("totalPages", status.getTotalPages());
                    row.put("createdAt", status.getCreatedAt());
                    return row;
                })
                .collect(Collectors.toList());
    }

    private DocumentStatusRecord completedStatus(String documentId) {
        DocumentStatusRecord status = statusStore.getDocument(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        if (status.getOverallStatus() != OverallStatus.COMPLETED || status.getResultKey() == null) {
            throw new ResultNotAvailableException(documentId, status.getOverallStatus().value());
        }
        return status;
    }
}
