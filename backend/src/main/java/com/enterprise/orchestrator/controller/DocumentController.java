package com.enterprise.orchestrator.controller;

import com.enterprise.orchestrator.core.model.ResultManifest;
import com.enterprise.orchestrator.model.UploadResponse;
import com.enterprise.orchestrator.service.DocumentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
@Tag(name = "Document API", description = "Document upload, progress polling, and result retrieval")
public class DocumentController {

    private final DocumentService documentService;

    // ─────────────────────────────────────────────────────────────────────
    // POST /api/documents/upload
    // ─────────────────────────────────────────────────────────────────────
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload a PDF for page-by-page analysis")
    public ResponseEntity<UploadResponse> uploadDocument(
            @RequestParam("file") MultipartFile file,
            @RequestParam("tenantId") String tenantId) {
        log.info("Upload received: tenantId={}, file={}, size={}",
                tenantId, file.getOriginalFilename(), file.getSize());
        return ResponseEntity.ok(documentService.upload(file, tenantId));
    }

    // ─────────────────────────────────────────────────────────────────────
    // GET /api/documents/status/{documentId}
    // ─────────────────────────────────────────────────────────────────────
    @GetMapping("/status/{documentId}")
    @Operation(summary = "Get processing status and page progress of a document")
    public ResponseEntity<Map<String, Object>> getStatus(@PathVariable String documentId) {
        return ResponseEntity.ok(documentService.getStatus(documentId));
    }

    // ─────────────────────────────────────────────────────────────────────
    // GET /api/documents/result/{documentId}
    // ─────────────────────────────────────────────────────────────────────
    @GetMapping("/result/{documentId}")
    @Operation(summary = "Get the aggregated per-page analysis of a completed document")
    public ResponseEntity<ResultManifest> getResult(@PathVariable String documentId) {
        return ResponseEntity.ok(documentService.getResult(documentId));
    }

    // ─────────────────────────────────────────────────────────────────────
    // GET /api/documents/download/{documentId}
    // ─────────────────────────────────────────────────────────────────────
    @GetMapping("/download/{documentId}")
    @Operation(summary = "Get a pre-signed download URL for the result manifest")
    public ResponseEntity<Map<String, Object>> getDownloadUrl(@PathVariable String documentId) {
        return ResponseEntity.ok(documentService.getDownloadLink(documentId));
    }

    // ─────────────────────────────────────────────────────────────────────
    // GET /api/documents/tenant/{tenantId}
    // ─────────────────────────────────────────────────────────────────────
    @GetMapping("/tenant/{tenantId}")
    @Operation(summary = "List a tenant's documents, most recent first")
    public ResponseEntity<List<Map<String, Object>>> listTenantDocuments(
            @PathVariable String tenantId,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        if (limit < 1 || limit > 500) {
            throw new IllegalArgumentException("limit must be between 1 and 500");
        }
        return ResponseEntity.ok(documentService.listTenantDocuments(tenantId, limit));
    }

    // ─────────────────────────────────────────────────────────────────────
    // POST /api/documents/reprocess/{documentId}
    // ─────────────────────────────────────────────────────────────────────
    @PostMapping("/reprocess/{documentId}")
    @Operation(summary = "Re-run a completed or failed document (overwrites the previous result)")
    public ResponseEntity<Map<String, Object>> reprocess(@PathVariable String documentId) {
        return ResponseEntity.ok(documentService.reprocess(documentId));
    }
}
