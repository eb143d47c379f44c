package com.enterprise.orchestrator.core.store;

import com.enterprise.orchestrator.core.model.DocumentStatusRecord;
import com.enterprise.orchestrator.core.model.FileRecord;
import com.enterprise.orchestrator.core.model.FileStatus;
import com.enterprise.orchestrator.core.model.OverallStatus;
import com.enterprise.orchestrator.core.model.PageOutcome;
import com.enterprise.orchestrator.core.model.PageRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable owner of file, document-status and page records.
 * <p>
 * Every operation is atomic at the single-record level. Infrastructure failures surface as
 * {@link com.enterprise.orchestrator.core.exception.StoreUnavailableException}.
 */
public interface StatusStore {

    // ─── file metadata ──────────────────────────────────────────────────────

    void saveFile(FileRecord record);

    Optional<FileRecord> getFile(String documentId);

    /**
     * @return false when no file record exists for the document
     */
    boolean updateFileStatus(String documentId, FileStatus status, String errorMessage);

    // ─── document status ────────────────────────────────────────────────────

    /**
     * Insert a status record with status {@code pending} and all counters at zero.
     *
     * @throws com.enterprise.orchestrator.core.exception.AlreadyExistsException if one already exists
     */
    DocumentStatusRecord createStatus(String documentId, String tenantId);

    Optional<DocumentStatusRecord> getDocument(String documentId);

    /**
     * Set (never add) the total page count. Safe to repeat.
     */
    void setTotalPages(String documentId, int totalPages);

    /**
     * Single atomic add of one to the processed-page counter.
     *
     * @return the counter value after the increment
     */
    int incrementProcessed(String documentId);

    /**
     * Single atomic add of one to the failed-page counter.
     */
    int incrementFailed(String documentId);

    /**
     * Unconditional status write.
     */
    void updateOverallStatus(String documentId, OverallStatus status, StatusUpdate update);

    /**
     * Write {@code next} only if the stored status is currently {@code expected}.
     *
     * @return true if this caller performed the transition
     */
    boolean compareAndSetStatus(String documentId, OverallStatus expected, OverallStatus next,
                                StatusUpdate update);

    /**
     * Most recently created documents of a tenant first.
     */
    List<DocumentStatusRecord> listDocumentsByTenant(String tenantId, int limit);

    /**
     * Status records with {@code processed == total}, {@code total > 0} and status {@code processing}.
     */
    List<DocumentStatusRecord> scanReadyForAggregation();

    /**
     * Return a document in a terminal state to {@code pending}: counters zeroed, result and error
     * cleared, page records removed.
     *
     * @return false if the document is missing or not in a terminal state
     */
    boolean resetForReprocessing(String documentId);

    // ─── pages ──────────────────────────────────────────────────────────────

    /**
     * Upsert the record for one page; a later write for the same page number replaces it.
     */
    void recordPage(String documentId, String tenantId, int pageNumber, PageOutcome outcome);

    /**
     * All visible page records for the document, ordered by page number.
     */
    List<PageRecord> getPages(String documentId);
}
