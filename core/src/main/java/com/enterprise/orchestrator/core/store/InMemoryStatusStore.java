package com.enterprise.orchestrator.core.store;

import com.enterprise.orchestrator.core.exception.AlreadyExistsException;
import com.enterprise.orchestrator.core.exception.DocumentNotFoundException;
import com.enterprise.orchestrator.core.model.DocumentStatusRecord;
import com.enterprise.orchestrator.core.model.FileRecord;
import com.enterprise.orchestrator.core.model.FileStatus;
import com.enterprise.orchestrator.core.model.OverallStatus;
import com.enterprise.orchestrator.core.model.PageOutcome;
import com.enterprise.orchestrator.core.model.PageRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Process-local {@link StatusStore} for single-node runs and tests.
 * <p>
 * Counters are {@link AtomicInteger}s and status transitions are {@link AtomicReference#compareAndSet},
 * so concurrent workers observe the same guarantees as the DynamoDB-backed store.
 */
@Slf4j
public class InMemoryStatusStore implements StatusStore {

    private final ConcurrentHashMap<String, FileRecord> files = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, StatusEntry> statuses = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ConcurrentSkipListMap<Integer, PageRecord>> pages =
            new ConcurrentHashMap<>();

    @Override
    public void saveFile(FileRecord record) {
        String now = Instant.now().toString();
        FileRecord copy = record.toBuilder()
                .uploadedAt(record.getUploadedAt() != null ? record.getUploadedAt() : now)
                .status(record.getStatus() != null ? record.getStatus() : FileStatus.UPLOADED)
                .updatedAt(now)
                .build();
        files.put(record.getDocumentId(), copy);
    }

    @Override
    public Optional<FileRecord> getFile(String documentId) {
        return Optional.ofNullable(files.get(documentId)).map(r -> r.toBuilder().build());
    }

    @Override
    public boolean updateFileStatus(String documentId, FileStatus status, String errorMessage) {
        FileRecord updated = files.computeIfPresent(documentId, (id, current) -> current.toBuilder()
                .status(status)
                .errorMessage(errorMessage != null ? errorMessage : current.getErrorMessage())
                .updatedAt(Instant.now().toString())
                .build());
        return updated != null;
    }

    @Override
    public DocumentStatusRecord createStatus(String documentId, String tenantId) {
        StatusEntry entry = new StatusEntry(documentId, tenantId);
        if (statuses.putIfAbsent(documentId, entry) != null) {
            throw new AlreadyExistsException(documentId);
        }
        log.info("Created status record: docId={}, tenantId={}", documentId, tenantId);
        return entry.snapshot();
    }

    @Override
    public Optional<DocumentStatusRecord> getDocument(String documentId) {
        return Optional.ofNullable(statuses.get(documentId)).map(StatusEntry::snapshot);
    }

    @Override
    public void setTotalPages(String documentId, int totalPages) {
        StatusEntry entry = require(documentId);
        entry.totalPages.set(totalPages);
        entry.touch();
    }

    @Override
    public int incrementProcessed(String documentId) {
        StatusEntry entry = require(documentId);
        int value = entry.processedPages.incrementAndGet();
        entry.touch();
        return value;
    }

    @Override
    public int incrementFailed(String documentId) {
        StatusEntry entry = require(documentId);
        int value = entry.failedPages.incrementAndGet();
        entry.touch();
        return value;
    }

    @Override
    public void updateOverallStatus(String documentId, OverallStatus status, StatusUpdate update) {
        StatusEntry entry = require(documentId);
        synchronized (entry) {
            entry.status.set(status);
            entry.apply(update);
        }
    }

    @Override
    public boolean compareAndSetStatus(String documentId, OverallStatus expected, OverallStatus next,
                                       StatusUpdate update) {
        StatusEntry entry = statuses.get(documentId);
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            if (!entry.status.compareAndSet(expected, next)) {
                return false;
            }
            entry.apply(update);
        }
        return true;
    }

    @Override
    public List<DocumentStatusRecord> listDocumentsByTenant(String tenantId, int limit) {
        return statuses.values().stream()
                .filter(e -> e.tenantId.equals(tenantId))
                .map(StatusEntry::snapshot)
                .sorted(Comparator.comparing(DocumentStatusRecord::getCreatedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public List<DocumentStatusRecord> scanReadyForAggregation() {
        return statuses.values().stream()
                .map(StatusEntry::snapshot)
                .filter(DocumentStatusRecord::isReadyForAggregation)
                .collect(Collectors.toList());
    }

    @Override
    public boolean resetForReprocessing(String documentId) {
        StatusEntry entry = statuses.get(documentId);
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            OverallStatus current = entry.status.get();
            if (!current.isTerminal() || !entry.status.compareAndSet(current, OverallStatus.PENDING)) {
                return false;
            }
            entry.totalPages.set(0);
            entry.processedPages.set(0);
            entry.failedPages.set(0);
            entry.resultKey = null;
            entry.errorMessage = null;
            entry.completedAt = null;
            entry.touch();
        }
        pages.remove(documentId);
        return true;
    }

    @Override
    public void recordPage(String documentId, String tenantId, int pageNumber, PageOutcome outcome) {
        PageRecord record = PageRecord.builder()
                .documentId(documentId)
                .tenantId(tenantId)
                .pageNumber(pageNumber)
                .outcome(outcome)
                .updatedAt(Instant.now().toString())
                .build();
        pages.computeIfAbsent(documentId, id -> new ConcurrentSkipListMap<>()).put(pageNumber, record);
    }

    @Override
    public List<PageRecord> getPages(String documentId) {
        Map<Integer, PageRecord> byNumber = pages.get(documentId);
        return byNumber == null ? List.of() : new ArrayList<>(byNumber.values());
    }

    private StatusEntry require(String documentId) {
        StatusEntry entry = statuses.get(documentId);
        if (entry == null) {
            throw new DocumentNotFoundException(documentId);
        }
        return entry;
    }

    private static final class StatusEntry {
        private final String documentId;
        private final String tenantId;
        private final String createdAt;
        private final AtomicInteger totalPages = new AtomicInteger();
        private final AtomicInteger processedPages = new AtomicInteger();
        private final AtomicInteger failedPages = new AtomicInteger();
        private final AtomicReference<OverallStatus> status = new AtomicReference<>(OverallStatus.PENDING);
        private volatile String resultKey;
        private volatile String errorMessage;
        private volatile String completedAt;
        private volatile String updatedAt;

        private StatusEntry(String documentId, String tenantId) {
            this.documentId = documentId;
            this.tenantId = tenantId;
            this.createdAt = Instant.now().toString();
            this.updatedAt = createdAt;
        }

        private void apply(StatusUpdate update) {
            if (update != null) {
                if (update.getResultKey() != null) {
                    resultKey = update.getResultKey();
                }
                if (update.getErrorMessage() != null) {
                    errorMessage = update.getErrorMessage();
                }
                if (update.getCompletedAt() != null) {
                    completedAt = update.getCompletedAt();
                }
            }
            touch();
        }

        private void touch() {
            updatedAt = Instant.now().toString();
        }

        private DocumentStatusRecord snapshot() {
            return DocumentStatusRecord.builder()
                    .documentId(documentId)
                    .tenantId(tenantId)
                    .totalPages(totalPages.get())
                    .processedPages(processedPages.get())
                    .failedPages(failedPages.get())
                    .overallStatus(status.get())
                    .resultKey(resultKey)
                    .errorMessage(errorMessage)
                    .startedAt(createdAt)
                    .completedAt(completedAt)
                    .createdAt(createdAt)
                    .updatedAt(updatedAt)
                    .build();
        }
    }
}
