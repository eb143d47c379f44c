package com.enterprise.orchestrator.core.store;

import com.enterprise.orchestrator.core.exception.AlreadyExistsException;
import com.enterprise.orchestrator.core.exception.DocumentNotFoundException;
import com.enterprise.orchestrator.core.exception.StoreUnavailableException;
import com.enterprise.orchestrator.core.model.AnalysisPayload;
import com.enterprise.orchestrator.core.model.DocumentStatusRecord;
import com.enterprise.orchestrator.core.model.FileRecord;
import com.enterprise.orchestrator.core.model.FileStatus;
import com.enterprise.orchestrator.core.model.OverallStatus;
import com.enterprise.orchestrator.core.model.PageOutcome;
import com.enterprise.orchestrator.core.model.PageRecord;
import com.enterprise.orchestrator.core.model.ProcessingMode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link StatusStore} over a single DynamoDB table, see {@link StatusKeys} for the key layout.
 */
@Slf4j
public class DynamoDbStatusStore implements StatusStore {

    private static final int DEFAULT_RETENTION_DAYS = 90;
    private static final int MAX_ERROR_LENGTH = 500;

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;
    private final ObjectMapper objectMapper;
    private final int retentionDays;

    public DynamoDbStatusStore(DynamoDbClient dynamoDbClient, String tableName, ObjectMapper objectMapper) {
        this(dynamoDbClient, tableName, objectMapper, DEFAULT_RETENTION_DAYS);
    }

    public DynamoDbStatusStore(DynamoDbClient dynamoDbClient, String tableName,
                               ObjectMapper objectMapper, int retentionDays) {
        this.dynamoDbClient = dynamoDbClient;
        this.tableName = tableName;
        this.objectMapper = objectMapper;
        this.retentionDays = retentionDays;
    }

    // ─── file metadata ──────────────────────────────────────────────────────

    @Override
    public void saveFile(FileRecord record) {
        String now = Instant.now().toString();
        String uploadedAt = record.getUploadedAt() != null ? record.getUploadedAt() : now;

        Map<String, AttributeValue> item = new HashMap<>(StatusKeys.file(record.getDocumentId()));
        item.put(StatusKeys.GSI1_PK, attr(StatusKeys.tenantFilesGsiPk(record.getTenantId())));
        item.put(StatusKeys.GSI1_SK, attr("FILE#" + uploadedAt));
        item.put("documentId", attr(record.getDocumentId()));
        item.put("tenantId", attr(record.getTenantId()));
        item.put("fileName", attr(record.getFileName()));
        item.put("fileSize", num(record.getFileSize()));
        item.put("mimeType", attr(record.getMimeType()));
        item.put("bucket", attr(record.getBucket()));
        item.put("blobKey", attr(record.getBlobKey()));
        item.put("processingType", attr(record.getProcessingMode() != null
                ? record.getProcessingMode().value() : ProcessingMode.SYNC.value()));
        item.put("status", attr(record.getStatus() != null
                ? record.getStatus().value() : FileStatus.UPLOADED.value()));
        item.put("uploadedAt", attr(uploadedAt));
        item.put("updatedAt", attr(now));
        item.put("ttl", num(StatusKeys.ttl(retentionDays)));

        execute("saveFile", () -> dynamoDbClient.putItem(PutItemRequest.builder()
                .tableName(tableName)
                .item(item)
                .build()));
        log.info("Saved file record: docId={}, tenantId={}, file={}",
                record.getDocumentId(), record.getTenantId(), record.getFileName());
    }

    @Override
    public Optional<FileRecord> getFile(String documentId) {
        GetItemResponse response = execute("getFile", () -> dynamoDbClient.getItem(GetItemRequest.builder()
                .tableName(tableName)
                .key(StatusKeys.file(documentId))
                .build()));

        if (!response.hasItem() || response.item().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapToFile(response.item()));
    }

    @Override
    public boolean updateFileStatus(String documentId, FileStatus status, String errorMessage) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":status", attr(status.value()));
        values.put(":updatedAt", attr(Instant.now().toString()));

        StringBuilder expr = new StringBuilder("SET #st = :status, updatedAt = :updatedAt");
        if (errorMessage != null) {
            values.put(":errMsg", attr(truncate(errorMessage)));
            expr.append(", errorMessage = :errMsg");
        }

        try {
            execute("updateFileStatus", () -> dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(StatusKeys.file(documentId))
                    .updateExpression(expr.toString())
                    .conditionExpression("attribute_exists(PK)")
                    .expressionAttributeNames(Map.of("#st", "status"))
                    .expressionAttributeValues(values)
                    .build()));
            return true;
        } catch (ConditionalCheckFailedException e) {
            log.debug("No file record to update: docId={}", documentId);
            return false;
        }
    }

    // ─── document status ────────────────────────────────────────────────────

    @Override
    public DocumentStatusRecord createStatus(String documentId, String tenantId) {
        String now = Instant.now().toString();
        Map<String, AttributeValue> item = new HashMap<>(StatusKeys.documentStatus(documentId));
        item.put(StatusKeys.GSI1_PK, attr(StatusKeys.tenantStatusGsiPk(tenantId)));
        item.put(StatusKeys.GSI1_SK, attr(now));
        item.put("documentId", attr(documentId));
        item.put("tenantId", attr(tenantId));
        item.put("overallStatus", attr(OverallStatus.PENDING.value()));
        item.put("totalPages", num(0));
        item.put("processedPages", num(0));
        item.put("failedPages", num(0));
        item.put("startedAt", attr(now));
        item.put("createdAt", attr(now));
        item.put("updatedAt", attr(now));
        item.put("ttl", num(StatusKeys.ttl(retentionDays)));

        try {
            execute("createStatus", () -> dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(tableName)
                    .item(item)
                    .conditionExpression("attribute_not_exists(PK)")
                    .build()));
        } catch (ConditionalCheckFailedException e) {
            throw new AlreadyExistsException(documentId);
        }

        log.info("Created status record: docId={}, tenantId={}", documentId, tenantId);
        return mapToStatus(item);
    }

    @Override
    public Optional<DocumentStatusRecord> getDocument(String documentId) {
        GetItemResponse response = execute("getDocument", () -> dynamoDbClient.getItem(GetItemRequest.builder()
                .tableName(tableName)
                .key(StatusKeys.documentStatus(documentId))
                .consistentRead(true)
                .build()));

        if (!response.hasItem() || response.item().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapToStatus(response.item()));
    }

    @Override
    public void setTotalPages(String documentId, int totalPages) {
        try {
            execute("setTotalPages", () -> dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(StatusKeys.documentStatus(documentId))
                    .updateExpression("SET totalPages = :totalPages, updatedAt = :updatedAt")
                    .conditionExpression("attribute_exists(PK)")
                    .expressionAttributeValues(Map.of(
                            ":totalPages", num(totalPages),
                            ":updatedAt", attr(Instant.now().toString())))
                    .build()));
        } catch (ConditionalCheckFailedException e) {
            throw new DocumentNotFoundException(documentId);
        }
        log.info("Set total pages: docId={}, totalPages={}", documentId, totalPages);
    }

    @Override
    public int incrementProcessed(String documentId) {
        return increment(documentId, "processedPages");
    }

    @Override
    public int incrementFailed(String documentId) {
        return increment(documentId, "failedPages");
    }

    private int increment(String documentId, String counter) {
        UpdateItemResponse response;
        try {
            response = execute("increment " + counter, () -> dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(StatusKeys.documentStatus(documentId))
                    .updateExpression("SET #c = if_not_exists(#c, :zero) + :inc, updatedAt = :updatedAt")
                    .conditionExpression("attribute_exists(PK)")
                    .expressionAttributeNames(Map.of("#c", counter))
                    .expressionAttributeValues(Map.of(
                            ":zero", num(0),
                            ":inc", num(1),
                            ":updatedAt", attr(Instant.now().toString())))
                    .returnValues(ReturnValue.UPDATED_NEW)
                    .build()));
        } catch (ConditionalCheckFailedException e) {
            throw new DocumentNotFoundException(documentId);
        }
        return intValue(response.attributes(), counter);
    }

    @Override
    public void updateOverallStatus(String documentId, OverallStatus status, StatusUpdate update) {
        UpdateItemRequest request = statusUpdateRequest(documentId, status, update, null);
        execute("updateOverallStatus", () -> dynamoDbClient.updateItem(request));
        log.info("Updated overall status: docId={}, status={}", documentId, status.value());
    }

    @Override
    public boolean compareAndSetStatus(String documentId, OverallStatus expected, OverallStatus next,
                                       StatusUpdate update) {
        UpdateItemRequest request = statusUpdateRequest(documentId, next, update, expected);
        try {
            execute("compareAndSetStatus", () -> dynamoDbClient.updateItem(request));
        } catch (ConditionalCheckFailedException e) {
            log.debug("Status transition rejected: docId={}, expected={}, next={}",
                    documentId, expected.value(), next.value());
            return false;
        }
        log.info("Status transition: docId={}, {} -> {}", documentId, expected.value(), next.value());
        return true;
    }

    private UpdateItemRequest statusUpdateRequest(String documentId, OverallStatus status,
                                                  StatusUpdate update, OverallStatus expected) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":status", attr(status.value()));
        values.put(":updatedAt", attr(Instant.now().toString()));

        StringBuilder expr = new StringBuilder("SET overallStatus = :status, updatedAt = :updatedAt");
        StatusUpdate extra = update != null ? update : StatusUpdate.none();
        if (extra.getResultKey() != null) {
            values.put(":resultKey", attr(extra.getResultKey()));
            expr.append(", resultKey = :resultKey");
        }
        if (extra.getErrorMessage() != null) {
            values.put(":errMsg", attr(truncate(extra.getErrorMessage())));
            expr.append(", errorMessage = :errMsg");
        }
        if (extra.getCompletedAt() != null) {
            values.put(":completedAt", attr(extra.getCompletedAt()));
            expr.append(", completedAt = :completedAt");
        }

        UpdateItemRequest.Builder builder = UpdateItemRequest.builder()
                .tableName(tableName)
                .key(StatusKeys.documentStatus(documentId))
                .updateExpression(expr.toString());
        if (expected != null) {
            values.put(":expected", attr(expected.value()));
            builder.conditionExpression("overallStatus = :expected");
        } else {
            builder.conditionExpression("attribute_exists(PK)");
        }
        return builder.expressionAttributeValues(values).build();
    }

    @Override
    public List<DocumentStatusRecord> listDocumentsByTenant(String tenantId, int limit) {
        QueryResponse response = execute("listDocumentsByTenant", () -> dynamoDbClient.query(QueryRequest.builder()
                .tableName(tableName)
                .indexName(StatusKeys.GSI1)
                .keyConditionExpression("GSI1PK = :gsi1pk")
                .expressionAttributeValues(Map.of(":gsi1pk", attr(StatusKeys.tenantStatusGsiPk(tenantId))))
                .scanIndexForward(false)
                .limit(limit)
                .build()));

        return response.items().stream().map(this::mapToStatus).collect(Collectors.toList());
    }

    @Override
    public List<DocumentStatusRecord> scanReadyForAggregation() {
        List<DocumentStatusRecord> ready = new ArrayList<>();
        Map<String, AttributeValue> startKey = null;
        do {
            ScanRequest.Builder request = ScanRequest.builder()
                    .tableName(tableName)
                    .filterExpression("SK = :sk AND overallStatus = :status "
                            + "AND processedPages = totalPages AND totalPages > :zero")
                    .expressionAttributeValues(Map.of(
                            ":sk", attr(StatusKeys.STATUS_SK),
                            ":status", attr(OverallStatus.PROCESSING.value()),
                            ":zero", num(0)));
            if (startKey != null) {
                request.exclusiveStartKey(startKey);
            }
            ScanResponse response = execute("scanReadyForAggregation", () -> dynamoDbClient.scan(request.build()));
            response.items().forEach(item -> ready.add(mapToStatus(item)));
            startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                    ? response.lastEvaluatedKey() : null;
        } while (startKey != null);
        return ready;
    }

    @Override
    public boolean resetForReprocessing(String documentId) {
        try {
            execute("resetForReprocessing", () -> dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(StatusKeys.documentStatus(documentId))
                    .updateExpression("SET overallStatus = :pending, totalPages = :zero, processedPages = :zero, "
                            + "failedPages = :zero, updatedAt = :updatedAt "
                            + "REMOVE resultKey, errorMessage, completedAt")
                    .conditionExpression("overallStatus IN (:completed, :failed)")
                    .expressionAttributeValues(Map.of(
                            ":pending", attr(OverallStatus.PENDING.value()),
                            ":completed", attr(OverallStatus.COMPLETED.value()),
                            ":failed", attr(OverallStatus.FAILED.value()),
                            ":zero", num(0),
                            ":updatedAt", attr(Instant.now().toString())))
                    .build()));
        } catch (ConditionalCheckFailedException e) {
            log.warn("Reset rejected, document missing or not terminal: docId={}", documentId);
            return false;
        }

        List<PageRecord> pages = getPages(documentId);
        for (PageRecord page : pages) {
            execute("deletePage", () -> dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                    .tableName(tableName)
                    .key(StatusKeys.page(documentId, page.getPageNumber()))
                    .build()));
        }
        log.info("Reset document for reprocessing: docId={}, deletedPages={}", documentId, pages.size());
        return true;
    }

    // ─── pages ──────────────────────────────────────────────────────────────

    @Override
    public void recordPage(String documentId, String tenantId, int pageNumber, PageOutcome outcome) {
        String now = Instant.now().toString();
        Map<String, AttributeValue> item = new HashMap<>(StatusKeys.page(documentId, pageNumber));
        item.put("documentId", attr(documentId));
        item.put("tenantId", attr(tenantId));
        item.put("pageNumber", num(pageNumber));
        item.put("createdAt", attr(now));
        item.put("updatedAt", attr(now));
        item.put("ttl", num(StatusKeys.ttl(retentionDays)));

        if (outcome.isSuccess()) {
            item.put("outcome", attr("success"));
            item.put("pageAnalysis", attr(toJson(outcome.getPayload())));
        } else {
            item.put("outcome", attr("failure"));
            item.put("failureReason", attr(truncate(outcome.getReason())));
            item.put("failedAt", attr(outcome.getFailedAt()));
        }

        execute("recordPage", () -> dynamoDbClient.putItem(PutItemRequest.builder()
                .tableName(tableName)
                .item(item)
                .build()));
        log.debug("Recorded page: docId={}, page={}, success={}", documentId, pageNumber, outcome.isSuccess());
    }

    @Override
    public List<PageRecord> getPages(String documentId) {
        List<PageRecord> pages = new ArrayList<>();
        Map<String, AttributeValue> startKey = null;
        do {
            QueryRequest.Builder request = QueryRequest.builder()
                    .tableName(tableName)
                    .keyConditionExpression("PK = :pk AND begins_with(SK, :sk)")
                    .expressionAttributeValues(Map.of(
                            ":pk", attr(StatusKeys.documentPk(documentId)),
                            ":sk", attr(StatusKeys.PAGE_SK_PREFIX)))
                    .consistentRead(true);
            if (startKey != null) {
                request.exclusiveStartKey(startKey);
            }
            QueryResponse response = execute("getPages", () -> dynamoDbClient.query(request.build()));
            response.items().forEach(item -> pages.add(mapToPage(item)));
            startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                    ? response.lastEvaluatedKey() : null;
        } while (startKey != null);

        pages.sort(Comparator.comparingInt(PageRecord::getPageNumber));
        return pages;
    }

    // ─── helpers ────────────────────────────────────────────────────────────

    private <T> T execute(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (ProvisionedThroughputExceededException | RequestLimitExceededException e) {
            throw new StoreUnavailableException("Status store throttled during " + operation, e);
        } catch (DynamoDbException e) {
            if (e.statusCode() >= 500) {
                throw new StoreUnavailableException("Status store failed during " + operation, e);
            }
            throw e;
        } catch (SdkClientException e) {
            throw new StoreUnavailableException("Status store unreachable during " + operation, e);
        }
    }

    private String toJson(AnalysisPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialise page analysis", e);
        }
    }

    private AnalysisPayload fromJson(String json) {
        try {
            return objectMapper.readValue(json, AnalysisPayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored page analysis is not valid JSON", e);
        }
    }

    private AttributeValue attr(String value) {
        return AttributeValue.builder().s(value == null ? "" : value).build();
    }

    private AttributeValue num(long value) {
        return AttributeValue.builder().n(Long.toString(value)).build();
    }

    private String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }

    private FileRecord mapToFile(Map<String, AttributeValue> item) {
        return FileRecord.builder()
                .documentId(str(item, "documentId"))
                .tenantId(str(item, "tenantId"))
                .fileName(str(item, "fileName"))
                .fileSize(longValue(item, "fileSize"))
                .mimeType(str(item, "mimeType"))
                .bucket(str(item, "bucket"))
                .blobKey(str(item, "blobKey"))
                .processingMode(ProcessingMode.fromValue(str(item, "processingType")))
                .status(FileStatus.fromValue(str(item, "status")))
                .errorMessage(str(item, "errorMessage"))
                .uploadedAt(str(item, "uploadedAt"))
                .updatedAt(str(item, "updatedAt"))
                .build();
    }

    private DocumentStatusRecord mapToStatus(Map<String, AttributeValue> item) {
        return DocumentStatusRecord.builder()
                .documentId(str(item, "documentId"))
                .tenantId(str(item, "tenantId"))
                .totalPages(intValue(item, "totalPages"))
                .processedPages(intValue(item, "processedPages"))
                .failedPages(intValue(item, "failedPages"))
                .overallStatus(OverallStatus.fromValue(str(item, "overallStatus")))
                .resultKey(str(item, "resultKey"))
                .errorMessage(str(item, "errorMessage"))
                .startedAt(str(item, "startedAt"))
                .completedAt(str(item, "completedAt"))
                .createdAt(str(item, "createdAt"))
                .updatedAt(str(item, "updatedAt"))
                .build();
    }

    private PageRecord mapToPage(Map<String, AttributeValue> item) {
        PageOutcome outcome = "success".equals(str(item, "outcome"))
                ? PageOutcome.success(fromJson(str(item, "pageAnalysis")))
                : PageOutcome.failure(str(item, "failureReason"), str(item, "failedAt"));
        return PageRecord.builder()
                .documentId(str(item, "documentId"))
                .tenantId(str(item, "tenantId"))
                .pageNumber(intValue(item, "pageNumber"))
                .outcome(outcome)
                .updatedAt(str(item, "updatedAt"))
                .build();
    }

    private String str(Map<String, AttributeValue> item, String key) {
        AttributeValue v = item.get(key);
        return (v != null && v.s() != null && !v.s().isEmpty()) ? v.s() : null;
    }

    private int intValue(Map<String, AttributeValue> item, String key) {
        return (int) longValue(item, key);
    }

    private long longValue(Map<String, AttributeValue> item, String key) {
        AttributeValue v = item.get(key);
        return (v != null && v.n() != null) ? Long.parseLong(v.n()) : 0L;
    }
}
