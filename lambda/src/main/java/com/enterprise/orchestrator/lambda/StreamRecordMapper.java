package com.enterprise.orchestrator.lambda;

import com.amazonaws.services.lambda.runtime.events.DynamodbEvent;
import com.amazonaws.services.lambda.runtime.events.models.dynamodb.AttributeValue;
import com.amazonaws.services.lambda.runtime.events.models.dynamodb.StreamRecord;
import com.enterprise.orchestrator.core.model.DocumentStatusRecord;
import com.enterprise.orchestrator.core.model.OverallStatus;
import com.enterprise.orchestrator.core.store.StatusKeys;
import com.enterprise.orchestrator.core.watch.StatusChange;

import java.util.Map;

/**
 * Converts DynamoDB Stream records into {@link StatusChange}s. Images are only decoded for
 * document status rows; file and page rows keep just their sort key.
 */
final class StreamRecordMapper {

    private StreamRecordMapper() {
    }

    static StatusChange toStatusChange(DynamodbEvent.DynamodbStreamRecord record) {
        StreamRecord stream = record.getDynamodb();
        String sortKey = stream == null ? null : sortKey(stream);

        StatusChange.StatusChangeBuilder change = StatusChange.builder()
                .eventName(record.getEventName())
                .sortKey(sortKey);
        if (StatusKeys.STATUS_SK.equals(sortKey)) {
            change.before(toStatus(stream.getOldImage()))
                    .after(toStatus(stream.getNewImage()));
        }
        return change.build();
    }

    static DocumentStatusRecord toStatus(Map<String, AttributeValue> image) {
        if (image == null || image.isEmpty()) {
            return null;
        }
        String status = str(image, "overallStatus");
        return DocumentStatusRecord.builder()
                .documentId(str(image, "documentId"))
                .tenantId(str(image, "tenantId"))
                .totalPages(num(image, "totalPages"))
                .processedPages(num(image, "processedPages"))
                .failedPages(num(image, "failedPages"))
                .overallStatus(status == null ? null : OverallStatus.fromValue(status))
                .resultKey(str(image, "resultKey"))
                .errorMessage(str(image, "errorMessage"))
                .startedAt(str(image, "startedAt"))
                .completedAt(str(image, "completedAt"))
                .createdAt(str(image, "createdAt"))
                .updatedAt(str(image, "updatedAt"))
                .build();
    }

    // ─── helpers ────────────────────────────────────────────────────────────

    private static String sortKey(StreamRecord stream) {
        String fromKeys = str(stream.getKeys(), StatusKeys.SK);
        return fromKeys != null ? fromKeys : str(stream.getNewImage(), StatusKeys.SK);
    }

    private static String str(Map<String, AttributeValue> image, String name) {
        if (image == null) {
            return null;
        }
        AttributeValue value = image.get(name);
        return value == null ? null : value.getS();
    }

    private static int num(Map<String, AttributeValue> image, String name) {
        AttributeValue value = image.get(name);
        return value == null || value.getN() == null ? 0 : Integer.parseInt(value.getN());
    }
}
