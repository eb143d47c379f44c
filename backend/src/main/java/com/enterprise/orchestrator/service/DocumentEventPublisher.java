package com.enterprise.orchestrator.service;

import com.enterprise.orchestrator.core.exception.OrchestratorException;
import com.enterprise.orchestrator.core.model.DocumentSubmittedEvent;
import com.enterprise.orchestrator.model.EventEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.kinesis.KinesisClient;
import software.amazon.awssdk.services.kinesis.model.PutRecordRequest;
import software.amazon.awssdk.services.kinesis.model.PutRecordResponse;

import java.time.Instant;

/**
 * Producer side of the partitioned log: one {@code document.uploaded} record per submission,
 * keyed by document id so redeliveries of a document stay on one shard.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentEventPublisher {

    private final KinesisClient kinesisClient;
    private final ObjectMapper objectMapper;

    @Value("${aws.kinesis.stream-name}")
    private String streamName;

    public void publishDocumentSubmitted(DocumentSubmittedEvent event) {
        EventEnvelope envelope = EventEnvelope.builder()
                .eventType(DocumentSubmittedEvent.EVENT_TYPE)
                .timestamp(Instant.now().toString())
                .data(event)
                .build();

        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new OrchestratorException("Unable to serialise submission event", e);
        }

        try {
            PutRecordResponse response = kinesisClient.putRecord(PutRecordRequest.builder()
                    .streamName(streamName)
                    .partitionKey(event.getDocumentId())
                    .data(SdkBytes.fromByteArray(payload))
                    .build());
            log.info("Published {}: docId={}, shard={}, seq={}", DocumentSubmittedEvent.EVENT_TYPE,
                    event.getDocumentId(), response.shardId(), response.sequenceNumber());
        } catch (SdkException e) {
            log.error("Failed to publish submission event: docId={}", event.getDocumentId(), e);
            throw new OrchestratorException("Kinesis publish failed: " + e.getMessage(), e);
        }
    }
}
