package com.enterprise.orchestrator.service;

import com.enterprise.orchestrator.core.worker.ChunkWorker;
import com.enterprise.orchestrator.core.worker.ProcessingOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.kinesis.KinesisClient;
import software.amazon.awssdk.services.kinesis.model.ExpiredIteratorException;
import software.amazon.awssdk.services.kinesis.model.GetRecordsRequest;
import software.amazon.awssdk.services.kinesis.model.GetRecordsResponse;
import software.amazon.awssdk.services.kinesis.model.GetShardIteratorRequest;
import software.amazon.awssdk.services.kinesis.model.GetShardIteratorResponse;
import software.amazon.awssdk.services.kinesis.model.ListShardsRequest;
import software.amazon.awssdk.services.kinesis.model.ListShardsResponse;
import software.amazon.awssdk.services.kinesis.model.Record;
import software.amazon.awssdk.services.kinesis.model.Shard;
import software.amazon.awssdk.services.kinesis.model.ShardIteratorType;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KinesisDocumentConsumerTest {

    private static final String STREAM = "document-processing-stream";

    @Mock
    private KinesisClient kinesisClient;

    @Mock
    private ChunkWorker chunkWorker;

    private KinesisDocumentConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new KinesisDocumentConsumer(kinesisClient, new ObjectMapper(), chunkWorker, STREAM, true,
                delay -> { });
        lenient().when(kinesisClient.listShards(any(ListShardsRequest.class))).thenReturn(ListShardsResponse.builder()
                .shards(Shard.builder().shardId("shardId-000000000000").build())
                .build());
        lenient().when(kinesisClient.getShardIterator(any(GetShardIteratorRequest.class)))
                .thenReturn(GetShardIteratorResponse.builder().shardIterator("iterator-1").build());
    }

    @Test
    void testPollAllShards_DispatchesUploadEventsAndIgnoresOthers() {
        // Given
        when(kinesisClient.getRecords(any(GetRecordsRequest.class))).thenReturn(GetRecordsResponse.builder()
                .records(
                        record("1", uploadEvent("doc-1")),
                        record("2", "{\"eventType\":\"chunk.ready\",\"timestamp\":\"t\",\"data\":{\"documentId\":\"doc-1\"}}"),
                        record("3", "not json at all"))
                .nextShardIterator("iterator-2")
                .build());
        when(chunkWorker.processDocument("doc-1", "tenant-a", "tenant-a/doc-1/report.pdf"))
                .thenReturn(ProcessingOutcome.PAGES_DISPATCHED);

        // When
        int received = consumer.pollAllShards();

        // Then
        assertEquals(3, received);
        verify(chunkWorker, times(1)).processDocument(any(), any(), any());

        ArgumentCaptor<GetShardIteratorRequest> iteratorRequest = ArgumentCaptor.forClass(GetShardIteratorRequest.class);
        verify(kinesisClient).getShardIterator(iteratorRequest.capture());
        assertEquals(STREAM, iteratorRequest.getValue().streamName());
        assertEquals(ShardIteratorType.LATEST, iteratorRequest.getValue().shardIteratorType());

        ArgumentCaptor<GetRecordsRequest> recordsRequest = ArgumentCaptor.forClass(GetRecordsRequest.class);
        verify(kinesisClient).getRecords(recordsRequest.capture());
        assertEquals("iterator-1", recordsRequest.getValue().shardIterator());
        assertEquals(KinesisDocumentConsumer.BATCH_SIZE, recordsRequest.getValue().limit());
    }

    @Test
    void testPollAllShards_ContinuesFromNextIterator() {
        // Given
        when(kinesisClient.getRecords(any(GetRecordsRequest.class))).thenReturn(
                GetRecordsResponse.builder().records(List.of()).nextShardIterator("iterator-2").build(),
                GetRecordsResponse.builder().records(List.of()).nextShardIterator("iterator-3").build());

        // When
        consumer.pollAllShards();
        consumer.pollAllShards();

        // Then
        ArgumentCaptor<GetRecordsRequest> captor = ArgumentCaptor.forClass(GetRecordsRequest.class);
        verify(kinesisClient, times(2)).getRecords(captor.capture());
        assertEquals(List.of("iterator-1", "iterator-2"),
                captor.getAllValues().stream().map(GetRecordsRequest::shardIterator).collect(Collectors.toList()));
        verify(kinesisClient, times(1)).getShardIterator(any(GetShardIteratorRequest.class));
        verify(kinesisClient, times(1)).listShards(any(ListShardsRequest.class));
    }

    @Test
    void testPollAllShards_ExpiredIterator_IsReacquired() {
        // Given
        when(kinesisClient.getRecords(any(GetRecordsRequest.class)))
                .thenThrow(ExpiredIteratorException.builder().message("Iterator expired").build())
                .thenReturn(GetRecordsResponse.builder()
                        .records(record("1", uploadEvent("doc-1")))
                        .nextShardIterator("iterator-2")
                        .build());

        // When
        int first = consumer.pollAllShards();
        int second = consumer.pollAllShards();

        // Then
        assertEquals(0, first);
        assertEquals(1, second);
        verify(kinesisClient, times(2)).getShardIterator(any(GetShardIteratorRequest.class));
        verify(chunkWorker).processDocument("doc-1", "tenant-a", "tenant-a/doc-1/report.pdf");
    }

    @Test
    void testHandleRecord_WorkerFailureDoesNotEscape() {
        // Given
        when(chunkWorker.processDocument(any(), any(), any())).thenThrow(new IllegalStateException("store down"));

        // When & Then
        assertDoesNotThrow(() -> consumer.handleRecord("shardId-000000000000", record("1", uploadEvent("doc-1"))));
    }

    @Test
    void testStop_LetsRecordInProgressFinishWithoutInterrupt() throws Exception {
        // Given - the worker is busy with a document when shutdown begins
        KinesisDocumentConsumer liveConsumer = new KinesisDocumentConsumer(kinesisClient, new ObjectMapper(),
                chunkWorker, STREAM, true, delay -> Thread.sleep(10));
        when(kinesisClient.getRecords(any(GetRecordsRequest.class))).thenReturn(
                GetRecordsResponse.builder().records(record("1", uploadEvent("doc-1"))).nextShardIterator("iterator-2").build(),
                GetRecordsResponse.builder().records(List.of()).nextShardIterator("iterator-3").build());
        CountDownLatch processing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        when(chunkWorker.processDocument("doc-1", "tenant-a", "tenant-a/doc-1/report.pdf")).thenAnswer(inv -> {
            processing.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
                interrupted.set(Thread.currentThread().isInterrupted());
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
            return ProcessingOutcome.PAGES_DISPATCHED;
        });
        liveConsumer.start();
        assertTrue(processing.await(5, TimeUnit.SECONDS));

        // When
        Thread stopper = new Thread(liveConsumer::stop);
        stopper.start();
        long deadline = System.currentTimeMillis() + 2000;
        while (liveConsumer.isRunning() && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        release.countDown();
        stopper.join(10_000);

        // Then
        assertFalse(liveConsumer.isRunning());
        assertFalse(interrupted.get());
        verify(chunkWorker, times(1)).processDocument(any(), any(), any());
    }

    private static Record record(String sequence, String json) {
        return Record.builder()
                .sequenceNumber(sequence)
                .partitionKey("doc-1")
                .data(SdkBytes.fromUtf8String(json))
                .build();
    }

    private static String uploadEvent(String documentId) {
        return "{\"eventType\":\"document.uploaded\",\"timestamp\":\"2026-01-01T00:00:00Z\",\"data\":{"
                + "\"documentId\":\"" + documentId + "\",\"tenantId\":\"tenant-a\","
                + "\"blobKey\":\"tenant-a/" + documentId + "/report.pdf\","
                + "\"bucket\":\"document-orchestrator-pdfs\",\"fileName\":\"report.pdf\",\"size\":1024}}";
    }
}
