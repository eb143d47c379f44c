package com.enterprise.orchestrator.service;

import com.enterprise.orchestrator.core.analysis.Sleeper;
import com.enterprise.orchestrator.core.model.DocumentSubmittedEvent;
import com.enterprise.orchestrator.core.worker.ChunkWorker;
import com.enterprise.orchestrator.model.EventEnvelope;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.kinesis.KinesisClient;
import software.amazon.awssdk.services.kinesis.model.ExpiredIteratorException;
import software.amazon.awssdk.services.kinesis.model.GetRecordsRequest;
import software.amazon.awssdk.services.kinesis.model.GetRecordsResponse;
import software.amazon.awssdk.services.kinesis.model.GetShardIteratorRequest;
import software.amazon.awssdk.services.kinesis.model.ListShardsRequest;
import software.amazon.awssdk.services.kinesis.model.ListShardsResponse;
import software.amazon.awssdk.services.kinesis.model.Record;
import software.amazon.awssdk.services.kinesis.model.Shard;
import software.amazon.awssdk.services.kinesis.model.ShardIteratorType;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consumer side of the partitioned log. Polls every shard of the stream with
 * {@code GetShardIterator}/{@code GetRecords} and hands each {@code document.uploaded} event to the
 * {@link ChunkWorker}. Records within a shard are handled one at a time, in order.
 */
@Slf4j
@Service
public class KinesisDocumentConsumer implements SmartLifecycle {

    static final int BATCH_SIZE = 10;
    static final Duration IDLE_PAUSE = Duration.ofSeconds(2);
    static final Duration ERROR_PAUSE = Duration.ofSeconds(5);

    private final KinesisClient kinesisClient;
    private final ObjectMapper objectMapper;
    private final ChunkWorker chunkWorker;
    private final String streamName;
    private final boolean enabled;
    private final Sleeper sleeper;

    // shardId -> next iterator; absent means "acquire a fresh one"
    private final Map<String, String> iterators = new LinkedHashMap<>();

    private volatile boolean running;
    private Thread pollThread;

    // guards idle; the poll thread is only interrupted while it is idle between polls
    private final Object pauseLock = new Object();
    private boolean idle;

    @Autowired
    public KinesisDocumentConsumer(KinesisClient kinesisClient,
                                   ObjectMapper objectMapper,
                                   ChunkWorker chunkWorker,
                                   @Value("${aws.kinesis.stream-name}") String streamName,
                                   @Value("${orchestrator.consumer.enabled:true}") boolean enabled) {
        this(kinesisClient, objectMapper, chunkWorker, streamName, enabled, Sleeper.SYSTEM);
    }

    KinesisDocumentConsumer(KinesisClient kinesisClient, ObjectMapper objectMapper, ChunkWorker chunkWorker,
                            String streamName, boolean enabled, Sleeper sleeper) {
        this.kinesisClient = kinesisClient;
        this.objectMapper = objectMapper;
        this.chunkWorker = chunkWorker;
        this.streamName = streamName;
        this.enabled = enabled;
        this.sleeper = sleeper;
    }

    // ─── lifecycle ──────────────────────────────────────────────────────────

    @Override
    public synchronized void start() {
        if (!enabled) {
            log.info("Kinesis consumer disabled");
            return;
        }
        if (running) {
            return;
        }
        running = true;
        pollThread = new Thread(this::pollLoop, "kinesis-consumer");
        pollThread.setDaemon(true);
        pollThread.start();
        log.info("Kinesis consumer started: stream={}", streamName);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        synchronized (pauseLock) {
            running = false;
            if (idle) {
                pollThread.interrupt();
            }
        }
        try {
            pollThread.join(ERROR_PAUSE.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (pollThread.isAlive()) {
            log.info("Kinesis consumer stopping, current record still in progress: stream={}", streamName);
        } else {
            log.info("Kinesis consumer stopped: stream={}", streamName);
        }
        pollThread = null;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ─── polling ────────────────────────────────────────────────────────────

    private void pollLoop() {
        while (running) {
            Duration pause;
            try {
                pause = pollAllShards() == 0 ? IDLE_PAUSE : Duration.ZERO;
            } catch (RuntimeException e) {
                log.error("Error polling stream: stream={}", streamName, e);
                pause = ERROR_PAUSE;
            }
            if (!pause.isZero() && !pauseFor(pause)) {
                return;
            }
        }
    }

    /**
     * One pass over every known shard.
     *
     * @return number of records received
     */
    int pollAllShards() {
        if (iterators.isEmpty()) {
            for (String shardId : listShardIds()) {
                iterators.put(shardId, null);
            }
            log.info("Consuming {} shard(s): stream={}", iterators.size(), streamName);
        }
        int received = 0;
        for (String shardId : new ArrayList<>(iterators.keySet())) {
            received += pollShard(shardId);
        }
        return received;
    }

    private int pollShard(String shardId) {
        String iterator = iterators.get(shardId);
        if (iterator == null) {
            iterator = acquireIterator(shardId);
        }

        GetRecordsResponse response;
        try {
            response = kinesisClient.getRecords(GetRecordsRequest.builder()
                    .shardIterator(iterator)
                    .limit(BATCH_SIZE)
                    .build());
        } catch (ExpiredIteratorException e) {
            log.warn("Shard iterator expired, re-acquiring: shard={}", shardId);
            iterators.put(shardId, null);
            return 0;
        }

        if (response.nextShardIterator() == null) {
            log.info("Shard closed: shard={}", shardId);
            iterators.remove(shardId);
        } else {
            iterators.put(shardId, response.nextShardIterator());
        }

        for (Record record : response.records()) {
            handleRecord(shardId, record);
        }
        return response.records().size();
    }

    void handleRecord(String shardId, Record record) {
        EventEnvelope envelope;
        try {
            envelope = objectMapper.readValue(record.data().asByteArray(), EventEnvelope.class);
        } catch (IOException e) {
            log.error("Discarding unreadable record: shard={}, seq={}", shardId, record.sequenceNumber(), e);
            return;
        }

        if (!DocumentSubmittedEvent.EVENT_TYPE.equals(envelope.getEventType()) || envelope.getData() == null) {
            log.debug("Ignoring event: type={}, seq={}", envelope.getEventType(), record.sequenceNumber());
            return;
        }

        DocumentSubmittedEvent event = envelope.getData();
        log.info("Received {}: docId={}, tenantId={}", envelope.getEventType(),
                event.getDocumentId(), event.getTenantId());
        try {
            chunkWorker.processDocument(event.getDocumentId(), event.getTenantId(), event.getBlobKey());
        } catch (RuntimeException e) {
            // the record is not redelivered by this loop, so the failure is only logged
            log.error("Processing failed for event: docId={}", event.getDocumentId(), e);
        }
    }

    private List<String> listShardIds() {
        List<String> shardIds = new ArrayList<>();
        String nextToken = null;
        do {
            ListShardsRequest.Builder request = ListShardsRequest.builder();
            if (nextToken == null) {
                request.streamName(streamName);
            } else {
                request.nextToken(nextToken);
            }
            ListShardsResponse response = kinesisClient.listShards(request.build());
            response.shards().stream().map(Shard::shardId).forEach(shardIds::add);
            nextToken = response.nextToken();
        } while (nextToken != null);
        return shardIds;
    }

    private String acquireIterator(String shardId) {
        String iterator = kinesisClient.getShardIterator(GetShardIteratorRequest.builder()
                .streamName(streamName)
                .shardId(shardId)
                .shardIteratorType(ShardIteratorType.LATEST)
                .build()).shardIterator();
        iterators.put(shardId, iterator);
        return iterator;
    }

    /**
     * @return false once the consumer has been stopped
     */
    private boolean pauseFor(Duration pause) {
        synchronized (pauseLock) {
            if (!running) {
                return false;
            }
            idle = true;
        }
        try {
            sleeper.sleep(pause);
            return running;
        } catch (InterruptedException e) {
            // only stop() interrupts, and only while idle
            return false;
        } finally {
            synchronized (pauseLock) {
                idle = false;
            }
        }
    }
}
