package com.enterprise.orchestrator.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.DynamodbEvent;
import com.enterprise.orchestrator.core.aggregate.Aggregator;
import com.enterprise.orchestrator.core.blob.S3BlobStore;
import com.enterprise.orchestrator.core.exception.BlobUnavailableException;
import com.enterprise.orchestrator.core.exception.OrchestratorException;
import com.enterprise.orchestrator.core.exception.StoreUnavailableException;
import com.enterprise.orchestrator.core.store.DynamoDbStatusStore;
import com.enterprise.orchestrator.core.watch.CompletionWatcher;
import com.enterprise.orchestrator.core.watch.StatusChange;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;

import java.time.Duration;

/**
 * Lambda handler subscribed to the orchestrator table's DynamoDB Stream.
 *
 * Workflow:
 * 1. Decode each stream record into before/after status images
 * 2. Skip everything except document status rows whose page counter just reached the total
 * 3. Hand ready documents to the aggregator, which writes the manifest and completes the document
 *
 * A store or bucket outage on any record fails the invocation once the whole batch has been tried,
 * so the stream redelivers it. Records that were already aggregated are skipped on the retry.
 */
public class AggregatorLambdaHandler implements RequestHandler<DynamodbEvent, String> {

    private static final Logger log = LoggerFactory.getLogger(AggregatorLambdaHandler.class);

    private static final String RESULTS_BUCKET = System.getenv("RESULTS_BUCKET");
    private static final String DYNAMODB_TABLE = System.getenv("DYNAMODB_TABLE");
    private static final String AWS_REGION_NAME = System.getenv("AWS_REGION_NAME") != null
            ? System.getenv("AWS_REGION_NAME")
            : "us-east-1";

    private final CompletionWatcher completionWatcher;

    public AggregatorLambdaHandler() {
        this(Clients.WATCHER);
    }

    AggregatorLambdaHandler(CompletionWatcher completionWatcher) {
        this.completionWatcher = completionWatcher;
    }

    @Override
    public String handleRequest(DynamodbEvent event, Context context) {
        log.info("Received stream batch with {} records", event.getRecords().size());

        int triggered = 0;
        int failed = 0;
        OrchestratorException retryable = null;
        for (DynamodbEvent.DynamodbStreamRecord record : event.getRecords()) {
            try {
                StatusChange change = StreamRecordMapper.toStatusChange(record);
                if (completionWatcher.onChange(change)) {
                    triggered++;
                }
            } catch (StoreUnavailableException | BlobUnavailableException e) {
                failed++;
                log.error("Stream record hit an unavailable dependency, batch will be retried: eventId={}",
                        record.getEventID(), e);
                if (retryable == null) {
                    retryable = e;
                } else {
                    retryable.addSuppressed(e);
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to handle stream record: eventId={}", record.getEventID(), e);
            }
        }

        log.info("Stream batch done: triggered={}, failed={}", triggered, failed);
        if (retryable != null) {
            throw retryable;
        }
        return "OK";
    }

    // SDK clients built once per container, on first use, for warm-start reuse
    private static final class Clients {
        private static final CompletionWatcher WATCHER = build();

        private static CompletionWatcher build() {
            Region region = Region.of(AWS_REGION_NAME);
            DynamoDbClient dynamoDbClient = DynamoDbClient.builder().region(region).build();
            S3Client s3Client = S3Client.builder().region(region).build();
            ObjectMapper objectMapper = new ObjectMapper();

            DynamoDbStatusStore statusStore = new DynamoDbStatusStore(dynamoDbClient, DYNAMODB_TABLE, objectMapper);
            Aggregator aggregator = new Aggregator(statusStore, new S3BlobStore(s3Client, RESULTS_BUCKET), objectMapper);
            // the Lambda is push-only; the poll interval is never used
            return new CompletionWatcher(statusStore, aggregator, Duration.ofSeconds(5));
        }
    }
}
