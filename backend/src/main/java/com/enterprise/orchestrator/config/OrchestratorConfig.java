package com.enterprise.orchestrator.config;

import com.enterprise.orchestrator.core.aggregate.Aggregator;
import com.enterprise.orchestrator.core.analysis.AnalysisClient;
import com.enterprise.orchestrator.core.analysis.RetryPolicy;
import com.enterprise.orchestrator.core.analysis.RetryingAnalyzer;
import com.enterprise.orchestrator.core.analysis.Sleeper;
import com.enterprise.orchestrator.core.blob.BlobStore;
import com.enterprise.orchestrator.core.blob.InMemoryBlobStore;
import com.enterprise.orchestrator.core.blob.S3BlobStore;
import com.enterprise.orchestrator.core.extract.PageExtractor;
import com.enterprise.orchestrator.core.extract.PdfBoxPageExtractor;
import com.enterprise.orchestrator.core.store.DynamoDbStatusStore;
import com.enterprise.orchestrator.core.store.InMemoryStatusStore;
import com.enterprise.orchestrator.core.store.StatusStore;
import com.enterprise.orchestrator.core.watch.CompletionWatcher;
import com.enterprise.orchestrator.core.worker.ChunkWorker;
import com.enterprise.orchestrator.core.worker.WorkerSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;

import java.time.Duration;

/**
 * Wires the framework-free coordination core into Spring.
 * <p>
 * {@code orchestrator.store=memory} swaps DynamoDB and S3 for process-local stores, for running the
 * service without AWS.
 */
@Slf4j
@Configuration
public class OrchestratorConfig {

    private static final String MEMORY_STORE = "memory";

    @Value("${orchestrator.store:dynamodb}")
    private String storeType;

    @Value("${aws.dynamodb.table-name}")
    private String tableName;

    @Value("${aws.s3.upload-bucket}")
    private String uploadBucket;

    @Value("${aws.s3.results-bucket}")
    private String resultsBucket;

    @Bean
    public StatusStore statusStore(DynamoDbClient dynamoDbClient, ObjectMapper objectMapper) {
        if (MEMORY_STORE.equalsIgnoreCase(storeType)) {
            log.warn("Using in-memory status store, state is lost on restart");
            return new InMemoryStatusStore();
        }
        log.info("Using DynamoDB status store: table={}", tableName);
        return new DynamoDbStatusStore(dynamoDbClient, tableName, objectMapper);
    }

    @Bean
    public BlobStore uploadBlobStore(S3Client s3Client) {
        return blobStore(s3Client, uploadBucket);
    }

    @Bean
    public BlobStore resultBlobStore(S3Client s3Client) {
        return blobStore(s3Client, resultsBucket);
    }

    @Bean
    public PageExtractor pageExtractor() {
        return new PdfBoxPageExtractor();
    }

    @Bean
    public RetryingAnalyzer retryingAnalyzer(
            AnalysisClient analysisClient,
            @Value("${orchestrator.analysis.max-attempts:3}") int maxAttempts,
            @Value("${orchestrator.analysis.base-delay:2s}") Duration baseDelay) {
        RetryPolicy policy = RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .build();
        return new RetryingAnalyzer(analysisClient, policy, Sleeper.SYSTEM);
    }

    @Bean(destroyMethod = "close")
    public ChunkWorker chunkWorker(
            StatusStore statusStore,
            @Qualifier("uploadBlobStore") BlobStore uploadBlobStore,
            PageExtractor pageExtractor,
            RetryingAnalyzer retryingAnalyzer,
            @Value("${orchestrator.worker.parallelism:1}") int parallelism,
            @Value("${orchestrator.worker.inter-page-delay:0s}") Duration interPageDelay,
            @Value("${orchestrator.worker.page-write-attempts:3}") int pageWriteAttempts,
            @Value("${orchestrator.worker.page-write-backoff:200ms}") Duration pageWriteBackoff) {
        WorkerSettings settings = WorkerSettings.builder()
                .parallelism(parallelism)
                .interPageDelay(interPageDelay)
                .pageWriteAttempts(pageWriteAttempts)
                .pageWriteBackoff(pageWriteBackoff)
                .build();
        log.info("Chunk worker configured: parallelism={}, interPageDelay={}ms",
                parallelism, interPageDelay.toMillis());
        return new ChunkWorker(statusStore, uploadBlobStore, pageExtractor, retryingAnalyzer, settings,
                Sleeper.SYSTEM);
    }

    @Bean
    public Aggregator aggregator(StatusStore statusStore,
                                 @Qualifier("resultBlobStore") BlobStore resultBlobStore,
                                 ObjectMapper objectMapper) {
        return new Aggregator(statusStore, resultBlobStore, objectMapper);
    }

    @Bean(destroyMethod = "close")
    public CompletionWatcher completionWatcher(
            StatusStore statusStore,
            Aggregator aggregator,
            @Value("${orchestrator.watcher.poll-interval:5s}") Duration pollInterval) {
        return new CompletionWatcher(statusStore, aggregator, pollInterval);
    }

    /**
     * Runs small documents in-process right after upload.
     */
    @Bean
    public ThreadPoolTaskExecutor documentWorkerExecutor(
            @Value("${orchestrator.worker.sync-pool-size:2}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("document-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    private BlobStore blobStore(S3Client s3Client, String bucket) {
        if (MEMORY_STORE.equalsIgnoreCase(storeType)) {
            return new InMemoryBlobStore(bucket);
        }
        return new S3BlobStore(s3Client, bucket);
    }
}
