package com.enterprise.orchestrator.core.blob;

import com.enterprise.orchestrator.core.exception.BlobUnavailableException;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

@Slf4j
public class S3BlobStore implements BlobStore {

    private final S3Client s3Client;
    private final String bucket;

    public S3BlobStore(S3Client s3Client, String bucket) {
        this.s3Client = s3Client;
        this.bucket = bucket;
    }

    @Override
    public void put(String key, byte[] data, String contentType) {
        log.info("Uploading {} bytes to s3://{}/{}", data.length, bucket, key);
        try {
            s3Client.putObject(
                    PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType(contentType)
                            .build(),
                    RequestBody.fromBytes(data));
        } catch (SdkException e) {
            throw new BlobUnavailableException("Failed to write s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public byte[] get(String key) {
        log.info("Downloading s3://{}/{}", bucket, key);
        try {
            return s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build()).asByteArray();
        } catch (NoSuchKeyException e) {
            throw new BlobUnavailableException("Object not found: s3://" + bucket + "/" + key, e);
        } catch (SdkException e) {
            throw new BlobUnavailableException("Failed to read s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw new BlobUnavailableException("Failed to check s3://" + bucket + "/" + key, e);
        } catch (SdkException e) {
            throw new BlobUnavailableException("Failed to check s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
        } catch (SdkException e) {
            throw new BlobUnavailableException("Failed to delete s3://" + bucket + "/" + key, e);
        }
        log.info("Deleted s3://{}/{}", bucket, key);
    }

    @Override
    public String bucket() {
        return bucket;
    }
}
