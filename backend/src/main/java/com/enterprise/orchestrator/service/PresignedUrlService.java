package com.enterprise.orchestrator.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

import java.time.Duration;

@Slf4j
@Service
@RequiredArgsConstructor
public class PresignedUrlService {

    public static final Duration DOWNLOAD_LINK_TTL = Duration.ofHours(1);

    private final S3Presigner s3Presigner;

    /**
     * Time-limited GET link for a result object.
     */
    public String downloadLink(String bucket, String key) {
        GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                .signatureDuration(DOWNLOAD_LINK_TTL)
                .getObjectRequest(r -> r.bucket(bucket).key(key))
                .build();
        PresignedGetObjectRequest presigned = s3Presigner.presignGetObject(presignRequest);
        log.debug("Presigned download link: s3://{}/{}", bucket, key);
        return presigned.url().toString();
    }
}
