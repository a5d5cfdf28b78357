package com.example.templatefiller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/** Templates and filled documents in one S3-compatible bucket. */
@Slf4j
@Service
@RequiredArgsConstructor
public class S3DocumentStore implements TemplateSource, DocumentSink {

    public static final String DOCX_CONTENT_TYPE = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    private final S3Client s3;

    @Value("${storage.s3.endpoint}")
    private String endpoint;

    @Value("${storage.s3.bucket}")
    private String bucket;

    @Override
    public byte[] fetch(String key) {
        try {
            byte[] bytes = s3.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build()).asByteArray();
            log.debug("fetched template {} ({} bytes)", key, bytes.length);
            return bytes;
        } catch (NoSuchKeyException e) {
            throw new TemplateNotFoundException(key, e);
        } catch (S3Exception e) {
            if (e.statusCode() == 404) throw new TemplateNotFoundException(key, e);
            throw new StorageException("Failed to download " + key + ": " + e.getMessage(), e);
        } catch (SdkException e) {
            throw new StorageException("Failed to download " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String store(String key, byte[] document) {
        try {
            s3.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType(DOCX_CONTENT_TYPE)
                            .build(),
                    RequestBody.fromBytes(document));
        } catch (SdkException e) {
            throw new StorageException("Failed to upload to S3: " + e.getMessage(), e);
        }
        log.info("uploaded {} ({} bytes) to bucket {}", key, document.length, bucket);
        return endpoint + "/" + bucket + "/" + key;
    }
}
